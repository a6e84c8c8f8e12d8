package io.github.eutro.livevars.core.passes.meta;

import io.github.eutro.livevars.core.ext.CommonExts;
import io.github.eutro.livevars.core.ext.MetadataState;
import io.github.eutro.livevars.core.passes.InPlaceIRPass;
import io.github.eutro.livevars.core.ssa.BasicBlock;
import io.github.eutro.livevars.core.ssa.Function;
import io.github.eutro.livevars.core.ssa.MalformedIRException;

import java.util.ArrayList;

/**
 * Computes {@link CommonExts#PREDS} for each block.
 * <p>
 * A block appears once in the predecessors of a target for every edge to it.
 */
public class ComputePreds implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputePreds INSTANCE = new ComputePreds();

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);

        for (BasicBlock block : func.blocks) {
            block.attachExt(CommonExts.PREDS, new ArrayList<>());
        }
        for (BasicBlock block : func.blocks) {
            for (BasicBlock target : block.getSuccessors()) {
                if (target.getNullable(CommonExts.OWNING_FUNCTION) != func) {
                    throw new MalformedIRException(String.format(
                            "jump to block not in function\n  target: %s\n  in block: %s",
                            target.toTargetString(),
                            block));
                }
                target.getExtOrThrow(CommonExts.PREDS).add(block);
            }
        }

        ms.validate(MetadataState.PREDS);
    }

    @Override
    public String toString() {
        return "ComputePreds";
    }
}
