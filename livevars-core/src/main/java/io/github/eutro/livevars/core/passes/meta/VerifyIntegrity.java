package io.github.eutro.livevars.core.passes.meta;

import io.github.eutro.livevars.core.ext.CommonExts;
import io.github.eutro.livevars.core.ext.MetadataState;
import io.github.eutro.livevars.core.ops.InsnKind;
import io.github.eutro.livevars.core.passes.InPlaceIRPass;
import io.github.eutro.livevars.core.ssa.*;

import java.util.HashSet;
import java.util.Set;

/**
 * Checks the structural rules of a function, throwing a {@link MalformedIRException}
 * describing the first violation found.
 * <ul>
 *     <li>The function has an entry block, and lists no block twice.</li>
 *     <li>Every block ends in a control instruction, and only there.</li>
 *     <li>Instructions are owned by the block they are in.</li>
 *     <li>Jump targets, block label operands and computed predecessors are blocks of the function.</li>
 *     <li>Phis come before any other effect of their block.</li>
 * </ul>
 */
public class VerifyIntegrity implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass.
     */
    public static final VerifyIntegrity INSTANCE = new VerifyIntegrity();

    @Override
    public void runInPlace(Function function) {
        if (function.blocks.isEmpty()) {
            throw new MalformedIRException("function has no entry block");
        }
        Set<BasicBlock> blockSet = new HashSet<>(function.blocks);
        if (blockSet.size() != function.blocks.size()) {
            throw new MalformedIRException("function contains duplicate blocks");
        }

        boolean checkPreds = function.getExtOrThrow(CommonExts.METADATA_STATE).isValid(MetadataState.PREDS);
        for (BasicBlock block : function.blocks) {
            if (block.getNullable(CommonExts.OWNING_FUNCTION) != function) {
                throw new MalformedIRException(String.format(
                        "block not owned by function\n  block: %s",
                        block));
            }

            Control control = block.getControl();
            if (control == null) {
                throw new MalformedIRException(String.format(
                        "block has no control instruction\n  in block: %s",
                        block));
            }

            boolean pastPhis = false;
            for (Effect effect : block.getEffects()) {
                if (effect.getNullable(CommonExts.OWNING_BLOCK) != block) {
                    throw new MalformedIRException(String.format(
                            "effect not owned by block\n  effect: %s\n  in block: %s",
                            effect,
                            block));
                }
                InsnKind kind = effect.insn().getNullable(CommonExts.INSN_KIND);
                if (kind != null && kind.isTerminator()) {
                    throw new MalformedIRException(String.format(
                            "terminator before end of block\n  effect: %s\n  in block: %s",
                            effect,
                            block));
                }
                if (kind == InsnKind.PHI) {
                    if (pastPhis) {
                        throw new MalformedIRException(String.format(
                                "phi not at block start\n  effect: %s\n  in block: %s",
                                effect,
                                block));
                    }
                } else {
                    pastPhis = true;
                }
                checkLabels(blockSet, block, effect.insn());
            }

            if (control.getNullable(CommonExts.OWNING_BLOCK) != block) {
                throw new MalformedIRException(String.format(
                        "control not owned by block\n  control: %s\n  in block: %s",
                        control,
                        block));
            }
            InsnKind kind = control.insn().getNullable(CommonExts.INSN_KIND);
            if (kind != null && !kind.isTerminator()) {
                throw new MalformedIRException(String.format(
                        "control instruction is not a terminator\n  control: %s\n  in block: %s",
                        control,
                        block));
            }
            checkLabels(blockSet, block, control.insn());
            for (BasicBlock target : control.targets) {
                if (!blockSet.contains(target)) {
                    throwInvalidReference(block, control, target);
                }
            }

            if (checkPreds) {
                for (BasicBlock pred : block.getExtOrThrow(CommonExts.PREDS)) {
                    if (!blockSet.contains(pred)) {
                        throw new MalformedIRException(String.format(
                                "predecessor not in function\n  predecessor: %s\n  in block: %s",
                                pred.toTargetString(),
                                block));
                    }
                }
            }
        }
    }

    private void checkLabels(Set<BasicBlock> blockSet, BasicBlock block, Insn insn) {
        for (Operand arg : insn) {
            if (arg.isBlockLabel()) {
                BasicBlock referenced = ((BlockLabel) arg).block;
                if (!blockSet.contains(referenced)) {
                    throwInvalidReference(block, insn, referenced);
                }
            }
        }
    }

    private void throwInvalidReference(BasicBlock block, Object insn, BasicBlock referenced) {
        throw new MalformedIRException(String.format(
                "instruction references block not in function" +
                        "\n  referenced: %s" +
                        "\n  instruction: %s" +
                        "\n  in block: %s",
                referenced.toTargetString(),
                insn,
                block
        ));
    }

    @Override
    public String toString() {
        return "VerifyIntegrity";
    }
}
