package io.github.eutro.livevars.core.passes.meta;

import io.github.eutro.livevars.core.ext.CommonExts;
import io.github.eutro.livevars.core.ext.MetadataState;
import io.github.eutro.livevars.core.liveness.LivenessOptions;
import io.github.eutro.livevars.core.liveness.LivenessResult;
import io.github.eutro.livevars.core.liveness.LivenessSolver;
import io.github.eutro.livevars.core.liveness.MergeRule;
import io.github.eutro.livevars.core.passes.InPlaceIRPass;
import io.github.eutro.livevars.core.ssa.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Computes {@link CommonExts#LIVENESS} for a function.
 * <p>
 * The function is {@link VerifyIntegrity verified} first, unless disabled in the options.
 */
public class ComputeLiveVars implements InPlaceIRPass<Function> {
    private static final Logger logger = LogManager.getLogger(ComputeLiveVars.class);

    /**
     * An instance of this pass with the {@link LivenessOptions#DEFAULT default options}.
     */
    public static final ComputeLiveVars INSTANCE = new ComputeLiveVars(LivenessOptions.DEFAULT);

    private final LivenessOptions options;

    /**
     * Construct the pass with the given options.
     *
     * @param options The options.
     */
    public ComputeLiveVars(LivenessOptions options) {
        this.options = options;
    }

    /**
     * Get the liveness of a function, computing it if it is not {@link MetadataState#LIVENESS valid}.
     *
     * @param func The function.
     * @return Its liveness.
     */
    public static LivenessResult resultFor(Function func) {
        func.getExtOrThrow(CommonExts.METADATA_STATE).ensureValid(func, MetadataState.LIVENESS);
        return func.getExtOrThrow(CommonExts.LIVENESS);
    }

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        if (options.isVerify()) {
            VerifyIntegrity.INSTANCE.runInPlace(func);
        }
        if (options.getMergeRule() == MergeRule.PREDECESSOR_EXIT) {
            ms.ensureValid(func, MetadataState.PREDS);
        }
        logger.debug("computing liveness of {} blocks with {}", func.blocks.size(), options);
        LivenessResult result = new LivenessSolver(func, options).solve().result();
        func.attachExt(CommonExts.LIVENESS, result);
        ms.validate(MetadataState.LIVENESS);
    }

    @Override
    public String toString() {
        return "ComputeLiveVars";
    }
}
