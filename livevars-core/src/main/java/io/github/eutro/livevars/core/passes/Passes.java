package io.github.eutro.livevars.core.passes;

import io.github.eutro.livevars.core.liveness.LivenessOptions;
import io.github.eutro.livevars.core.passes.meta.ComputeLiveVars;
import io.github.eutro.livevars.core.passes.meta.ComputePreds;
import io.github.eutro.livevars.core.passes.meta.VerifyIntegrity;
import io.github.eutro.livevars.core.ssa.Function;

public class Passes {
    public static final IRPass<Function, Function> LIVENESS =
            ComputePreds.INSTANCE
                    .then(VerifyIntegrity.INSTANCE)
                    .then(new ComputeLiveVars(LivenessOptions.builder()
                            .setVerify(false)
                            .build()));
}
