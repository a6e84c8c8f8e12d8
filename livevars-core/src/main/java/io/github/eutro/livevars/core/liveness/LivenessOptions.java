package io.github.eutro.livevars.core.liveness;

import org.jetbrains.annotations.Nullable;

/**
 * Options for {@link LivenessSolver} and {@link io.github.eutro.livevars.core.passes.meta.ComputeLiveVars}.
 * <p>
 * The defaults can be changed with the environment variables
 * {@code LIVEVARS_MERGE_RULE}, {@code LIVEVARS_SWEEP_ORDER} and {@code LIVEVARS_MAX_SWEEPS}.
 */
public final class LivenessOptions {
    /**
     * The options read from the environment.
     */
    public static final LivenessOptions DEFAULT = builder().build();

    private final MergeRule mergeRule;
    private final SweepOrder sweepOrder;
    private final boolean verify;
    private final int maxSweeps;

    private LivenessOptions(MergeRule mergeRule, SweepOrder sweepOrder, boolean verify, int maxSweeps) {
        this.mergeRule = mergeRule;
        this.sweepOrder = sweepOrder;
        this.verify = verify;
        this.maxSweeps = maxSweeps;
    }

    /**
     * Create a new builder, starting from the defaults in the environment.
     *
     * @return The builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Get the merge rule.
     *
     * @return The merge rule.
     */
    public MergeRule getMergeRule() {
        return mergeRule;
    }

    /**
     * Get the sweep order.
     *
     * @return The sweep order.
     */
    public SweepOrder getSweepOrder() {
        return sweepOrder;
    }

    /**
     * Get whether functions are checked before being analysed.
     *
     * @return Whether to verify.
     */
    public boolean isVerify() {
        return verify;
    }

    /**
     * Get the most sweeps the solver may run, or 0 to derive the limit from the size of the function.
     *
     * @return The sweep limit.
     */
    public int getMaxSweeps() {
        return maxSweeps;
    }

    @Override
    public String toString() {
        return "LivenessOptions{" +
                "mergeRule=" + mergeRule +
                ", sweepOrder=" + sweepOrder +
                ", verify=" + verify +
                ", maxSweeps=" + maxSweeps +
                '}';
    }

    /**
     * A builder for {@link LivenessOptions}.
     */
    public static class Builder {
        private MergeRule mergeRule = envEnum("LIVEVARS_MERGE_RULE", MergeRule.class, MergeRule.SUCCESSOR_ENTRY);
        private SweepOrder sweepOrder = envEnum("LIVEVARS_SWEEP_ORDER", SweepOrder.class, SweepOrder.FUNCTION_ORDER);
        private boolean verify = true;
        private int maxSweeps = envInt("LIVEVARS_MAX_SWEEPS", 0);

        Builder() {
        }

        /**
         * Set the merge rule.
         *
         * @param mergeRule The merge rule.
         * @return This.
         */
        public Builder setMergeRule(MergeRule mergeRule) {
            this.mergeRule = mergeRule;
            return this;
        }

        /**
         * Set the order blocks are swept in.
         *
         * @param sweepOrder The sweep order.
         * @return This.
         */
        public Builder setSweepOrder(SweepOrder sweepOrder) {
            this.sweepOrder = sweepOrder;
            return this;
        }

        /**
         * Set whether functions should be checked with
         * {@link io.github.eutro.livevars.core.passes.meta.VerifyIntegrity} first.
         *
         * @param verify Whether to verify.
         * @return This.
         */
        public Builder setVerify(boolean verify) {
            this.verify = verify;
            return this;
        }

        /**
         * Set the most sweeps the solver may run before failing.
         *
         * @param maxSweeps The limit, or 0 to derive it from the size of the function.
         * @return This.
         */
        public Builder setMaxSweeps(int maxSweeps) {
            if (maxSweeps < 0) throw new IllegalArgumentException("negative sweep limit: " + maxSweeps);
            this.maxSweeps = maxSweeps;
            return this;
        }

        /**
         * Build the options.
         *
         * @return The built options.
         */
        public LivenessOptions build() {
            return new LivenessOptions(mergeRule, sweepOrder, verify, maxSweeps);
        }
    }

    private static <E extends Enum<E>> E envEnum(String name, Class<E> type, E fallback) {
        @Nullable String value = System.getenv(name);
        if (value == null || value.isEmpty()) return fallback;
        try {
            return Enum.valueOf(type, value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("bad value for " + name + ": " + value, e);
        }
    }

    private static int envInt(String name, int fallback) {
        @Nullable String value = System.getenv(name);
        if (value == null || value.isEmpty()) return fallback;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("bad value for " + name + ": " + value, e);
        }
    }
}
