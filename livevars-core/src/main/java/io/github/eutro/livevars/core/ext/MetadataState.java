package io.github.eutro.livevars.core.ext;

import io.github.eutro.livevars.core.passes.IRPass;
import io.github.eutro.livevars.core.passes.meta.ComputeLiveVars;
import io.github.eutro.livevars.core.passes.meta.ComputePreds;
import io.github.eutro.livevars.core.ssa.Function;

import java.util.BitSet;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tracks which derived metadata of a {@link Function} is currently valid.
 */
public class MetadataState {
    /**
     * A kind of metadata whose validity can be tracked.
     */
    public static class MetaKind {
        private static final AtomicInteger COUNTER = new AtomicInteger();
        final int id = COUNTER.getAndIncrement();
        final String name;

        MetaKind(String name) {
            this.name = name;
        }

        @Override
        public boolean equals(Object o) {
            return this == o;
        }

        @Override
        public int hashCode() {
            return id;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * A kind of metadata that also knows which passes compute it.
     *
     * @param <T> The IR the passes run on.
     */
    public static class ComputableMetaKind<T> extends MetaKind {
        private final IRPass<T, T>[] passes;

        @SafeVarargs
        ComputableMetaKind(String name, IRPass<T, T>... passes) {
            super(name);
            this.passes = passes;
        }

        void computeFor(T t) {
            for (IRPass<T, T> pass : passes) {
                if (!pass.isInPlace()) throw new IllegalArgumentException("not an in-place pass: " + pass);
                pass.run(t);
            }
        }
    }

    /**
     * The {@link CommonExts#PREDS predecessors} of every block.
     */
    public static final ComputableMetaKind<Function> PREDS = new ComputableMetaKind<>("PREDS", ComputePreds.INSTANCE);
    /**
     * The {@link CommonExts#LIVENESS liveness tables} of the function.
     */
    public static final ComputableMetaKind<Function> LIVENESS = new ComputableMetaKind<>("LIVENESS", ComputeLiveVars.INSTANCE);

    private final BitSet validSet = new BitSet();

    /**
     * Check whether the given metadata is valid.
     *
     * @param kind The kind of metadata.
     * @return Whether it is valid.
     */
    public boolean isValid(MetaKind kind) {
        return validSet.get(kind.id);
    }

    /**
     * Compute each of the given metadata that is not currently valid.
     *
     * @param t     The IR to compute them for.
     * @param first The first metadata kind.
     * @param kinds The other metadata kinds.
     * @param <T>   The type of {@code t}.
     */
    @SafeVarargs
    public final <T> void ensureValid(T t, ComputableMetaKind<T> first, ComputableMetaKind<T>... kinds) {
        ensureValid0(t, first);
        for (ComputableMetaKind<T> kind : kinds) {
            ensureValid0(t, kind);
        }
    }

    private <T> void ensureValid0(T t, ComputableMetaKind<T> kind) {
        if (!isValid(kind)) {
            kind.computeFor(t);
            validate(kind);
        }
    }

    /**
     * Mark the given metadata as valid.
     *
     * @param kinds The metadata kinds.
     */
    public void validate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            validSet.set(kind.id, true);
        }
    }

    /**
     * Mark the given metadata as invalid.
     *
     * @param kinds The metadata kinds.
     */
    public void invalidate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            validSet.set(kind.id, false);
        }
    }

    /**
     * Invalidate everything that depends on the control flow graph.
     */
    public void graphChanged() {
        invalidate(PREDS);
        varsChanged();
    }

    /**
     * Invalidate everything that depends on which variables instructions read or write.
     */
    public void varsChanged() {
        invalidate(LIVENESS);
    }
}
