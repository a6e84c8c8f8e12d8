package io.github.eutro.livevars.core.util;

import io.github.eutro.livevars.core.ssa.Function;

/**
 * A unary function.
 * <p>
 * Equivalent to {@link java.util.function.Function}, but doesn't collide with
 * {@link Function}.
 *
 * @param <A> The argument type.
 * @param <B> The return type.
 */
@FunctionalInterface
public interface F<A, B> {
    /**
     * Apply the function.
     *
     * @param a The argument.
     * @return The result.
     */
    B apply(A a);
}
