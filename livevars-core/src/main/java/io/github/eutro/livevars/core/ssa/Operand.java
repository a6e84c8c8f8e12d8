package io.github.eutro.livevars.core.ssa;

import io.github.eutro.livevars.core.ext.ExtHolder;

/**
 * Something an {@link Insn} reads: a {@link Var}, a {@link Constant} or a {@link BlockLabel}.
 * <p>
 * Only {@link Var}s are tracked by liveness. Operands compare by identity.
 */
public abstract class Operand extends ExtHolder {
    Operand() {
    }

    /**
     * Whether this operand is a compile-time constant.
     *
     * @return Whether this is a {@link Constant}.
     */
    public boolean isConstant() {
        return false;
    }

    /**
     * Whether this operand names a block rather than a value.
     *
     * @return Whether this is a {@link BlockLabel}.
     */
    public boolean isBlockLabel() {
        return false;
    }
}
