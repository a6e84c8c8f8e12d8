package io.github.eutro.livevars.core.ops;

import io.github.eutro.livevars.core.ext.DelegatingExtHolder;
import io.github.eutro.livevars.core.ext.ExtContainer;
import io.github.eutro.livevars.core.ssa.Insn;
import io.github.eutro.livevars.core.ssa.Operand;

import java.util.List;

/**
 * An operation, an {@link OpKey operation key} together with any immediates.
 */
public /* virtual */ class Op extends DelegatingExtHolder {
    /**
     * The key of the operation.
     */
    public final OpKey key;

    /**
     * Construct an operation with the given key.
     *
     * @param key The key.
     */
    protected Op(OpKey key) {
        this.key = key;
    }

    @Override
    protected ExtContainer getDelegate() {
        return key;
    }

    @Override
    public String toString() {
        return key.toString();
    }

    /**
     * Construct an instruction applying this operation to the given operands.
     *
     * @param args The operands.
     * @return The instruction.
     */
    public Insn insn(Operand... args) {
        return new Insn(this, args);
    }

    /**
     * Construct an instruction applying this operation to the given operands.
     *
     * @param args The operands.
     * @return The instruction.
     */
    public Insn insn(List<? extends Operand> args) {
        return new Insn(this, args);
    }
}
