package io.github.eutro.livevars.core.ssa;

import io.github.eutro.livevars.core.ext.CommonExts;
import io.github.eutro.livevars.core.ext.DelegatingExtHolder;
import io.github.eutro.livevars.core.ext.Ext;
import io.github.eutro.livevars.core.ext.ExtContainer;
import io.github.eutro.livevars.core.ops.Op;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A raw instruction: an {@link Op operation} applied to an ordered list of {@link Operand}s.
 * <p>
 * An instruction becomes part of a block by being wrapped in an {@link Effect},
 * which names the variables it assigns, or in a {@link Control}, which names
 * the blocks it may jump to. Instructions are compared by identity.
 */
public final class Insn extends DelegatingExtHolder implements Iterable<Operand> {
    /**
     * The operation of this instruction.
     */
    public Op op;

    // null if empty,
    // Operand if unary,
    // Operand[] otherwise.
    private Object args;

    /**
     * Construct an instruction.
     *
     * @param op   The operation.
     * @param args The operands, which are copied.
     */
    public Insn(Op op, List<? extends Operand> args) {
        this.op = op;
        switch (args.size()) {
            case 0:
                this.args = null;
                break;
            case 1:
                this.args = args.get(0);
                break;
            default:
                this.args = args.toArray(new Operand[0]);
                break;
        }
    }

    /**
     * Construct an instruction.
     *
     * @param op   The operation.
     * @param args The operands.
     */
    public Insn(Op op, Operand... args) {
        this(op, Arrays.asList(args));
    }

    @Override
    protected ExtContainer getDelegate() {
        return op;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(op);
        for (Operand arg : this) {
            sb.append(' ').append(arg);
        }
        return sb.toString();
    }

    /**
     * Make an effect assigning the result of this instruction to the given variables.
     *
     * @param vars The variables, usually zero or one.
     * @return The effect.
     */
    public Effect assignTo(Var... vars) {
        return new Effect(Arrays.asList(vars), this);
    }

    /**
     * Make an effect assigning the result of this instruction to the given variables.
     *
     * @param vars The variables.
     * @return The effect.
     */
    public Effect assignTo(List<Var> vars) {
        return new Effect(vars, this);
    }

    /**
     * Make a control instruction from this, jumping to the given blocks.
     *
     * @param targets The jump targets.
     * @return The control instruction.
     */
    public Control jumpsTo(BasicBlock... targets) {
        return jumpsTo(Arrays.asList(targets));
    }

    /**
     * Make a control instruction from this, jumping to the given blocks.
     *
     * @param targets The jump targets, which are copied.
     * @return The control instruction.
     */
    public Control jumpsTo(List<BasicBlock> targets) {
        return new Control(this, new ArrayList<>(targets));
    }

    // exts
    private Object owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_EFFECT) {
            return owner instanceof Effect ? (T) owner : null;
        } else if (ext == CommonExts.OWNING_CONTROL) {
            return owner instanceof Control ? (T) owner : null;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_EFFECT || ext == CommonExts.OWNING_CONTROL) {
            owner = value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_EFFECT || ext == CommonExts.OWNING_CONTROL) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }

    /**
     * Get a view of the operands of this instruction. Operands may be replaced
     * through the view, but not added or removed.
     *
     * @return The operands.
     */
    public List<Operand> args() {
        return new Args();
    }

    @NotNull
    @Override
    public Iterator<Operand> iterator() {
        if (args == null) return Collections.emptyIterator();
        if (args instanceof Operand) return Collections.singletonList((Operand) args).iterator();
        return Arrays.asList((Operand[]) args).iterator();
    }

    private class Args extends AbstractList<Operand> implements RandomAccess {
        @Override
        public Operand get(int index) {
            if (args == null) throw new IndexOutOfBoundsException("Index: " + index + ", Size: 0");
            if (args instanceof Operand) {
                if (index != 0) throw new IndexOutOfBoundsException("Index: " + index + ", Size: 1");
                return (Operand) args;
            }
            return ((Operand[]) args)[index];
        }

        @Override
        public Operand set(int index, Operand value) {
            Operand old = get(index);
            if (args instanceof Operand) {
                args = value;
            } else {
                ((Operand[]) args)[index] = value;
            }
            return old;
        }

        @Override
        public int size() {
            if (args == null) return 0;
            if (args instanceof Operand) return 1;
            return ((Operand[]) args).length;
        }

        @Override
        public @NotNull Iterator<Operand> iterator() {
            return Insn.this.iterator();
        }
    }
}
