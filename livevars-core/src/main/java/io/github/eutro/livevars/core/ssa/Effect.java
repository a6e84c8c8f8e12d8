package io.github.eutro.livevars.core.ssa;

import io.github.eutro.livevars.core.ext.CommonExts;
import io.github.eutro.livevars.core.ext.DelegatingExtHolder;
import io.github.eutro.livevars.core.ext.Ext;
import io.github.eutro.livevars.core.ext.ExtContainer;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An effect, a non-terminating instruction of a block: an {@link Insn} and
 * the variables its result is assigned to.
 * <p>
 * An effect with no variables produces no value, like a store or a fence.
 */
public final class Effect extends DelegatingExtHolder {
    private List<Var> assignsTo;
    private Insn insn;

    Effect(List<Var> assignsTo, Insn insn) {
        setAssignsTo(assignsTo);
        setInsn(insn);
    }

    @Override
    protected ExtContainer getDelegate() {
        return insn;
    }

    @Override
    public String toString() {
        if (assignsTo.isEmpty()) return insn.toString();
        return assignsTo.stream()
                .map(Var::toString)
                .collect(Collectors.joining(", ", "", " = ")) + insn;
    }

    /**
     * Get the variables this effect assigns to.
     *
     * @return An unmodifiable list of the variables.
     */
    public List<Var> getAssignsTo() {
        return Collections.unmodifiableList(assignsTo);
    }

    /**
     * Set the variables this effect assigns to. The list is copied.
     *
     * @param assignsTo The variables.
     */
    public void setAssignsTo(List<Var> assignsTo) {
        this.assignsTo = new ArrayList<>(assignsTo);
    }

    /**
     * Get the {@link Insn underlying instruction} of this effect.
     *
     * @return The instruction.
     */
    public Insn insn() {
        return insn;
    }

    /**
     * Set the {@link Insn underlying instruction} of this effect.
     *
     * @param insn The instruction.
     */
    public void setInsn(Insn insn) {
        insn.attachExt(CommonExts.OWNING_EFFECT, this);
        this.insn = insn;
    }

    // exts
    private BasicBlock owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = (BasicBlock) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
