package io.github.eutro.livevars.core.ssa;

import io.github.eutro.livevars.core.ext.*;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A basic block, a list of {@link Effect} instructions
 * followed by exactly one {@link Control} instruction.
 */
public final class BasicBlock extends ExtHolder {
    private final TrackedList<Effect> effects = new TrackedList<Effect>(new ArrayList<>()) {
        @Override
        protected void onAdded(Effect elt) {
            elt.attachExt(CommonExts.OWNING_BLOCK, BasicBlock.this);
        }

        @Override
        protected void onRemoved(Effect elt) {
            elt.removeExt(CommonExts.OWNING_BLOCK);
        }
    };
    private Control control;

    BasicBlock() {
    }

    /**
     * Format this block as a jump target.
     * <p>
     * This is {@code %n} for the {@code n}th block of its function, so it is
     * stable between runs, or an identity hash if the block is not in a function.
     *
     * @return The jump target string.
     */
    public String toTargetString() {
        if (owner != null) {
            int index = owner.blocks.indexOf(this);
            if (index != -1) return "%" + index;
        }
        return String.format("@%08x", System.identityHashCode(this));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(toTargetString()).append("\n{\n");
        for (Effect effect : getEffects()) {
            sb.append(' ').append(effect).append('\n');
        }
        sb.append(' ').append(getControl());
        sb.append("\n}");
        return sb.toString();
    }

    /**
     * Get the list of {@link Effect effects} in this basic block.
     *
     * @return The list.
     */
    public List<Effect> getEffects() {
        return effects;
    }

    /**
     * Add an {@link Effect effect} to the end of this basic block.
     *
     * @param effect The effect to add.
     */
    public void addEffect(Effect effect) {
        effects.add(effect);
    }

    /**
     * Get the control instruction of this block.
     *
     * @return The control instruction, or null if it has not been set yet.
     */
    public Control getControl() {
        return control;
    }

    /**
     * Set the control instruction of this block.
     *
     * @param control The control instruction.
     */
    public void setControl(Control control) {
        if (this.control != null) {
            this.control.removeExt(CommonExts.OWNING_BLOCK);
        }
        control.attachExt(CommonExts.OWNING_BLOCK, this);
        this.control = control;
    }

    /**
     * Get every instruction of this block in order, the control instruction last.
     *
     * @return A new list of the instructions.
     * @throws MalformedIRException If the block has no control instruction.
     */
    public List<Insn> getInsns() {
        if (control == null) {
            throw new MalformedIRException(String.format("block has no control instruction\n  in block: %s", this));
        }
        List<Insn> insns = new ArrayList<>(effects.size() + 1);
        for (Effect effect : effects) {
            insns.add(effect.insn());
        }
        insns.add(control.insn());
        return insns;
    }

    /**
     * Get the successors of this block, the targets of its control instruction.
     *
     * @return The successors.
     */
    public List<BasicBlock> getSuccessors() {
        return control == null ? Collections.emptyList() : control.targets;
    }

    /**
     * Get the predecessors of this block, computing them for the
     * whole function if they are not {@link MetadataState#PREDS valid}.
     *
     * @return The predecessors.
     * @throws IllegalStateException If the block is not in a function.
     */
    public List<BasicBlock> getPredecessors() {
        if (owner == null) {
            throw new IllegalStateException("block is not in a function: " + toTargetString());
        }
        owner.getExtOrThrow(CommonExts.METADATA_STATE).ensureValid(owner, MetadataState.PREDS);
        return getExtOrThrow(CommonExts.PREDS);
    }

    // exts
    private Function owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            owner = (Function) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
