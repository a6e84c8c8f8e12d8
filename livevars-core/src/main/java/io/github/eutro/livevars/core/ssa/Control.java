package io.github.eutro.livevars.core.ssa;

import io.github.eutro.livevars.core.ext.CommonExts;
import io.github.eutro.livevars.core.ext.Ext;
import io.github.eutro.livevars.core.ext.ExtHolder;
import io.github.eutro.livevars.core.ops.CommonOps;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A control instruction, the terminator of a block: an {@link Insn}
 * and the blocks it may transfer control to.
 * <p>
 * Some control instructions also produce a value, like an invoke,
 * which is assigned to {@link #getAssignsTo()} on the normal path.
 */
public final class Control extends ExtHolder {
    private Insn insn;
    private List<Var> assignsTo = Collections.emptyList();
    /**
     * The jump targets of this instruction, the successor edges of its block.
     * The meaning of the order depends on the instruction.
     */
    public final List<BasicBlock> targets;

    Control(Insn insn, List<BasicBlock> targets) {
        setInsn(insn);
        this.targets = targets;
    }

    /**
     * Construct an unconditional jump to a block.
     *
     * @param target The jump target.
     * @return The jump instruction.
     */
    public static Control br(BasicBlock target) {
        return CommonOps.BR.insn().jumpsTo(target);
    }

    /**
     * Make this control instruction assign its result to the given variables.
     *
     * @param vars The variables.
     * @return This.
     */
    public Control assigning(Var... vars) {
        assignsTo = new ArrayList<>(Arrays.asList(vars));
        return this;
    }

    /**
     * Get the variables this instruction assigns to, usually none.
     *
     * @return An unmodifiable list of the variables.
     */
    public List<Var> getAssignsTo() {
        return Collections.unmodifiableList(assignsTo);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < assignsTo.size(); i++) {
            if (i != 0) sb.append(", ");
            sb.append(assignsTo.get(i));
        }
        if (!assignsTo.isEmpty()) sb.append(" = ");
        sb.append(insn);
        if (!targets.isEmpty()) {
            sb.append(" ->");
            for (BasicBlock target : targets) {
                sb.append(' ').append(target.toTargetString());
            }
        }
        return sb.toString();
    }

    /**
     * Get the {@link Insn underlying instruction} of this control instruction.
     *
     * @return The instruction.
     */
    public Insn insn() {
        return insn;
    }

    /**
     * Set the {@link Insn underlying instruction} of this control instruction.
     *
     * @param insn The instruction.
     */
    public void setInsn(Insn insn) {
        insn.attachExt(CommonExts.OWNING_CONTROL, this);
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
