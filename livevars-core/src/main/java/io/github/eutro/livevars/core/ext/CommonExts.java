package io.github.eutro.livevars.core.ext;

import io.github.eutro.livevars.core.liveness.LivenessResult;
import io.github.eutro.livevars.core.ops.InsnKind;
import io.github.eutro.livevars.core.ops.Op;
import io.github.eutro.livevars.core.ops.OpKey;
import io.github.eutro.livevars.core.passes.meta.ComputeLiveVars;
import io.github.eutro.livevars.core.passes.meta.ComputePreds;
import io.github.eutro.livevars.core.ssa.*;

import java.util.List;

/**
 * The {@link Ext}s the IR and its analyses attach to each other.
 */
public class CommonExts {
    /**
     * Attached to a {@link Function}. Which metadata on the function is up to date.
     *
     * @see MetadataState
     */
    public static final Ext<MetadataState> METADATA_STATE = Ext.create(MetadataState.class, "METADATA_STATE");

    /**
     * Attached to a {@link BasicBlock}. The predecessors of the block, in function order.
     * <p>
     * Computed by {@link ComputePreds}.
     */
    public static final Ext<List<BasicBlock>> PREDS = Ext.create(List.class, "PREDS");

    /**
     * Attached to an {@link Insn}, {@link Op} or {@link OpKey}.
     * The kind of instruction, which decides how liveness treats it.
     * <p>
     * Instructions without a kind are classified conservatively.
     */
    public static final Ext<InsnKind> INSN_KIND = Ext.create(InsnKind.class, "INSN_KIND");

    /**
     * Attached to a {@link BasicBlock}. The function this basic block is in.
     */
    public static final Ext<Function> OWNING_FUNCTION = Ext.create(Function.class, "OWNING_FUNCTION");
    /**
     * Attached to a {@link Control} or {@link Effect}. The block this instruction is in.
     */
    public static final Ext<BasicBlock> OWNING_BLOCK = Ext.create(BasicBlock.class, "OWNING_BLOCK");
    /**
     * Attached to an {@link Insn}. The control instruction this insn is part of, if any.
     */
    public static final Ext<Control> OWNING_CONTROL = Ext.create(Control.class, "OWNING_CONTROL");
    /**
     * Attached to an {@link Insn}. The effect instruction this insn is part of, if any.
     */
    public static final Ext<Effect> OWNING_EFFECT = Ext.create(Effect.class, "OWNING_EFFECT");

    /**
     * Attached to a {@link Function}, computed by {@link ComputeLiveVars}.
     * The converged liveness tables of the function.
     */
    public static final Ext<LivenessResult> LIVENESS = Ext.create(LivenessResult.class, "LIVENESS");

    /**
     * Give an operation key its {@link #INSN_KIND}.
     *
     * @param key  The key.
     * @param kind The kind.
     * @param <K>  The type of the key.
     * @return {@code key}.
     */
    public static <K extends OpKey> K markKind(K key, InsnKind kind) {
        key.attachExt(INSN_KIND, kind);
        return key;
    }
}
