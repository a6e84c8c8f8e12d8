package io.github.eutro.livevars.core.liveness;

import io.github.eutro.livevars.core.ext.CommonExts;
import io.github.eutro.livevars.core.ssa.*;
import io.github.eutro.livevars.core.util.OrderedSet;

import java.util.Collections;
import java.util.Map;

/**
 * The converged liveness tables of one function, read-only.
 * <p>
 * Obtained from {@link LivenessSolver#result()}, or attached to a function as
 * {@link CommonExts#LIVENESS} by {@link io.github.eutro.livevars.core.passes.meta.ComputeLiveVars}.
 * The tables describe the function as it was when it was analysed.
 */
public final class LivenessResult {
    private final Function func;
    private final Map<BasicBlock, OrderedSet<Var>> inSets;
    private final Map<Insn, OrderedSet<Var>> outSets;
    private final int sweeps;

    LivenessResult(Function func,
                   Map<BasicBlock, OrderedSet<Var>> inSets,
                   Map<Insn, OrderedSet<Var>> outSets,
                   int sweeps) {
        this.func = func;
        this.inSets = Collections.unmodifiableMap(inSets);
        this.outSets = Collections.unmodifiableMap(outSets);
        this.sweeps = sweeps;
    }

    /**
     * Get the function these tables are for.
     *
     * @return The function.
     */
    public Function getFunction() {
        return func;
    }

    /**
     * Get the variables live on entry to a block.
     *
     * @param block The block.
     * @return The live variables.
     * @throws IllegalArgumentException If the block is not in the function.
     */
    public OrderedSet<Var> getIn(BasicBlock block) {
        OrderedSet<Var> set = inSets.get(block);
        if (set == null || block.getNullable(CommonExts.OWNING_FUNCTION) != func) {
            throw new IllegalArgumentException("block not in function: " + block.toTargetString());
        }
        return set;
    }

    /**
     * Get the variables recorded at an instruction.
     *
     * @param insn The instruction.
     * @return The live variables.
     * @throws IllegalArgumentException If the instruction is not in the function.
     */
    public OrderedSet<Var> getOut(Insn insn) {
        OrderedSet<Var> set = outSets.get(insn);
        if (set == null) {
            throw new IllegalArgumentException("instruction not in function: " + insn);
        }
        return set;
    }

    /**
     * Get the variables recorded at an effect.
     *
     * @param effect The effect.
     * @return The live variables.
     */
    public OrderedSet<Var> getOut(Effect effect) {
        return getOut(effect.insn());
    }

    /**
     * Get the variables recorded at a control instruction.
     *
     * @param control The control instruction.
     * @return The live variables.
     */
    public OrderedSet<Var> getOut(Control control) {
        return getOut(control.insn());
    }

    /**
     * Whether a variable is live on entry to a block.
     *
     * @param block The block.
     * @param var   The variable.
     * @return Whether {@code var} is in the live-in set of {@code block}.
     * @throws IllegalArgumentException If the block is not in the function.
     */
    public boolean isLiveIn(BasicBlock block, Var var) {
        return getIn(block).contains(var);
    }

    /**
     * Whether a variable is recorded at an instruction, that is, live just before it.
     *
     * @param insn The instruction.
     * @param var  The variable.
     * @return Whether {@code var} is in the set recorded at {@code insn}.
     * @throws IllegalArgumentException If the instruction is not in the function.
     */
    public boolean isLiveAt(Insn insn, Var var) {
        return getOut(insn).contains(var);
    }

    /**
     * Get every variable that is live anywhere in the function, in block order.
     *
     * @return The variables.
     */
    public OrderedSet<Var> getLiveValues() {
        OrderedSet<Var> acc = OrderedSet.empty();
        for (BasicBlock block : func.blocks) {
            OrderedSet<Var> in = inSets.get(block);
            if (in == null) continue;
            acc = acc.union(in);
            for (Effect effect : block.getEffects()) {
                OrderedSet<Var> out = outSets.get(effect.insn());
                if (out != null) acc = acc.union(out);
            }
            Control control = block.getControl();
            if (control != null) {
                OrderedSet<Var> out = outSets.get(control.insn());
                if (out != null) acc = acc.union(out);
            }
        }
        return acc;
    }

    /**
     * Whether the tables are at a fixpoint. Always true for a result that could be obtained.
     *
     * @return {@code true}
     */
    public boolean isConverged() {
        return true;
    }

    /**
     * Get the number of sweeps it took to converge, including the final sweep that changed nothing.
     *
     * @return The number of sweeps.
     */
    public int getSweeps() {
        return sweeps;
    }

    @Override
    public String toString() {
        return LivenessPrinter.print(func, this);
    }
}
