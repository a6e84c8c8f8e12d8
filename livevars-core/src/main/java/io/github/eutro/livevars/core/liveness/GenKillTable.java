package io.github.eutro.livevars.core.liveness;

import io.github.eutro.livevars.core.ssa.*;
import io.github.eutro.livevars.core.util.OrderedSet;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * The {@link GenKill} of every instruction of a function, classified once.
 */
public final class GenKillTable {
    private final Map<Insn, GenKill> table;
    private final OrderedSet<Var> vars;

    private GenKillTable(Map<Insn, GenKill> table, OrderedSet<Var> vars) {
        this.table = table;
        this.vars = vars;
    }

    /**
     * Classify every instruction of a function.
     *
     * @param func The function.
     * @return The table.
     * @throws MalformedIRException If a block has no control instruction.
     */
    public static GenKillTable build(Function func) {
        Map<Insn, GenKill> table = new IdentityHashMap<>();
        Set<Var> vars = new LinkedHashSet<>();
        for (BasicBlock block : func.blocks) {
            for (Effect effect : block.getEffects()) {
                GenKill gk = GenKillClassifier.classify(effect);
                table.put(effect.insn(), gk);
                vars.addAll(gk.gen);
                vars.addAll(gk.kill);
            }
            Control control = block.getControl();
            if (control == null) {
                throw new MalformedIRException(String.format(
                        "block has no control instruction\n  in block: %s",
                        block));
            }
            GenKill gk = GenKillClassifier.classify(control);
            table.put(control.insn(), gk);
            vars.addAll(gk.gen);
            vars.addAll(gk.kill);
        }
        return new GenKillTable(Collections.unmodifiableMap(table), OrderedSet.copyOf(vars));
    }

    /**
     * Get the gen and kill sets of an instruction.
     *
     * @param insn The instruction.
     * @return Its gen and kill sets.
     * @throws IllegalArgumentException If the instruction was not in the function.
     */
    public GenKill get(Insn insn) {
        GenKill gk = table.get(insn);
        if (gk == null) {
            throw new IllegalArgumentException("instruction not in function: " + insn);
        }
        return gk;
    }

    /**
     * Get every variable read or written in the function, in the order they were first seen.
     *
     * @return The variables.
     */
    public OrderedSet<Var> getVars() {
        return vars;
    }
}
