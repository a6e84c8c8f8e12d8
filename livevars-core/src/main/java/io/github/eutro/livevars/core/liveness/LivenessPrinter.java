package io.github.eutro.livevars.core.liveness;

import io.github.eutro.livevars.core.ssa.BasicBlock;
import io.github.eutro.livevars.core.ssa.Control;
import io.github.eutro.livevars.core.ssa.Effect;
import io.github.eutro.livevars.core.ssa.Function;

/**
 * Prints liveness tables alongside the instructions of a function.
 * <p>
 * Each block is printed as
 * <pre>
 * BB: %0
 * {live after first}
 *   first instruction
 * ...
 * {live after control}
 *   control instruction
 * {live in}
 * </pre>
 */
public final class LivenessPrinter {
    private LivenessPrinter() {
    }

    /**
     * Print the liveness of a function.
     *
     * @param func   The function.
     * @param result Its liveness.
     * @return The printed tables.
     */
    public static String print(Function func, LivenessResult result) {
        StringBuilder sb = new StringBuilder();
        for (BasicBlock block : func.blocks) {
            sb.append("BB: ").append(block.toTargetString()).append('\n');
            for (Effect effect : block.getEffects()) {
                sb.append(result.getOut(effect)).append('\n');
                sb.append("  ").append(effect).append('\n');
            }
            Control control = block.getControl();
            sb.append(result.getOut(control)).append('\n');
            sb.append("  ").append(control).append('\n');
            sb.append(result.getIn(block)).append('\n');
        }
        return sb.toString();
    }
}
