package io.github.eutro.livevars.core.ssa;

/**
 * A variable, a virtual register. This is the value liveness is computed for.
 * <p>
 * A variable is usually the result of an {@link Effect}, or of a {@link Control}
 * such as an invoke. A variable that no instruction of the function assigns
 * is defined outside it, like a parameter, and is live on entry wherever it is read.
 * <p>
 * May be assigned more than once, but only if the IR is not in SSA form.
 */
public final class Var extends Operand {
    /**
     * The name of the variable.
     */
    public final String name;
    /**
     * The index of the variable, to tell it apart from others
     * with the same name in the same function,
     * if {@link Function#UNIQUE_VAR_NAMES counting is enabled}.
     */
    public final int index;

    Var(String name, int index) {
        this.name = name;
        this.index = index;
    }

    @Override
    public String toString() {
        return '$' + name + (index == 0 ? "" : "." + index);
    }
}
