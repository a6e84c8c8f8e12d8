package io.github.eutro.livevars.core.liveness;

import io.github.eutro.livevars.core.ssa.Var;
import io.github.eutro.livevars.core.util.OrderedSet;

import java.util.Objects;

/**
 * The variables a single instruction reads ({@link #gen}) and writes ({@link #kill}).
 */
public final class GenKill {
    /**
     * Neither reads nor writes anything.
     */
    public static final GenKill EMPTY = new GenKill(OrderedSet.empty(), OrderedSet.empty());

    /**
     * The variables read, in operand order.
     */
    public final OrderedSet<Var> gen;
    /**
     * The variables assigned.
     */
    public final OrderedSet<Var> kill;

    /**
     * Construct a gen/kill pair.
     *
     * @param gen  The variables read.
     * @param kill The variables assigned.
     */
    public GenKill(OrderedSet<Var> gen, OrderedSet<Var> kill) {
        this.gen = gen;
        this.kill = kill;
    }

    /**
     * Apply the flow function of the instruction to the variables live after it.
     * <p>
     * The result is {@code (live ∪ gen) \ kill}.
     *
     * @param live The running live set.
     * @return The live set recorded at this instruction.
     */
    public OrderedSet<Var> apply(OrderedSet<Var> live) {
        return live.union(gen).minus(kill);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GenKill genKill = (GenKill) o;
        return gen.equals(genKill.gen) && kill.equals(genKill.kill);
    }

    @Override
    public int hashCode() {
        return Objects.hash(gen, kill);
    }

    @Override
    public String toString() {
        return "gen " + gen + " kill " + kill;
    }
}
