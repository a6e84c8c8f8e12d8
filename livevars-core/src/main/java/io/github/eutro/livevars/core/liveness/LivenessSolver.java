package io.github.eutro.livevars.core.liveness;

import io.github.eutro.livevars.core.ext.CommonExts;
import io.github.eutro.livevars.core.ssa.*;
import io.github.eutro.livevars.core.util.OrderedSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * Computes liveness for one function by sweeping its blocks until nothing changes.
 * <p>
 * Each sweep visits every block in order. A block's neighbours, chosen by the
 * {@link MergeRule}, are merged into one set. If the block has been visited before and the
 * merged set is the same as last time, the block is skipped. Otherwise the block is walked
 * from its last instruction to its first, recording {@link GenKill#apply(OrderedSet)} of the
 * running set at each instruction.
 * <p>
 * A solver owns its tables, and is not thread-safe.
 */
public final class LivenessSolver {
    private static final Logger logger = LogManager.getLogger(LivenessSolver.class);

    /**
     * The state of a solver.
     */
    public enum State {
        /**
         * The last sweep changed something, or no sweep has run yet.
         */
        UNCONVERGED,
        /**
         * A full sweep changed nothing.
         */
        CONVERGED,
    }

    private final Function func;
    private final MergeRule mergeRule;
    private final GenKillTable table;
    private final List<BasicBlock> order;
    private final int maxSweeps;

    private final Map<BasicBlock, OrderedSet<Var>> merged = new HashMap<>();
    private final Map<Insn, OrderedSet<Var>> outSets = new IdentityHashMap<>();
    private State state = State.UNCONVERGED;
    private int sweeps = 0;

    /**
     * Construct a solver for a function, sweeping in the order given by the options.
     *
     * @param func    The function.
     * @param options The options.
     */
    public LivenessSolver(Function func, LivenessOptions options) {
        this(func, options, options.getSweepOrder().order(func));
    }

    /**
     * Construct a solver for a function, sweeping in the given order.
     *
     * @param func    The function.
     * @param options The options. The sweep order is ignored.
     * @param order   The blocks of the function, each exactly once.
     * @throws IllegalArgumentException If {@code order} is not a permutation of the blocks of the function.
     * @throws MalformedIRException     If a block has no control instruction, or jumps to a block outside the function.
     */
    public LivenessSolver(Function func, LivenessOptions options, List<BasicBlock> order) {
        Set<BasicBlock> orderSet = new HashSet<>(order);
        if (order.size() != func.blocks.size()
                || orderSet.size() != order.size()
                || !orderSet.containsAll(func.blocks)) {
            throw new IllegalArgumentException("sweep order is not a permutation of the blocks of the function");
        }
        for (BasicBlock block : func.blocks) {
            Control control = block.getControl();
            if (control == null) continue;
            for (BasicBlock target : control.targets) {
                if (target.getNullable(CommonExts.OWNING_FUNCTION) != func) {
                    throw new MalformedIRException(String.format(
                            "jump to block not in function\n  target: %s\n  in block: %s",
                            target.toTargetString(),
                            block));
                }
            }
        }
        this.func = func;
        this.mergeRule = options.getMergeRule();
        this.table = GenKillTable.build(func);
        this.order = new ArrayList<>(order);
        this.maxSweeps = options.getMaxSweeps() == 0
                ? func.blocks.size() * (table.getVars().size() + 1) + 2
                : options.getMaxSweeps();
    }

    /**
     * Get the state of this solver.
     *
     * @return The state.
     */
    public State getState() {
        return state;
    }

    /**
     * Get the number of sweeps run so far.
     *
     * @return The number of sweeps.
     */
    public int getSweeps() {
        return sweeps;
    }

    /**
     * Run one sweep over every block.
     *
     * @return Whether any block was recomputed.
     */
    public boolean sweep() {
        sweeps++;
        int changed = 0;
        for (BasicBlock block : order) {
            OrderedSet<Var> mergedSet = merge(block);
            OrderedSet<Var> stored = merged.get(block);
            if (stored != null && stored.equals(mergedSet)) {
                continue;
            }
            merged.put(block, mergedSet);
            logger.trace("recomputing {} from {}", block.toTargetString(), mergedSet);
            walk(block, mergedSet);
            changed++;
        }
        logger.debug("sweep {} recomputed {} of {} blocks", sweeps, changed, order.size());
        if (changed == 0) {
            if (state != State.CONVERGED) {
                logger.debug("converged after {} sweeps", sweeps);
            }
            state = State.CONVERGED;
            return false;
        }
        state = State.UNCONVERGED;
        return true;
    }

    /**
     * Sweep until a sweep changes nothing.
     *
     * @return This.
     * @throws IllegalStateException If the sweep limit is reached first.
     */
    public LivenessSolver solve() {
        while (state != State.CONVERGED) {
            if (sweeps >= maxSweeps) {
                throw new IllegalStateException(String.format(
                        "liveness did not converge in %d sweeps\n  in function: %s",
                        sweeps,
                        func));
            }
            sweep();
        }
        return this;
    }

    /**
     * Get the converged tables.
     *
     * @return The result.
     * @throws IllegalStateException If the solver has not converged.
     */
    public LivenessResult result() {
        if (state != State.CONVERGED) {
            throw new IllegalStateException("liveness has not converged, after " + sweeps + " sweeps");
        }
        Map<BasicBlock, OrderedSet<Var>> inSets = new IdentityHashMap<>();
        for (BasicBlock block : func.blocks) {
            inSets.put(block, currentIn(block));
        }
        return new LivenessResult(func, inSets, new IdentityHashMap<>(outSets), sweeps);
    }

    /**
     * Get the variables currently live on entry to a block, which may change in later sweeps.
     *
     * @param block The block.
     * @return The live variables, empty if the block has not been visited.
     */
    public OrderedSet<Var> currentIn(BasicBlock block) {
        if (block.getNullable(CommonExts.OWNING_FUNCTION) != func) {
            throw new IllegalArgumentException("block not in function: " + block.toTargetString());
        }
        switch (mergeRule) {
            case SUCCESSOR_ENTRY:
                return outOrEmpty(mergeRule.boundary(block));
            case PREDECESSOR_EXIT:
            default:
                OrderedSet<Var> set = merged.get(block);
                return set == null ? OrderedSet.empty() : set;
        }
    }

    /**
     * Get the variables currently recorded at an instruction, which may change in later sweeps.
     *
     * @param insn The instruction.
     * @return The live variables, empty if the instruction has not been visited.
     */
    public OrderedSet<Var> currentOut(Insn insn) {
        table.get(insn);
        return outOrEmpty(insn);
    }

    private OrderedSet<Var> merge(BasicBlock block) {
        OrderedSet<Var> acc = OrderedSet.empty();
        for (BasicBlock neighbour : mergeRule.neighbours(block)) {
            acc = acc.union(outOrEmpty(mergeRule.boundary(neighbour)));
        }
        return acc;
    }

    private void walk(BasicBlock block, OrderedSet<Var> live) {
        Control control = block.getControl();
        live = table.get(control.insn()).apply(live);
        outSets.put(control.insn(), live);
        List<Effect> effects = block.getEffects();
        for (ListIterator<Effect> it = effects.listIterator(effects.size()); it.hasPrevious(); ) {
            Insn insn = it.previous().insn();
            live = table.get(insn).apply(live);
            outSets.put(insn, live);
        }
    }

    private OrderedSet<Var> outOrEmpty(Insn insn) {
        OrderedSet<Var> set = outSets.get(insn);
        return set == null ? OrderedSet.empty() : set;
    }
}
