package io.github.eutro.livevars.core.liveness;

import io.github.eutro.livevars.core.ssa.BasicBlock;
import io.github.eutro.livevars.core.ssa.Function;
import io.github.eutro.livevars.core.util.GraphWalker;

import java.util.*;

/**
 * The order blocks are visited in within a sweep. Only the number of sweeps depends on it.
 */
public enum SweepOrder {
    /**
     * The order of {@link Function#blocks}.
     */
    FUNCTION_ORDER {
        @Override
        public List<BasicBlock> order(Function func) {
            return new ArrayList<>(func.blocks);
        }
    },
    /**
     * The reverse of {@link Function#blocks}.
     */
    REVERSE_FUNCTION_ORDER {
        @Override
        public List<BasicBlock> order(Function func) {
            List<BasicBlock> order = new ArrayList<>(func.blocks);
            Collections.reverse(order);
            return order;
        }
    },
    /**
     * Depth-first post-order from the entry block, so successors tend to come first.
     * Unreachable blocks follow, in function order.
     */
    POSTORDER {
        @Override
        public List<BasicBlock> order(Function func) {
            List<BasicBlock> order = GraphWalker.blockWalker(func).postOrder();
            Set<BasicBlock> seen = new HashSet<>(order);
            for (BasicBlock block : func.blocks) {
                if (seen.add(block)) order.add(block);
            }
            return order;
        }
    },
    ;

    /**
     * Get the blocks of a function in this order.
     *
     * @param func The function.
     * @return A new list of every block of the function.
     */
    public abstract List<BasicBlock> order(Function func);
}
