package io.github.eutro.livevars.core.liveness;

import io.github.eutro.livevars.core.ssa.BasicBlock;
import io.github.eutro.livevars.core.ssa.Effect;
import io.github.eutro.livevars.core.ssa.Insn;

import java.util.List;

/**
 * Which neighbours of a block are merged into the live set its backward walk starts from,
 * and which of their instructions is read.
 */
public enum MergeRule {
    /**
     * Merge the first instruction of every successor. The live-in set of a block is the
     * set recorded at its first instruction.
     */
    SUCCESSOR_ENTRY {
        @Override
        public List<BasicBlock> neighbours(BasicBlock block) {
            return block.getSuccessors();
        }

        @Override
        public Insn boundary(BasicBlock neighbour) {
            List<Effect> effects = neighbour.getEffects();
            return effects.isEmpty() ? neighbour.getControl().insn() : effects.get(0).insn();
        }
    },
    /**
     * Merge the control instruction of every predecessor. The live-in set of a block is
     * the merged set itself.
     * <p>
     * This is the merge as the analysis was first worded, kept for comparison with
     * {@link #SUCCESSOR_ENTRY}, the default. It carries sets forward along edges, so a use in a
     * later block is never live in an earlier one.
     */
    PREDECESSOR_EXIT {
        @Override
        public List<BasicBlock> neighbours(BasicBlock block) {
            return block.getPredecessors();
        }

        @Override
        public Insn boundary(BasicBlock neighbour) {
            return neighbour.getControl().insn();
        }
    },
    ;

    /**
     * Get the blocks whose boundaries are merged for a block.
     *
     * @param block The block.
     * @return The neighbouring blocks.
     */
    public abstract List<BasicBlock> neighbours(BasicBlock block);

    /**
     * Get the instruction of a neighbour whose recorded set is merged.
     *
     * @param neighbour The neighbouring block.
     * @return The instruction.
     */
    public abstract Insn boundary(BasicBlock neighbour);
}
