package io.github.eutro.livevars.core.ssa;

/**
 * An operand referring to a basic block, such as the incoming block of a phi
 * or a case target of a switch.
 * <p>
 * Labels are not values, so they are never live. The edges of the control flow
 * graph are the {@link Control#targets}, not these.
 */
public final class BlockLabel extends Operand {
    /**
     * The referenced block.
     */
    public final BasicBlock block;

    private BlockLabel(BasicBlock block) {
        this.block = block;
    }

    /**
     * Create a label operand for a block.
     *
     * @param block The block.
     * @return The operand.
     */
    public static BlockLabel of(BasicBlock block) {
        return new BlockLabel(block);
    }

    @Override
    public boolean isBlockLabel() {
        return true;
    }

    @Override
    public String toString() {
        return "label " + block.toTargetString();
    }
}
