package io.github.eutro.livevars.core.ops;

/**
 * The kind of an instruction, as far as liveness is concerned.
 * <p>
 * Kinds are attached to {@link OpKey}s with
 * {@link io.github.eutro.livevars.core.ext.CommonExts#INSN_KIND}.
 */
public enum InsnKind {
    // terminators
    BRANCH(Category.TERMINATOR),
    SWITCH(Category.TERMINATOR),
    INDIRECT_BRANCH(Category.TERMINATOR),
    RETURN(Category.TERMINATOR),
    RESUME(Category.TERMINATOR),
    UNREACHABLE(Category.TERMINATOR),
    /**
     * A call that is also a terminator, with a normal and an unwind successor.
     */
    INVOKE(Category.TERMINATOR),

    /**
     * Binary and unary arithmetic, bitwise logic and shifts.
     */
    ARITHMETIC(Category.ARITHMETIC),

    /**
     * Reads memory. Operands: {@code [address]}.
     */
    LOAD(Category.MEMORY),
    /**
     * Writes memory. Operands: {@code [value, address]}. Never produces a value.
     */
    STORE(Category.MEMORY),
    /**
     * Computes an address from a base. Operands: {@code [base, indices...]}.
     */
    ADDRESS(Category.MEMORY),
    ALLOCA(Category.MEMORY),
    FENCE(Category.MEMORY),
    /**
     * Atomic read-modify-write and compare-exchange.
     */
    ATOMIC(Category.MEMORY),

    CONVERSION(Category.CONVERSION),
    COMPARISON(Category.COMPARISON),
    CALL(Category.CALL),
    PHI(Category.PHI),
    OTHER(Category.OTHER),
    ;

    /**
     * The broad category of this kind.
     */
    public final Category category;

    InsnKind(Category category) {
        this.category = category;
    }

    /**
     * Whether instructions of this kind end a block.
     *
     * @return Whether this is a terminator kind.
     */
    public boolean isTerminator() {
        return category == Category.TERMINATOR;
    }

    /**
     * The broad categories of instructions.
     */
    public enum Category {
        TERMINATOR,
        ARITHMETIC,
        MEMORY,
        CONVERSION,
        COMPARISON,
        CALL,
        PHI,
        OTHER,
    }
}
