package io.github.eutro.livevars.core.ssa;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A literal operand. Never live, since nothing defines it.
 */
public final class Constant extends Operand {
    private final @Nullable Object value;

    private Constant(@Nullable Object value) {
        this.value = value;
    }

    /**
     * Create a constant operand.
     *
     * @param value The value, may be null.
     * @return The operand.
     */
    public static Constant of(@Nullable Object value) {
        return new Constant(value);
    }

    /**
     * Get the literal value.
     *
     * @return The value.
     */
    public @Nullable Object getValue() {
        return value;
    }

    @Override
    public boolean isConstant() {
        return true;
    }

    @Override
    public String toString() {
        return Objects.toString(value);
    }
}
