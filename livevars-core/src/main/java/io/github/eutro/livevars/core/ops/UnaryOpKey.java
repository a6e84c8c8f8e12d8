package io.github.eutro.livevars.core.ops;

import java.util.Objects;
import java.util.function.Function;

/**
 * An operation key with one immediate, such as the predicate of a comparison
 * or the callee of a call.
 *
 * @param <T> The type of the immediate.
 */
public class UnaryOpKey<T> extends OpKey {
    private final Function<T, String> printer;

    public UnaryOpKey(String mnemonic, Function<T, String> printer) {
        super(mnemonic);
        this.printer = printer;
    }

    public UnaryOpKey(String mnemonic) {
        this(mnemonic, Objects::toString);
    }

    /**
     * An operation of this key, with its immediate.
     */
    public class UnaryOp extends Op {
        /**
         * The immediate.
         */
        public final T arg;

        UnaryOp(T arg) {
            super(UnaryOpKey.this);
            this.arg = arg;
        }

        @Override
        public String toString() {
            return key + " " + printer.apply(arg);
        }
    }

    /**
     * Create an operation of this key.
     *
     * @param arg The immediate, not null.
     * @return The operation.
     */
    public UnaryOp create(T arg) {
        if (arg == null) {
            throw new IllegalArgumentException("Argument is null");
        }
        return new UnaryOp(arg);
    }
}
