package io.github.eutro.livevars.core.ops;

/**
 * An operation key without immediates, which therefore has only one {@link Op}.
 */
public class SimpleOpKey extends OpKey {
    private final Op op = new Op(this);

    public SimpleOpKey(String mnemonic) {
        super(mnemonic);
    }

    /**
     * Get the single operation of this key.
     *
     * @return The operation.
     */
    public Op create() {
        return op;
    }
}
