package io.github.eutro.livevars.core.ops;

import io.github.eutro.livevars.core.ext.ExtHolder;

/**
 * An operation key, a type of operation without its immediates.
 */
public abstract class OpKey extends ExtHolder {
    /**
     * The name of the operation, used when printing.
     */
    public final String mnemonic;

    /**
     * Construct an operation key.
     *
     * @param mnemonic The name of the operation.
     */
    protected OpKey(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
