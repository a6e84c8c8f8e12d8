package io.github.eutro.livevars.core.passes.misc;

import io.github.eutro.livevars.core.passes.IRPass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A pass which runs one pass, then gives its result to another.
 *
 * @param <A> The input type.
 * @param <B> The intermediate type.
 * @param <C> The output type.
 */
public class ChainedPass<A, B, C> implements IRPass<A, C> {
    private final IRPass<A, B> firstPass;
    private final IRPass<B, C> nextPass;

    /**
     * Construct a chained pass.
     *
     * @param firstPass The first pass to run.
     * @param nextPass  The next pass to run.
     */
    public ChainedPass(IRPass<A, B> firstPass, IRPass<B, C> nextPass) {
        this.firstPass = firstPass;
        this.nextPass = nextPass;
    }

    @SuppressWarnings("unchecked")
    private List<IRPass<Object, Object>> listPasses() {
        List<IRPass<?, ?>> passes = new ArrayList<>();
        IRPass<?, ?> pass = this;
        while (pass instanceof ChainedPass) {
            ChainedPass<?, ?, ?> cPass = (ChainedPass<?, ?, ?>) pass;
            passes.add(cPass.nextPass);
            pass = cPass.firstPass;
        }
        passes.add(pass);
        Collections.reverse(passes);
        return (List<IRPass<Object, Object>>) (Object) passes;
    }

    @Override
    public boolean isInPlace() {
        return firstPass.isInPlace() && nextPass.isInPlace();
    }

    @SuppressWarnings("unchecked")
    @Override
    public C run(A a) {
        List<IRPass<Object, Object>> passes = listPasses();
        Object acc = a;
        for (int i = 0; i < passes.size(); i++) {
            try {
                acc = passes.get(i).run(acc);
            } catch (RuntimeException e) {
                e.addSuppressed(new RuntimeException("running pass " + i + " in chain: " + passes.get(i)));
                throw e;
            }
        }
        return (C) acc;
    }

    @Override
    public String toString() {
        return firstPass + " then " + nextPass;
    }
}
