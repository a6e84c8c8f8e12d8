package io.github.eutro.livevars.test;

import io.github.eutro.livevars.core.ext.CommonExts;
import io.github.eutro.livevars.core.ext.MetadataState;
import io.github.eutro.livevars.core.liveness.LivenessOptions;
import io.github.eutro.livevars.core.liveness.LivenessResult;
import io.github.eutro.livevars.core.liveness.MergeRule;
import io.github.eutro.livevars.core.ops.CommonOps;
import io.github.eutro.livevars.core.passes.Passes;
import io.github.eutro.livevars.core.passes.meta.ComputeLiveVars;
import io.github.eutro.livevars.core.ssa.*;
import io.github.eutro.livevars.core.util.OrderedSet;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ComputeLiveVarsTest {
    @Test
    void testAttachesResult() {
        Fixtures.StraightLine f = new Fixtures.StraightLine();
        MetadataState ms = f.func.getExtOrThrow(CommonExts.METADATA_STATE);
        assertFalse(ms.isValid(MetadataState.LIVENESS));

        LivenessResult result = ComputeLiveVars.resultFor(f.func);
        assertTrue(ms.isValid(MetadataState.LIVENESS));
        assertSame(result, f.func.getExtOrThrow(CommonExts.LIVENESS));
        assertSame(result, ComputeLiveVars.resultFor(f.func));
        assertSame(f.func, result.getFunction());
        assertEquals(OrderedSet.of(f.p, f.q), result.getIn(f.entry));
    }

    @Test
    void testRecomputesWhenInvalidated() {
        Fixtures.StraightLine f = new Fixtures.StraightLine();
        LivenessResult first = ComputeLiveVars.resultFor(f.func);

        Var extra = f.func.newVar("extra");
        f.entry.getEffects().add(0, CommonOps.CALL.create("use").insn(extra).assignTo());
        assertSame(first, ComputeLiveVars.resultFor(f.func));

        f.func.getExtOrThrow(CommonExts.METADATA_STATE).varsChanged();
        LivenessResult second = ComputeLiveVars.resultFor(f.func);
        assertNotSame(first, second);
        assertTrue(second.isLiveIn(f.entry, extra));
        assertFalse(first.isLiveIn(f.entry, extra));
    }

    @Test
    void testGraphChangeInvalidatesPreds() {
        Fixtures.Diamond f = new Fixtures.Diamond(true);
        MetadataState ms = f.func.getExtOrThrow(CommonExts.METADATA_STATE);
        new ComputeLiveVars(LivenessOptions.builder()
                .setMergeRule(MergeRule.PREDECESSOR_EXIT)
                .build())
                .runInPlace(f.func);
        assertTrue(ms.isValid(MetadataState.PREDS));
        assertEquals(2, f.join.getPredecessors().size());

        f.right.setControl(CommonOps.RETURN.insn().jumpsTo());
        ms.graphChanged();
        assertFalse(ms.isValid(MetadataState.PREDS));
        assertFalse(ms.isValid(MetadataState.LIVENESS));
        assertEquals(1, f.join.getPredecessors().size());
    }

    @Test
    void testPassChain() {
        Function func = Fixtures.nested();
        Passes.LIVENESS.run(func);
        LivenessResult result = func.getExtOrThrow(CommonExts.LIVENESS);
        assertTrue(result.isConverged());
        assertFalse(result.getLiveValues().isEmpty());
    }

    @Test
    void testRejectsMalformed() {
        Function func = new Function();
        BasicBlock bb = func.newBb();
        new IRBuilder(func, bb).insert(CommonOps.FENCE.insn());

        assertThrows(MalformedIRException.class, () -> ComputeLiveVars.INSTANCE.runInPlace(func));
        assertNull(func.getNullable(CommonExts.LIVENESS));

        MalformedIRException e = assertThrows(MalformedIRException.class, () -> Passes.LIVENESS.run(func));
        assertEquals(1, e.getSuppressed().length);
        assertTrue(e.getSuppressed()[0].getMessage().startsWith("running pass 1 in chain"),
                e.getSuppressed()[0]::getMessage);
    }
}
