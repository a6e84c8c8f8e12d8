package io.github.eutro.livevars.test;

import io.github.eutro.livevars.core.ext.CommonExts;
import io.github.eutro.livevars.core.ext.MetadataState;
import io.github.eutro.livevars.core.ops.CommonOps;
import io.github.eutro.livevars.core.passes.meta.ComputePreds;
import io.github.eutro.livevars.core.passes.meta.VerifyIntegrity;
import io.github.eutro.livevars.core.ssa.*;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class VerifyIntegrityTest {
    static MalformedIRException assertMalformed(Function func, String message) {
        MalformedIRException e = assertThrows(MalformedIRException.class,
                () -> VerifyIntegrity.INSTANCE.runInPlace(func));
        assertTrue(e.getMessage().startsWith(message), e::getMessage);
        return e;
    }

    @Test
    void testAccepts() {
        VerifyIntegrity.INSTANCE.runInPlace(new Fixtures.StraightLine().func);
        VerifyIntegrity.INSTANCE.runInPlace(new Fixtures.Diamond(true).func);
        Function nested = Fixtures.nested();
        ComputePreds.INSTANCE.runInPlace(nested);
        VerifyIntegrity.INSTANCE.runInPlace(nested);
    }

    @Test
    void testNoEntry() {
        assertMalformed(new Function(), "function has no entry block");
    }

    @Test
    void testMissingControl() {
        Function func = new Function();
        BasicBlock bb = func.newBb();
        new IRBuilder(func, bb).insert(CommonOps.FENCE.insn());
        MalformedIRException e = assertMalformed(func, "block has no control instruction");
        assertTrue(e.getMessage().contains("\n  in block: %0"));
    }

    @Test
    void testDuplicateBlock() {
        Fixtures.StraightLine f = new Fixtures.StraightLine();
        f.func.blocks.add(f.entry);
        assertMalformed(f.func, "function contains duplicate blocks");
    }

    @Test
    void testJumpOutsideFunction() {
        Fixtures.StraightLine other = new Fixtures.StraightLine();
        Function func = new Function();
        BasicBlock bb = func.newBb();
        bb.setControl(Control.br(other.entry));
        assertMalformed(func, "instruction references block not in function");
        assertThrows(MalformedIRException.class, () -> ComputePreds.INSTANCE.runInPlace(func));
    }

    @Test
    void testPredecessorOutsideFunction() {
        Fixtures.StraightLine f = new Fixtures.StraightLine();
        Fixtures.StraightLine other = new Fixtures.StraightLine();
        f.entry.attachExt(CommonExts.PREDS, new ArrayList<>(Collections.singletonList(other.entry)));
        f.func.getExtOrThrow(CommonExts.METADATA_STATE).validate(MetadataState.PREDS);
        MalformedIRException e = assertMalformed(f.func, "predecessor not in function");
        assertTrue(e.getMessage().contains(other.entry.toTargetString()), e::getMessage);
    }

    @Test
    void testLabelOutsideFunction() {
        Fixtures.StraightLine other = new Fixtures.StraightLine();
        Function func = new Function();
        BasicBlock bb = func.newBb();
        IRBuilder ib = new IRBuilder(func, bb);
        ib.insert(CommonOps.SELECT.insn(func.newVar("c"), BlockLabel.of(other.entry), BlockLabel.of(bb)), "addr");
        ib.insertCtrl(CommonOps.RETURN.insn().jumpsTo());
        assertMalformed(func, "instruction references block not in function");
    }

    @Test
    void testTerminatorMidBlock() {
        Function func = new Function();
        BasicBlock bb = func.newBb();
        IRBuilder ib = new IRBuilder(func, bb);
        ib.insert(CommonOps.RETURN.insn());
        ib.insertCtrl(CommonOps.RETURN.insn().jumpsTo());
        assertMalformed(func, "terminator before end of block");
    }

    @Test
    void testControlNotTerminator() {
        Function func = new Function();
        BasicBlock bb = func.newBb();
        bb.setControl(CommonOps.ADD.insn(func.newVar("a"), func.newVar("b")).jumpsTo());
        assertMalformed(func, "control instruction is not a terminator");
    }

    @Test
    void testPhiAfterEffect() {
        Fixtures.Loop f = new Fixtures.Loop();
        Effect phi = f.loop.getEffects().remove(0);
        f.loop.addEffect(phi);
        assertMalformed(f.func, "phi not at block start");
    }
}
