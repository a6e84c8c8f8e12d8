package io.github.eutro.livevars.test;

import io.github.eutro.livevars.core.liveness.*;
import io.github.eutro.livevars.core.ops.CommonOps;
import io.github.eutro.livevars.core.ssa.*;
import io.github.eutro.livevars.core.util.OrderedSet;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class LivenessSolverTest {
    static final LivenessOptions IN_ORDER = LivenessOptions.builder()
            .setMergeRule(MergeRule.SUCCESSOR_ENTRY)
            .setSweepOrder(SweepOrder.FUNCTION_ORDER)
            .setMaxSweeps(0)
            .build();

    static LivenessResult solve(Function func, LivenessOptions options) {
        return new LivenessSolver(func, options).solve().result();
    }

    @Test
    void testStraightLine() {
        Fixtures.StraightLine f = new Fixtures.StraightLine();
        LivenessResult result = solve(f.func, IN_ORDER);

        assertEquals(OrderedSet.of(f.p, f.q), result.getIn(f.entry));
        assertTrue(result.getOut(f.ret).isEmpty());
        assertEquals(OrderedSet.of(f.q, f.y), result.getOut(f.store));
        assertEquals(OrderedSet.of(f.q, f.x), result.getOut(f.add));
        assertEquals(OrderedSet.of(f.q, f.p), result.getOut(f.load));
        assertFalse(result.isLiveIn(f.entry, f.x));
        assertFalse(result.isLiveIn(f.entry, f.y));
        assertTrue(result.isLiveAt(f.store.insn(), f.y));
        assertTrue(result.isLiveAt(f.load.insn(), f.p));
        assertFalse(result.isLiveAt(f.add.insn(), f.p));
        assertFalse(result.isLiveAt(f.ret.insn(), f.y));
        assertTrue(result.isConverged());
        assertEquals(2, result.getSweeps());
    }

    @Test
    void testDiamondJoinReadsValue() {
        Fixtures.Diamond f = new Fixtures.Diamond(true);
        LivenessResult result = solve(f.func, IN_ORDER);

        assertTrue(result.isLiveIn(f.join, f.v));
        assertTrue(result.isLiveIn(f.right, f.v));
        assertFalse(result.isLiveIn(f.left, f.v));
        assertEquals(OrderedSet.of(f.a), result.getIn(f.left));
        assertEquals(OrderedSet.of(f.a, f.v, f.c), result.getIn(f.entry));
    }

    @Test
    void testDiamondValueOnOnePathOnly() {
        Fixtures.Diamond f = new Fixtures.Diamond(false);
        LivenessResult result = solve(f.func, IN_ORDER);

        assertFalse(result.isLiveIn(f.right, f.v));
        assertFalse(result.isLiveIn(f.join, f.v));
        assertFalse(result.isLiveIn(f.entry, f.v));
        assertTrue(result.getIn(f.right).isEmpty());
        assertEquals(OrderedSet.of(f.a, f.c), result.getIn(f.entry));
        assertTrue(result.getLiveValues().contains(f.v));
    }

    @Test
    void testLoopFeedsBack() {
        Fixtures.Loop f = new Fixtures.Loop();
        LivenessSolver solver = new LivenessSolver(f.func, IN_ORDER);

        assertTrue(solver.sweep());
        assertTrue(solver.currentOut(f.back.insn()).isEmpty());
        OrderedSet<Var> firstIn = solver.currentIn(f.loop);
        assertEquals(OrderedSet.of(f.i0, f.i2), firstIn);

        // the back edge now carries the loop's own live-in set
        assertTrue(solver.sweep());
        assertEquals(firstIn, solver.currentOut(f.back.insn()));

        assertFalse(solver.sweep());
        assertEquals(LivenessSolver.State.CONVERGED, solver.getState());

        LivenessResult result = solver.result();
        assertEquals(result.getOut(f.back), result.getIn(f.loop));
        assertEquals(OrderedSet.of(f.i0, f.i), result.getOut(f.loop.getEffects().get(1)));
        assertEquals(3, result.getSweeps());
    }

    @Test
    void testStateTransitions() {
        Fixtures.Loop f = new Fixtures.Loop();
        LivenessSolver solver = new LivenessSolver(f.func, IN_ORDER);
        assertEquals(LivenessSolver.State.UNCONVERGED, solver.getState());
        assertThrows(IllegalStateException.class, solver::result);
        solver.sweep();
        assertEquals(LivenessSolver.State.UNCONVERGED, solver.getState());
        assertThrows(IllegalStateException.class, solver::result);
        solver.solve();
        assertEquals(LivenessSolver.State.CONVERGED, solver.getState());
        assertNotNull(solver.result());
    }

    @Test
    void testFixpointIsStable() {
        Function func = Fixtures.nested();
        LivenessSolver solver = new LivenessSolver(func, IN_ORDER).solve();
        LivenessResult before = solver.result();
        for (int i = 0; i < 3; i++) {
            assertFalse(solver.sweep());
        }
        LivenessResult after = solver.result();
        assertEquals(LivenessSolver.State.CONVERGED, solver.getState());
        for (Insn insn : Fixtures.allInsns(func)) {
            assertTrue(before.getOut(insn).sameOrder(after.getOut(insn)));
        }
    }

    @Test
    void testMonotonic() {
        Function func = Fixtures.nested();
        LivenessSolver solver = new LivenessSolver(func, IN_ORDER);
        Map<BasicBlock, OrderedSet<Var>> last = new HashMap<>();
        for (BasicBlock block : func.blocks) {
            last.put(block, OrderedSet.empty());
        }
        boolean changed = true;
        while (changed) {
            changed = solver.sweep();
            for (BasicBlock block : func.blocks) {
                OrderedSet<Var> in = solver.currentIn(block);
                assertTrue(in.containsAll(last.get(block)),
                        () -> "live-in of " + block.toTargetString() + " shrank to " + in);
                last.put(block, in);
            }
        }
    }

    @Test
    void testNested() {
        Function func = Fixtures.nested();
        LivenessResult result = solve(func, IN_ORDER);
        OrderedSet<Var> entryIn = result.getIn(func.getEntry());
        Set<String> names = new HashSet<>();
        for (Var var : entryIn) {
            names.add(var.name);
        }
        // phis read every incoming value, so the back edge value reaches the entry
        assertEquals(new HashSet<>(Arrays.asList("n", "buf", "next")), names);

        BasicBlock dead = func.blocks.get(7);
        assertEquals(2, result.getIn(dead).size());

        BasicBlock unwind = func.blocks.get(6);
        assertTrue(result.getIn(unwind).isEmpty());
    }

    @Test
    void testOrderIndependent() {
        Function func = Fixtures.nested();
        LivenessResult expected = solve(func, IN_ORDER);
        Random random = new Random(0x11FE);
        for (int trial = 0; trial < 50; trial++) {
            List<BasicBlock> order = new ArrayList<>(func.blocks);
            Collections.shuffle(order, random);
            LivenessResult actual = new LivenessSolver(func, IN_ORDER, order).solve().result();
            for (BasicBlock block : func.blocks) {
                assertEquals(expected.getIn(block), actual.getIn(block), order::toString);
            }
            for (Insn insn : Fixtures.allInsns(func)) {
                assertEquals(expected.getOut(insn), actual.getOut(insn), order::toString);
            }
        }
        for (SweepOrder sweepOrder : SweepOrder.values()) {
            LivenessResult actual = solve(func, LivenessOptions.builder()
                    .setSweepOrder(sweepOrder)
                    .setMergeRule(MergeRule.SUCCESSOR_ENTRY)
                    .build());
            for (BasicBlock block : func.blocks) {
                assertEquals(expected.getIn(block), actual.getIn(block), sweepOrder::toString);
            }
        }
    }

    @Test
    void testDeterministic() {
        Function func = Fixtures.nested();
        LivenessResult first = solve(func, IN_ORDER);
        LivenessResult second = solve(func, IN_ORDER);
        for (BasicBlock block : func.blocks) {
            assertTrue(first.getIn(block).sameOrder(second.getIn(block)));
        }
        for (Insn insn : Fixtures.allInsns(func)) {
            assertTrue(first.getOut(insn).sameOrder(second.getOut(insn)));
        }
        assertEquals(first.getSweeps(), second.getSweeps());
        assertEquals(LivenessPrinter.print(func, first), LivenessPrinter.print(func, second));
    }

    @Test
    void testPredecessorExit() {
        Fixtures.Diamond f = new Fixtures.Diamond(true);
        LivenessResult result = solve(f.func, LivenessOptions.builder()
                .setMergeRule(MergeRule.PREDECESSOR_EXIT)
                .setSweepOrder(SweepOrder.FUNCTION_ORDER)
                .build());

        assertTrue(result.getIn(f.entry).isEmpty());
        for (BasicBlock block : f.func.blocks) {
            OrderedSet<Var> merged = OrderedSet.empty();
            for (BasicBlock pred : block.getPredecessors()) {
                merged = merged.union(result.getOut(pred.getControl()));
            }
            assertEquals(merged, result.getIn(block));
        }
    }

    @Test
    void testSweepLimit() {
        Fixtures.Loop f = new Fixtures.Loop();
        LivenessSolver solver = new LivenessSolver(f.func, LivenessOptions.builder()
                .setSweepOrder(SweepOrder.FUNCTION_ORDER)
                .setMergeRule(MergeRule.SUCCESSOR_ENTRY)
                .setMaxSweeps(1)
                .build());
        assertThrows(IllegalStateException.class, solver::solve);
        assertEquals(1, solver.getSweeps());
        assertThrows(IllegalArgumentException.class, () -> LivenessOptions.builder().setMaxSweeps(-1));
    }

    @Test
    void testForeignQueries() {
        Fixtures.StraightLine f = new Fixtures.StraightLine();
        Fixtures.StraightLine g = new Fixtures.StraightLine();
        LivenessResult result = solve(f.func, IN_ORDER);
        assertThrows(IllegalArgumentException.class, () -> result.getIn(g.entry));
        assertThrows(IllegalArgumentException.class, () -> result.getOut(g.load));
        assertThrows(IllegalArgumentException.class, () -> result.getOut(CommonOps.FENCE.insn()));

        List<BasicBlock> badOrder = Arrays.asList(f.entry, f.entry);
        assertThrows(IllegalArgumentException.class, () -> new LivenessSolver(f.func, IN_ORDER, badOrder));
    }

    @Test
    void testJumpOutsideFunction() {
        Function other = new Function();
        BasicBlock foreign = other.newBb();
        Var w = other.newVar("w");
        foreign.setControl(CommonOps.RETURN.insn(w).jumpsTo());

        Function func = new Function();
        BasicBlock entry = func.newBb();
        entry.setControl(Control.br(foreign));

        LivenessOptions predExit = LivenessOptions.builder()
                .setMergeRule(MergeRule.PREDECESSOR_EXIT)
                .setSweepOrder(SweepOrder.FUNCTION_ORDER)
                .build();
        for (LivenessOptions options : Arrays.asList(IN_ORDER, predExit)) {
            MalformedIRException e = assertThrows(MalformedIRException.class,
                    () -> solve(func, options));
            assertTrue(e.getMessage().startsWith("jump to block not in function"), e::getMessage);
        }
    }

    @Test
    void testNoValuesFromConstantsOrLabels() {
        Function func = Fixtures.nested();
        LivenessResult result = solve(func, IN_ORDER);
        for (Var var : result.getLiveValues()) {
            assertFalse(var.isConstant());
            assertFalse(var.isBlockLabel());
        }
    }
}
