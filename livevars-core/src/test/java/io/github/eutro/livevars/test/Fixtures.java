package io.github.eutro.livevars.test;

import io.github.eutro.livevars.core.ops.CommonOps;
import io.github.eutro.livevars.core.ssa.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

class Fixtures {
    /**
     * <pre>
     * %0:
     *   $x = load $p
     *   $y = add $x 1
     *   store $y $q
     *   return
     * </pre>
     */
    static class StraightLine {
        final Function func = new Function();
        final BasicBlock entry = func.newBb();
        final Var p = func.newVar("p");
        final Var q = func.newVar("q");
        final Var x, y;
        final Effect load, add, store;
        final Control ret;

        StraightLine() {
            IRBuilder ib = new IRBuilder(func, entry);
            load = CommonOps.LOAD.insn(p).assignTo(x = func.newVar("x"));
            ib.insert(load);
            add = CommonOps.ADD.insn(x, Constant.of(1)).assignTo(y = func.newVar("y"));
            ib.insert(add);
            store = CommonOps.STORE.insn(y, q).assignTo();
            ib.insert(store);
            ib.insertCtrl(ret = CommonOps.RETURN.insn().jumpsTo());
        }
    }

    /**
     * <pre>
     * %0: br_if $c -> %1 %2
     * %1: $v = add $a 1; br -> %3
     * %2: br -> %3
     * %3: return $v
     * </pre>
     * With {@code useInJoin} false, {@code $v} is returned from a block only {@code %1} reaches,
     * and {@code %3} returns nothing.
     */
    static class Diamond {
        final Function func = new Function();
        final BasicBlock entry = func.newBb();
        final BasicBlock left = func.newBb();
        final BasicBlock right = func.newBb();
        final BasicBlock join = func.newBb();
        final Var c = func.newVar("c");
        final Var a = func.newVar("a");
        final Var v;

        Diamond(boolean useInJoin) {
            IRBuilder ib = new IRBuilder(func, entry);
            ib.insertCtrl(CommonOps.BR_IF.insn(c).jumpsTo(left, right));

            ib.setBlock(left);
            v = ib.insert(CommonOps.ADD.insn(a, Constant.of(1)), "v");
            if (useInJoin) {
                ib.insertCtrl(Control.br(join));
            } else {
                BasicBlock use = func.newBb();
                ib.insertCtrl(Control.br(use));
                ib.setBlock(use);
                ib.insert(CommonOps.CALL.create("print").insn(v));
                ib.insertCtrl(Control.br(join));
            }

            ib.setBlock(right);
            ib.insertCtrl(Control.br(join));

            ib.setBlock(join);
            if (useInJoin) {
                ib.insertCtrl(CommonOps.RETURN.insn(v).jumpsTo());
            } else {
                ib.insertCtrl(CommonOps.RETURN.insn().jumpsTo());
            }
        }
    }

    /**
     * <pre>
     * %0: br -> %1
     * %1: $i = phi $i0 %0 $i2 %1
     *     $i2 = add $i 1
     *     br -> %1
     * </pre>
     */
    static class Loop {
        final Function func = new Function();
        final BasicBlock entry = func.newBb();
        final BasicBlock loop = func.newBb();
        final Var i0 = func.newVar("i0");
        final Var i, i2;
        final Control back;

        Loop() {
            IRBuilder ib = new IRBuilder(func, entry);
            ib.insertCtrl(Control.br(loop));

            ib.setBlock(loop);
            i = func.newVar("i");
            i2 = func.newVar("i2");
            ib.insert(CommonOps.phi(Arrays.asList(entry, loop), Arrays.asList(i0, i2)), i);
            ib.insert(CommonOps.ADD.insn(i, Constant.of(1)), i2);
            ib.insertCtrl(back = Control.br(loop));
        }
    }

    /**
     * A function with a nested loop, a switch, a call with an unwind edge and an unreachable block.
     */
    static Function nested() {
        Function func = new Function();
        BasicBlock entry = func.newBb();
        BasicBlock header = func.newBb();
        BasicBlock body = func.newBb();
        BasicBlock inner = func.newBb();
        BasicBlock latch = func.newBb();
        BasicBlock exit = func.newBb();
        BasicBlock unwind = func.newBb();
        BasicBlock dead = func.newBb();

        Var n = func.newVar("n");
        Var buf = func.newVar("buf");
        IRBuilder ib = new IRBuilder(func, entry);
        Var zero = ib.insert(CommonOps.CAST.create("zext").insn(Constant.of(0)), "zero");
        ib.insertCtrl(Control.br(header));

        ib.setBlock(header);
        Var i = func.newVar("i");
        Var next = func.newVar("next");
        ib.insert(CommonOps.phi(Arrays.asList(entry, latch), Arrays.asList(zero, next)), i);
        Var cond = ib.insert(CommonOps.ICMP.create("slt").insn(i, n), "cond");
        ib.insertCtrl(CommonOps.BR_IF.insn(cond).jumpsTo(body, exit));

        ib.setBlock(body);
        Var addr = ib.insert(CommonOps.GEP.insn(buf, i), "addr");
        Var old = ib.insert(CommonOps.LOAD.insn(addr), "old");
        ib.insertCtrl(CommonOps.SWITCH.insn(old, Constant.of(0), BlockLabel.of(latch)).jumpsTo(inner, latch));

        ib.setBlock(inner);
        Var sum = ib.insert(CommonOps.ADD.insn(old, i), "sum");
        ib.insert(CommonOps.STORE.insn(sum, addr));
        Var res = func.newVar("res");
        ib.insertCtrl(CommonOps.INVOKE.create("check").insn(sum).jumpsTo(latch, unwind).assigning(res));

        ib.setBlock(latch);
        ib.insert(CommonOps.FENCE.insn());
        ib.insert(CommonOps.ADD.insn(i, Constant.of(1)), next);
        ib.insertCtrl(Control.br(header));

        ib.setBlock(exit);
        ib.insertCtrl(CommonOps.RETURN.insn(buf).jumpsTo());

        ib.setBlock(unwind);
        Var exn = ib.insert(CommonOps.LANDING_PAD.insn(), "exn");
        ib.insertCtrl(CommonOps.RESUME.insn(exn).jumpsTo());

        ib.setBlock(dead);
        ib.insert(CommonOps.STORE.insn(n, buf));
        ib.insertCtrl(CommonOps.UNREACHABLE.insn().jumpsTo());
        return func;
    }

    static List<Insn> allInsns(Function func) {
        List<Insn> insns = new ArrayList<>();
        for (BasicBlock block : func.blocks) {
            insns.addAll(block.getInsns());
        }
        return insns;
    }
}
