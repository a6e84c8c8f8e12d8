package io.github.eutro.livevars.core.ops;

import io.github.eutro.livevars.core.ssa.BasicBlock;
import io.github.eutro.livevars.core.ssa.BlockLabel;
import io.github.eutro.livevars.core.ssa.Insn;
import io.github.eutro.livevars.core.ssa.Operand;

import java.util.ArrayList;
import java.util.List;

import static io.github.eutro.livevars.core.ext.CommonExts.markKind;

/**
 * The operations of the IR, each with its {@link InsnKind}.
 * <p>
 * Operand orders follow the kinds: a store is {@code [value, address]},
 * an address computation {@code [base, indices...]}, a phi alternates
 * incoming values and {@link BlockLabel}s.
 */
public class CommonOps {
    /**
     * Control: an unconditional jump to its single target.
     */
    public static final Op BR = markKind(new SimpleOpKey("br"), InsnKind.BRANCH).create();
    /**
     * Control: jumps to the first target if its operand is true, otherwise the second.
     */
    public static final Op BR_IF = markKind(new SimpleOpKey("br_if"), InsnKind.BRANCH).create();
    /**
     * Control: {@code [value, case constant, case label, ...]}, jumps to the matching case,
     * or the first target if none matches.
     */
    public static final Op SWITCH = markKind(new SimpleOpKey("switch"), InsnKind.SWITCH).create();
    /**
     * Control: jumps to the address in its first operand, which must be one of the targets.
     */
    public static final Op INDIRECT_BR = markKind(new SimpleOpKey("indirectbr"), InsnKind.INDIRECT_BRANCH).create();
    /**
     * Control: returns from the function, with its operand, if any.
     */
    public static final Op RETURN = markKind(new SimpleOpKey("return"), InsnKind.RETURN).create();
    /**
     * Control: continues propagating an in-flight exception.
     */
    public static final Op RESUME = markKind(new SimpleOpKey("resume"), InsnKind.RESUME).create();
    /**
     * Control: marks a point that cannot be reached. No operands, no targets.
     */
    public static final Op UNREACHABLE = markKind(new SimpleOpKey("unreachable"), InsnKind.UNREACHABLE).create();
    /**
     * Control: calls the named function with its operands. Targets are the normal
     * and unwind successors. May assign a result.
     */
    public static final UnaryOpKey<String> INVOKE = markKind(new UnaryOpKey<>("invoke", name -> "@" + name), InsnKind.INVOKE);

    public static final Op ADD = arithmetic("add");
    public static final Op SUB = arithmetic("sub");
    public static final Op MUL = arithmetic("mul");
    public static final Op SDIV = arithmetic("sdiv");
    public static final Op UDIV = arithmetic("udiv");
    public static final Op AND = arithmetic("and");
    public static final Op OR = arithmetic("or");
    public static final Op XOR = arithmetic("xor");
    public static final Op SHL = arithmetic("shl");
    public static final Op FNEG = arithmetic("fneg");

    /**
     * Effect: {@code [address]}, reads memory.
     */
    public static final Op LOAD = markKind(new SimpleOpKey("load"), InsnKind.LOAD).create();
    /**
     * Effect: {@code [value, address]}, writes memory. Assigns nothing.
     */
    public static final Op STORE = markKind(new SimpleOpKey("store"), InsnKind.STORE).create();
    /**
     * Effect: {@code [base, indices...]}, computes an address.
     */
    public static final Op GEP = markKind(new SimpleOpKey("getelementptr"), InsnKind.ADDRESS).create();
    /**
     * Effect: allocates stack memory, with an optional element count operand.
     */
    public static final Op ALLOCA = markKind(new SimpleOpKey("alloca"), InsnKind.ALLOCA).create();
    /**
     * Effect: a memory fence. No operands, no result.
     */
    public static final Op FENCE = markKind(new SimpleOpKey("fence"), InsnKind.FENCE).create();
    /**
     * Effect: {@code [address, expected, replacement]}, atomic compare-exchange.
     */
    public static final Op CMPXCHG = markKind(new SimpleOpKey("cmpxchg"), InsnKind.ATOMIC).create();
    /**
     * Effect: {@code [address, value]}, atomic read-modify-write with the named operation.
     */
    public static final UnaryOpKey<String> ATOMIC_RMW = markKind(new UnaryOpKey<>("atomicrmw"), InsnKind.ATOMIC);

    /**
     * Effect: converts its operand, with the named conversion ({@code zext}, {@code bitcast}, ...).
     */
    public static final UnaryOpKey<String> CAST = markKind(new UnaryOpKey<>("cast"), InsnKind.CONVERSION);
    /**
     * Effect: integer comparison with the named predicate.
     */
    public static final UnaryOpKey<String> ICMP = markKind(new UnaryOpKey<>("icmp"), InsnKind.COMPARISON);
    /**
     * Effect: floating point comparison with the named predicate.
     */
    public static final UnaryOpKey<String> FCMP = markKind(new UnaryOpKey<>("fcmp"), InsnKind.COMPARISON);
    /**
     * Effect: calls the named function with its operands.
     */
    public static final UnaryOpKey<String> CALL = markKind(new UnaryOpKey<>("call", name -> "@" + name), InsnKind.CALL);
    /**
     * Effect: returns the value paired with the predecessor control came from.
     * <p>
     * Operands alternate values and the labels of their blocks.
     *
     * @see #phi(List, List)
     */
    public static final Op PHI = markKind(new SimpleOpKey("phi"), InsnKind.PHI).create();

    /**
     * Effect: {@code [condition, then, else]}.
     */
    public static final Op SELECT = markKind(new SimpleOpKey("select"), InsnKind.OTHER).create();
    public static final UnaryOpKey<Integer> EXTRACT_VALUE = markKind(new UnaryOpKey<>("extractvalue"), InsnKind.OTHER);
    public static final UnaryOpKey<Integer> INSERT_VALUE = markKind(new UnaryOpKey<>("insertvalue"), InsnKind.OTHER);
    public static final Op VA_ARG = markKind(new SimpleOpKey("va_arg"), InsnKind.OTHER).create();
    public static final Op LANDING_PAD = markKind(new SimpleOpKey("landingpad"), InsnKind.OTHER).create();

    private static Op arithmetic(String mnemonic) {
        return markKind(new SimpleOpKey(mnemonic), InsnKind.ARITHMETIC).create();
    }

    /**
     * Construct a phi instruction.
     *
     * @param preds  The incoming blocks.
     * @param values The value coming from each block, in the same order.
     * @return The instruction.
     */
    public static Insn phi(List<BasicBlock> preds, List<? extends Operand> values) {
        if (preds.size() != values.size()) {
            throw new IllegalArgumentException(String.format(
                    "phi has %d predecessors but %d values",
                    preds.size(),
                    values.size()));
        }
        List<Operand> args = new ArrayList<>(values.size() * 2);
        for (int i = 0; i < values.size(); i++) {
            args.add(values.get(i));
            args.add(BlockLabel.of(preds.get(i)));
        }
        return PHI.insn(args);
    }
}
