package io.github.eutro.livevars.core.liveness;

import io.github.eutro.livevars.core.ext.CommonExts;
import io.github.eutro.livevars.core.ops.InsnKind;
import io.github.eutro.livevars.core.ssa.*;
import io.github.eutro.livevars.core.util.OrderedSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives the {@link GenKill} of an instruction from its kind, operands and assigned variables.
 * <p>
 * Classification looks at nothing but the instruction itself, so classifying
 * the same instruction twice gives equal results.
 * <ul>
 *     <li>Kill is the variables the instruction assigns.</li>
 *     <li>Gen is its variable operands in order. Constants and block labels are never generated.</li>
 *     <li>A store generates its address, then its value, and never kills.</li>
 *     <li>A load or address computation generates its address first.</li>
 * </ul>
 * Operations with no {@link CommonExts#INSN_KIND kind} are classified by the general rule.
 */
public final class GenKillClassifier {
    private static final Logger logger = LogManager.getLogger(GenKillClassifier.class);

    private GenKillClassifier() {
    }

    /**
     * Classify an effect.
     *
     * @param effect The effect.
     * @return Its gen and kill sets.
     */
    public static GenKill classify(Effect effect) {
        return classify(effect.insn(), effect.getAssignsTo());
    }

    /**
     * Classify a control instruction.
     *
     * @param control The control instruction.
     * @return Its gen and kill sets.
     */
    public static GenKill classify(Control control) {
        return classify(control.insn(), control.getAssignsTo());
    }

    /**
     * Classify an instruction assigning the given variables.
     *
     * @param insn    The instruction.
     * @param results The variables it assigns.
     * @return Its gen and kill sets.
     */
    public static GenKill classify(Insn insn, List<Var> results) {
        InsnKind kind = insn.getNullable(CommonExts.INSN_KIND);
        if (kind == null) {
            logger.warn("no instruction kind for {}, generating all operands", insn.op);
            return general(insn, results);
        }
        switch (kind) {
            case STORE: {
                List<Operand> args = insn.args();
                if (args.size() < 2) {
                    logger.warn("store without an address, generating all operands: {}", insn);
                    return gen(args, OrderedSet.empty());
                }
                if (!results.isEmpty()) {
                    logger.debug("ignoring results of store: {}", results);
                }
                List<Operand> ordered = new ArrayList<>(args.size());
                ordered.add(args.get(1));
                ordered.add(args.get(0));
                ordered.addAll(args.subList(2, args.size()));
                return gen(ordered, OrderedSet.empty());
            }
            case LOAD:
            case ADDRESS:
                // address is operand 0
                return general(insn, results);
            case FENCE:
            case UNREACHABLE:
                if (insn.args().isEmpty() && results.isEmpty()) return GenKill.EMPTY;
                return general(insn, results);
            case BRANCH:
            case SWITCH:
            case INDIRECT_BRANCH:
            case RETURN:
            case RESUME:
            case INVOKE:
            case ARITHMETIC:
            case ALLOCA:
            case ATOMIC:
            case CONVERSION:
            case COMPARISON:
            case CALL:
            case PHI:
            case OTHER:
            default:
                return general(insn, results);
        }
    }

    private static GenKill general(Insn insn, List<Var> results) {
        return gen(insn.args(), OrderedSet.copyOf(results));
    }

    private static GenKill gen(List<Operand> operands, OrderedSet<Var> kill) {
        List<Var> gen = new ArrayList<>(operands.size());
        for (Operand operand : operands) {
            if (operand.isConstant() || operand.isBlockLabel()) continue;
            gen.add((Var) operand);
        }
        if (gen.isEmpty() && kill.isEmpty()) return GenKill.EMPTY;
        return new GenKill(OrderedSet.copyOf(gen), kill);
    }
}
