/**
 * The intermediate representation (IR) analysed by this library.
 * <p>
 * A {@link io.github.eutro.livevars.core.ssa.Function} is a list of
 * {@link io.github.eutro.livevars.core.ssa.BasicBlock}s, the first being the entry.
 * Each block holds {@link io.github.eutro.livevars.core.ssa.Effect}s and ends in one
 * {@link io.github.eutro.livevars.core.ssa.Control}, whose targets are the successor
 * edges of the control flow graph. Both wrap an {@link io.github.eutro.livevars.core.ssa.Insn},
 * an operation applied to {@link io.github.eutro.livevars.core.ssa.Operand}s.
 * <p>
 * Values are {@link io.github.eutro.livevars.core.ssa.Var}s. Operands may also be
 * {@link io.github.eutro.livevars.core.ssa.Constant}s or
 * {@link io.github.eutro.livevars.core.ssa.BlockLabel}s, which are never live.
 * <p>
 * The IR is usually in static single assignment form (SSA), hence the name of
 * the package: each variable is assigned by exactly one instruction. Liveness
 * does not depend on this, and works on IR where variables are reassigned.
 * <p>
 * Structural rules are checked by
 * {@link io.github.eutro.livevars.core.passes.meta.VerifyIntegrity}.
 */
package io.github.eutro.livevars.core.ssa;
