/**
 * Backward may-liveness over the IR.
 * <p>
 * {@link io.github.eutro.livevars.core.liveness.GenKillClassifier} classifies each instruction,
 * {@link io.github.eutro.livevars.core.liveness.LivenessSolver} iterates to a fixpoint, and
 * {@link io.github.eutro.livevars.core.liveness.LivenessResult} holds the tables.
 */
package io.github.eutro.livevars.core.liveness;
