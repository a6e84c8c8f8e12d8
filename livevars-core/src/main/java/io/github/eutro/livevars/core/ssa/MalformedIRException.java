package io.github.eutro.livevars.core.ssa;

/**
 * Thrown when IR handed to an analysis breaks the structural rules of the IR,
 * such as a block without a control instruction, or a jump to a block
 * outside the function.
 * <p>
 * This is an error of whoever built the IR; analyses do not try to work around it.
 */
public class MalformedIRException extends RuntimeException {
    public MalformedIRException(String message) {
        super(message);
    }
}
