package com.memoryscramble;

/**
 * Raised when the board's representation invariant is broken.
 *
 * This signals a bug in the board, not a bad request, so it is an
 * {@link AssertionError}: callers catching {@link Exception} do not swallow it.
 */
public class InvariantViolation extends AssertionError {
    public InvariantViolation(String message) {
        super(message);
    }
}
