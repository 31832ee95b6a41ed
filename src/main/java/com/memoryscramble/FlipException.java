package com.memoryscramble;

/**
 * Thrown when a flip breaks a game rule.
 *
 * These are ordinary failures: the caller is expected to catch them and report
 * them to the player. The board never retries a rejected flip.
 */
public class FlipException extends Exception {
    private final FlipError error;

    public FlipException(FlipError error, String message) {
        super(message);
        this.error = error;
    }

    /**
     * @return which rule rejected the flip
     */
    public FlipError error() {
        return error;
    }
}
