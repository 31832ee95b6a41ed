package com.memoryscramble;

import java.io.IOException;

/**
 * Thrown when a board description does not follow the board file format.
 */
public class BoardFormatException extends IOException {
    public BoardFormatException(String message) {
        super(message);
    }
}
