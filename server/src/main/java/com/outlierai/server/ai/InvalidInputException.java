package com.outlierai.server.ai;

/**
 * Malformed input: bad shapes, mismatched dimensions, non-finite entries, too few rows for the
 * requested neighbourhood or group count, or out-of-range parameters.
 */
public class InvalidInputException extends IllegalArgumentException {

    public InvalidInputException(String message) {
        super(message);
    }
}
