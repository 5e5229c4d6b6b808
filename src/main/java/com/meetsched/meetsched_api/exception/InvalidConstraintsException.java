package com.meetsched.meetsched_api.exception;

/**
 * Malformed or contradictory scheduling input. The run does not start.
 */
public class InvalidConstraintsException extends IllegalArgumentException {

    public InvalidConstraintsException(String message) {
        super(message);
    }
}
