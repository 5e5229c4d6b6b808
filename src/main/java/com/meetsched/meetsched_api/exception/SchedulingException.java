package com.meetsched.meetsched_api.exception;

/**
 * Raised only when the classical fallback itself cannot produce a schedule.
 */
public class SchedulingException extends RuntimeException {

    public SchedulingException(String message, Throwable cause) {
        super(message, cause);
    }
}
