package com.meetsched.meetsched_api.model;

/**
 * Lifecycle of a single scheduling run. {@code SUCCEEDED} and {@code FAILED_FALLBACK} are terminal.
 */
public enum RunState {
    DISPATCHED,
    SOLVING,
    SUCCEEDED,
    FAILED_FALLBACK
}
