package com.meetsched.meetsched_api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SchedulerAlgorithm {
    CLASSICAL("classical"),
    QUANTUM("quantum"),
    HYBRID("hybrid");

    private final String value;

    SchedulerAlgorithm(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SchedulerAlgorithm fromValue(String value) {
        if (value == null) {
            return HYBRID;
        }
        for (SchedulerAlgorithm algorithm : values()) {
            if (algorithm.value.equalsIgnoreCase(value.trim())) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("Unknown scheduling algorithm: " + value);
    }
}
