package com.taskq.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TaskStatus {

    PENDING("pending"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed"),
    RETRY("retry");

    private final String value;

    TaskStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() { return value; }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /** PENDING and RETRY tasks are the only ones that may sit in a ready-set. */
    public boolean isClaimable() {
        return this == PENDING || this == RETRY;
    }

    @JsonCreator
    public static TaskStatus fromValue(String value) {
        for (TaskStatus s : values()) {
            if (s.value.equalsIgnoreCase(value)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + value);
    }
}
