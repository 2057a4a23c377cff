package com.taskq.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Priority tier of a task. Dequeue scans tiers from {@link #CRITICAL} down to {@link #LOW}.
 */
public enum TaskPriority {

    LOW(1),
    NORMAL(2),
    HIGH(3),
    CRITICAL(4);

    private final int level;

    TaskPriority(int level) {
        this.level = level;
    }

    public int getLevel() { return level; }

    /** Lower-case tier name used in store keys, e.g. {@code normal}. */
    public String tierName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonValue
    public String toJson() {
        return name();
    }

    /**
     * Accepts a tier name (any case) or the numeric level, so producers that send
     * {@code "priority": 3} and {@code "priority": "high"} both resolve to {@link #HIGH}.
     */
    @JsonCreator
    public static TaskPriority fromJson(String value) {
        if (value == null || value.isBlank()) {
            return NORMAL;
        }
        String trimmed = value.trim();
        for (TaskPriority p : values()) {
            if (p.name().equalsIgnoreCase(trimmed) || String.valueOf(p.level).equals(trimmed)) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unknown priority: " + value);
    }

    /** Tiers in the order dequeue visits them. */
    public static TaskPriority[] scanOrder() {
        return new TaskPriority[]{CRITICAL, HIGH, NORMAL, LOW};
    }
}
