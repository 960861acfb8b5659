package com.devkit.core.model;

import java.util.Locale;

/**
 * Category of a task. The label decides which execution strategy handles the task.
 */
public enum TaskLabel {
    FEATURE,
    CHORE,
    BUGFIX;

    /**
     * Parses a label as it appears on a ticket ("Feature", "chore", "BUGFIX").
     *
     * @throws IllegalArgumentException if the value is blank or not a known label
     */
    public static TaskLabel fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Task label is missing");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown task label: " + value, e);
        }
    }
}
