package com.devkit.gate;

import java.util.List;

/**
 * Structured review returned by the chat model.
 *
 * @param score overall quality, 0-10
 */
public record ReviewFeedback(
    boolean approved,
    String summary,
    List<String> issues,
    int score
) {
    public ReviewFeedback {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }
}
