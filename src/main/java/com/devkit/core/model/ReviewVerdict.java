package com.devkit.core.model;

/**
 * Verdict of a per-task or final review.
 */
public record ReviewVerdict(boolean passed, String detail) {

    public static ReviewVerdict approve(String detail) {
        return new ReviewVerdict(true, detail);
    }

    public static ReviewVerdict reject(String detail) {
        return new ReviewVerdict(false, detail);
    }
}
