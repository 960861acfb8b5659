package com.devkit.gate;

/**
 * Verdict returned by a {@link JudgmentService}.
 */
public record Judgment(boolean passed, String findings) {}
