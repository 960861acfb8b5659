package com.devkit.core.model;

/**
 * Outcome of dispatching one task to its execution strategy.
 *
 * @param success whether the strategy reported success
 * @param output  change summary on success, failure detail otherwise
 */
public record ExecutionResult(boolean success, String output) {

    public static ExecutionResult success(String changeSummary) {
        return new ExecutionResult(true, changeSummary);
    }

    public static ExecutionResult failure(String detail) {
        return new ExecutionResult(false, detail);
    }
}
