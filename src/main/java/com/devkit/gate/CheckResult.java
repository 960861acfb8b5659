package com.devkit.gate;

/**
 * Outcome of one named check.
 *
 * @param skipped the check is not defined for this workspace; counts as passed
 */
public record CheckResult(String name, boolean passed, boolean skipped, String output) {

    public static CheckResult passed(String name, String output) {
        return new CheckResult(name, true, false, output);
    }

    public static CheckResult failed(String name, String output) {
        return new CheckResult(name, false, false, output);
    }

    public static CheckResult skipped(String name, String reason) {
        return new CheckResult(name, true, true, reason);
    }
}
