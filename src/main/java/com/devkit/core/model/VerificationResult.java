package com.devkit.core.model;

/**
 * Result of the post-task check sequence.
 *
 * @param passed      true when every check passed or was skipped
 * @param failedCheck name of the first failing check, null when passed
 * @param detail      output of the failing check, or a short pass summary
 */
public record VerificationResult(boolean passed, String failedCheck, String detail) {

    public static VerificationResult passed(String detail) {
        return new VerificationResult(true, null, detail);
    }

    public static VerificationResult failed(String check, String detail) {
        return new VerificationResult(false, check, detail);
    }
}
