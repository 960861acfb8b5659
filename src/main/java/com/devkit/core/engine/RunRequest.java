package com.devkit.core.engine;

/**
 * Operator input for one run.
 *
 * @param parentId        parent ticket whose children are executed; also the run id
 * @param integrate       hand the workspace off for merge when everything completed and the final review passed
 * @param discardOnAbort  on abort, discard the workspace instead of keeping it for inspection
 * @param maxRetries      overrides {@code devkit.run.max-retries} when non-null
 */
public record RunRequest(
    String parentId,
    boolean integrate,
    boolean discardOnAbort,
    Integer maxRetries
) {
    public static RunRequest of(String parentId) {
        return new RunRequest(parentId, false, false, null);
    }
}
