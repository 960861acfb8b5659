package com.devkit.core.model;

import java.util.List;

/**
 * Terminal report of a run. Every task of the graph appears in {@link #outcomes()}.
 *
 * @param runId          parent ticket id
 * @param outcomes       one entry per task, in creation order
 * @param unsyncedTaskIds tasks whose latest status could not be written to the ticket store
 * @param finalReview    verdict of the final review, null when it did not run
 * @param aborted        whether the operator aborted the run between tasks
 * @param integrated     whether the workspace was handed off for merge
 */
public record RunSummary(
    String runId,
    List<TaskOutcome> outcomes,
    List<String> unsyncedTaskIds,
    ReviewVerdict finalReview,
    boolean aborted,
    boolean integrated
) {

    public RunSummary {
        outcomes = List.copyOf(outcomes);
        unsyncedTaskIds = List.copyOf(unsyncedTaskIds);
    }

    public List<String> completed() {
        return idsWithStatus(TaskStatus.COMPLETED);
    }

    public List<String> skipped() {
        return idsWithStatus(TaskStatus.SKIPPED);
    }

    public List<String> blocked() {
        return idsWithStatus(TaskStatus.BLOCKED);
    }

    /** Tasks left pending, only non-empty after an abort. */
    public List<String> pending() {
        return idsWithStatus(TaskStatus.PENDING);
    }

    public boolean fullySucceeded() {
        return !aborted
                && completed().size() == outcomes.size()
                && (finalReview == null || finalReview.passed());
    }

    public RunSummary withFinalReview(ReviewVerdict verdict) {
        return new RunSummary(runId, outcomes, unsyncedTaskIds, verdict, aborted, integrated);
    }

    public RunSummary withIntegrated(boolean value) {
        return new RunSummary(runId, outcomes, unsyncedTaskIds, finalReview, aborted, value);
    }

    public RunSummary withUnsynced(List<String> ids) {
        return new RunSummary(runId, outcomes, ids, finalReview, aborted, integrated);
    }

    /** 0 when every task completed and the final review passed, 1 otherwise. */
    public int exitCode() {
        return fullySucceeded() ? 0 : 1;
    }

    private List<String> idsWithStatus(TaskStatus status) {
        return outcomes.stream()
                .filter(o -> o.status() == status)
                .map(TaskOutcome::taskId)
                .toList();
    }
}
