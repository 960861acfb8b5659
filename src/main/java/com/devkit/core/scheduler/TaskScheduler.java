package com.devkit.core.scheduler;

import com.devkit.core.events.DevkitEvent;
import com.devkit.core.events.EventBus;
import com.devkit.core.graph.TaskGraph;
import com.devkit.core.logging.MdcContext;
import com.devkit.core.metrics.DevkitMetrics;
import com.devkit.core.model.ExecutionResult;
import com.devkit.core.model.ReviewVerdict;
import com.devkit.core.model.RunSummary;
import com.devkit.core.model.Task;
import com.devkit.core.model.TaskOutcome;
import com.devkit.core.model.TaskStatus;
import com.devkit.core.model.VerificationResult;
import com.devkit.core.persistence.StateSynchronizer;
import com.devkit.executor.ExecutorDispatcher;
import com.devkit.executor.TaskContext;
import com.devkit.gate.ReviewGate;
import com.devkit.gate.VerificationGate;
import com.devkit.workspace.WorkspaceException;
import com.devkit.workspace.WorkspaceManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The control loop of a run: executes ready tasks strictly one at a time in creation order.
 * <p>
 * Per task: RUNNING, dispatch, verification, per-task review. A task completes only when all
 * three succeed; otherwise its retry count grows and it goes back to PENDING, or to SKIPPED once
 * the retry budget is spent. A skipped task never stops the run: independent tasks keep going
 * and only its dependents end up BLOCKED. Every transition is persisted before the loop moves on.
 * <p>
 * Not thread-safe; one run at a time.
 */
@Service
public class TaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    /** Failure text kept on the task; the tail carries the actual error. */
    static final int MAX_REASON_CHARS = 2_000;

    private final ExecutorDispatcher dispatcher;
    private final VerificationGate verificationGate;
    private final ReviewGate reviewGate;
    private final StateSynchronizer stateSynchronizer;
    private final WorkspaceManager workspaceManager;
    private final EventBus eventBus;
    private final DevkitMetrics metrics;

    public TaskScheduler(ExecutorDispatcher dispatcher,
                         VerificationGate verificationGate,
                         ReviewGate reviewGate,
                         StateSynchronizer stateSynchronizer,
                         WorkspaceManager workspaceManager,
                         EventBus eventBus,
                         DevkitMetrics metrics) {
        this.dispatcher = dispatcher;
        this.verificationGate = verificationGate;
        this.reviewGate = reviewGate;
        this.stateSynchronizer = stateSynchronizer;
        this.workspaceManager = workspaceManager;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Runs the loop until no task is ready or the operator aborts, then marks the remainder blocked.
     * The returned summary has no final review and is not integrated.
     */
    public RunSummary execute(TaskGraph graph, RunContext run) {
        Map<String, Integer> attempts = new HashMap<>();
        boolean aborted = false;

        String enclosingRunId = MdcContext.runId();
        MdcContext.setRun(run.runId());
        try {
            while (true) {
                if (run.control().isAbortRequested()) {
                    aborted = true;
                    log.warn("Abort requested; stopping before the next task");
                    eventBus.publish(DevkitEvent.of("run.aborted", run.runId(), null, Map.of()));
                    break;
                }
                List<Task> ready = graph.readyTasks();
                if (ready.isEmpty()) {
                    break;
                }
                Task task = ready.get(0);
                int attempt = attempts.merge(task.id(), 1, Integer::sum);
                runTask(graph, task, attempt, run);
            }

            if (!aborted) {
                for (Task blocked : graph.markBlocked()) {
                    log.warn("Task {} BLOCKED: {}", blocked.id(), blocked.reason());
                    stateSynchronizer.persist(blocked);
                    stateSynchronizer.appendNote(blocked.id(), "Blocked: " + blocked.reason());
                    metrics.recordTaskOutcome(blocked.label().name(), TaskStatus.BLOCKED.name());
                    eventBus.publish(DevkitEvent.of("task.blocked", run.runId(), blocked.id(),
                            Map.of("reason", blocked.reason())));
                }
            }
        } finally {
            if (enclosingRunId == null) {
                MdcContext.clear();
            } else {
                MdcContext.clearTask();
                MdcContext.setRun(enclosingRunId);
            }
        }

        var outcomes = new ArrayList<TaskOutcome>();
        for (Task task : graph.tasks()) {
            outcomes.add(new TaskOutcome(task.id(), task.title(), task.status(),
                    attempts.getOrDefault(task.id(), 0), task.reason()));
        }
        return new RunSummary(run.runId(), outcomes, stateSynchronizer.unsyncedTaskIds(), null, aborted, false);
    }

    private void runTask(TaskGraph graph, Task task, int attempt, RunContext run) {
        MdcContext.setTask(run.runId(), task.id(), task.label().name(), attempt);
        try {
            Task running = task.withStatus(TaskStatus.RUNNING);
            graph.update(running);
            stateSynchronizer.persist(running);
            log.info("Task {} [{}] attempt {}/{}: {}", task.id(), task.label(), attempt, run.maxRetries(), task.title());
            eventBus.publish(DevkitEvent.of("task.started", run.runId(), task.id(),
                    Map.of("attempt", attempt, "title", String.valueOf(task.title()))));

            long start = System.currentTimeMillis();
            var context = new TaskContext(running, run.parentContext(), run.workspace(), attempt, run.maxRetries());
            ExecutionResult result = dispatcher.run(running, context, run.taskTimeout());
            metrics.recordTaskExecution(task.label().name(), System.currentTimeMillis() - start);

            String failure = evaluate(running, result, run);
            if (failure == null) {
                complete(graph, running, attempt, result, run);
            } else {
                fail(graph, running, attempt, failure, run);
            }
        } finally {
            MdcContext.clearTask();
        }
    }

    /**
     * @return null when the attempt succeeded, the failure reason otherwise
     */
    private String evaluate(Task task, ExecutionResult result, RunContext run) {
        if (!result.success()) {
            return "execution failed: " + result.output();
        }

        VerificationResult verification = verificationGate.run(run.workspace());
        metrics.recordGateResult("verification", verification.passed());
        if (!verification.passed()) {
            return "verification failed at '" + verification.failedCheck() + "': " + verification.detail();
        }

        ReviewVerdict review = reviewGate.runPerTask(task, result);
        metrics.recordGateResult("review", review.passed());
        if (!review.passed()) {
            return "review rejected: " + review.detail();
        }

        try {
            workspaceManager.commit(run.workspace(), task.id() + ": " + task.title());
        } catch (WorkspaceException e) {
            return "commit failed: " + e.getMessage();
        }
        return null;
    }

    private void complete(TaskGraph graph, Task task, int attempt, ExecutionResult result, RunContext run) {
        Task done = task.withStatus(TaskStatus.COMPLETED, null);
        graph.update(done);
        stateSynchronizer.persist(done);
        stateSynchronizer.appendNote(task.id(), "Completed on attempt " + attempt + "."
                + (result.output() == null || result.output().isBlank() ? "" : "\n\n" + tail(result.output())));

        log.info("Task {} COMPLETED on attempt {}", task.id(), attempt);
        metrics.recordTaskOutcome(task.label().name(), TaskStatus.COMPLETED.name());
        metrics.recordAttempts(attempt);
        eventBus.publish(DevkitEvent.of("task.completed", run.runId(), task.id(), Map.of("attempt", attempt)));
    }

    private void fail(TaskGraph graph, Task task, int attempt, String failure, RunContext run) {
        discardAttempt(run);

        Task failed = task.withStatus(TaskStatus.FAILED).withFailure(tail(failure));
        if (failed.retryCount() >= run.maxRetries()) {
            Task skipped = failed.withStatus(TaskStatus.SKIPPED,
                    "skipped after " + failed.retryCount() + " failed attempts; last: " + failed.reason());
            graph.update(skipped);
            stateSynchronizer.persist(skipped);
            stateSynchronizer.appendNote(task.id(), "Skipped: " + skipped.reason());

            log.warn("Task {} SKIPPED after {} failed attempts: {}", task.id(), failed.retryCount(), firstLine(failure));
            metrics.recordTaskOutcome(task.label().name(), TaskStatus.SKIPPED.name());
            metrics.recordAttempts(attempt);
            eventBus.publish(DevkitEvent.of("task.skipped", run.runId(), task.id(),
                    Map.of("attempts", attempt, "reason", firstLine(failure))));
        } else {
            Task retry = failed.withStatus(TaskStatus.PENDING);
            graph.update(retry);
            stateSynchronizer.persist(retry);

            log.warn("Task {} failed (attempt {}/{}), will retry: {}",
                    task.id(), failed.retryCount(), run.maxRetries(), firstLine(failure));
            metrics.recordRetry(task.label().name());
            eventBus.publish(DevkitEvent.of("task.retry", run.runId(), task.id(),
                    Map.of("attempt", attempt, "reason", firstLine(failure))));
        }
    }

    /** Each attempt starts from the last completed task's commit. */
    private void discardAttempt(RunContext run) {
        try {
            workspaceManager.reset(run.workspace());
        } catch (WorkspaceException e) {
            log.error("Could not discard changes of the failed attempt: {}", e.getMessage());
        }
    }

    static String tail(String text) {
        if (text == null || text.length() <= MAX_REASON_CHARS) {
            return text;
        }
        return "..." + text.substring(text.length() - MAX_REASON_CHARS);
    }

    static String firstLine(String text) {
        if (text == null) {
            return "";
        }
        int newline = text.indexOf('\n');
        return newline < 0 ? text : text.substring(0, newline);
    }
}
