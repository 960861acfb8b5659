package com.devkit.core.engine;

import com.devkit.config.DevkitProperties;
import com.devkit.core.events.DevkitEvent;
import com.devkit.core.events.EventBus;
import com.devkit.core.graph.TaskGraph;
import com.devkit.core.logging.MdcContext;
import com.devkit.core.metrics.DevkitMetrics;
import com.devkit.core.model.ReleaseMode;
import com.devkit.core.model.ReviewVerdict;
import com.devkit.core.model.RunSummary;
import com.devkit.core.model.TaskStatus;
import com.devkit.core.model.WorkspaceHandle;
import com.devkit.core.persistence.StateSynchronizer;
import com.devkit.core.persistence.TaskRecord;
import com.devkit.core.persistence.TicketStore;
import com.devkit.core.scheduler.RunContext;
import com.devkit.core.scheduler.RunControl;
import com.devkit.core.scheduler.TaskScheduler;
import com.devkit.gate.ReviewGate;
import com.devkit.workspace.WorkspaceException;
import com.devkit.workspace.WorkspaceManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Drives one run from ticket load to integration hand-off.
 * <p>
 * Configuration errors (cycles, dangling references, bad labels) and workspace acquisition
 * failures are thrown before any task executes. Everything after that is absorbed into the
 * returned {@link RunSummary}.
 */
@Service
public class RunEngine {

    private static final Logger log = LoggerFactory.getLogger(RunEngine.class);

    private final TicketStore ticketStore;
    private final StateSynchronizer stateSynchronizer;
    private final WorkspaceManager workspaceManager;
    private final TaskScheduler scheduler;
    private final ReviewGate reviewGate;
    private final EventBus eventBus;
    private final DevkitMetrics metrics;
    private final DevkitProperties properties;

    public RunEngine(TicketStore ticketStore,
                     StateSynchronizer stateSynchronizer,
                     WorkspaceManager workspaceManager,
                     TaskScheduler scheduler,
                     ReviewGate reviewGate,
                     EventBus eventBus,
                     DevkitMetrics metrics,
                     DevkitProperties properties) {
        this.ticketStore = ticketStore;
        this.stateSynchronizer = stateSynchronizer;
        this.workspaceManager = workspaceManager;
        this.scheduler = scheduler;
        this.reviewGate = reviewGate;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
    }

    /**
     * Loads and validates the graph without executing anything. Persisted statuses are applied
     * the same way a resumed run applies them.
     */
    public TaskGraph plan(String parentId) {
        List<TaskRecord> records = ticketStore.getChildTasks(parentId);
        TaskGraph graph = TaskGraph.load(records);
        graph.seed(stateSynchronizer.loadStatuses(parentId));
        return graph;
    }

    public RunSummary execute(RunRequest request) {
        return execute(request, new RunControl(abortMarker(request.parentId())));
    }

    public RunSummary execute(RunRequest request, RunControl control) {
        String runId = request.parentId();
        MdcContext.setRun(runId);
        try {
            log.info("Starting run {}", runId);
            stateSynchronizer.reset();
            clearAbortMarker(control);

            List<TaskRecord> records = ticketStore.getChildTasks(runId);
            TaskGraph graph = TaskGraph.load(records);
            Map<String, TaskStatus> persisted = stateSynchronizer.loadStatuses(runId);
            for (String requeued : graph.seed(persisted)) {
                stateSynchronizer.persist(graph.get(requeued));
            }
            int alreadyDone = graph.tasksWithStatus(TaskStatus.COMPLETED).size();
            if (alreadyDone > 0) {
                log.info("Resuming run {}: {}/{} tasks already completed", runId, alreadyDone, graph.size());
            }

            WorkspaceHandle workspace = workspaceManager.acquire(runId);
            eventBus.publish(DevkitEvent.of("run.started", runId, null,
                    Map.of("tasks", graph.size(), "completed", alreadyDone, "workspace", workspace.path().toString())));

            int maxRetries = request.maxRetries() != null ? request.maxRetries() : properties.getRun().getMaxRetries();
            var context = new RunContext(runId, workspace, ticketStore.getParentContext(runId), maxRetries,
                    properties.getRun().getTaskTimeout(), control);

            RunSummary summary = scheduler.execute(graph, context);
            summary = summary.withUnsynced(stateSynchronizer.retryPending());

            summary = summary.aborted()
                    ? handleAbort(summary, workspace, request)
                    : finish(summary, graph, workspace, request);

            String result = summary.fullySucceeded() ? "succeeded" : summary.aborted() ? "aborted" : "incomplete";
            metrics.recordRunResult(result);
            eventBus.publish(DevkitEvent.of("run.completed", runId, null, Map.of(
                    "result", result,
                    "completed", summary.completed().size(),
                    "skipped", summary.skipped().size(),
                    "blocked", summary.blocked().size())));
            log.info("Run {} {}: completed={} skipped={} blocked={}", runId, result,
                    summary.completed(), summary.skipped(), summary.blocked());
            return summary;
        } finally {
            clearAbortMarker(control);
            MdcContext.clear();
        }
    }

    private RunSummary finish(RunSummary summary, TaskGraph graph, WorkspaceHandle workspace, RunRequest request) {
        String cumulativeChange;
        try {
            cumulativeChange = workspaceManager.diffSummary(workspace);
        } catch (WorkspaceException e) {
            log.warn("Could not compute the cumulative change: {}", e.getMessage());
            cumulativeChange = "";
        }
        ReviewVerdict verdict = reviewGate.runFinal(graph, cumulativeChange);
        metrics.recordGateResult("final_review", verdict.passed());
        summary = summary.withFinalReview(verdict);
        eventBus.publish(DevkitEvent.of(verdict.passed() ? "review.final.passed" : "review.final.failed",
                summary.runId(), null, Map.of("detail", String.valueOf(verdict.detail()))));

        if (!request.integrate()) {
            log.info("Workspace kept at {} (integration not requested)", workspace.path());
            return summary;
        }
        if (!summary.fullySucceeded()) {
            log.warn("Not integrating {}: skipped={} blocked={} finalReviewPassed={}", summary.runId(),
                    summary.skipped(), summary.blocked(), verdict.passed());
            return summary;
        }
        try {
            workspaceManager.release(workspace, ReleaseMode.INTEGRATE);
            eventBus.publish(DevkitEvent.of("workspace.integrated", summary.runId(), null,
                    Map.of("branch", workspace.branchName())));
            return summary.withIntegrated(true);
        } catch (WorkspaceException e) {
            log.error("Integration of {} failed: {}", summary.runId(), e.getMessage());
            return summary;
        }
    }

    private RunSummary handleAbort(RunSummary summary, WorkspaceHandle workspace, RunRequest request) {
        if (request.discardOnAbort()) {
            try {
                workspaceManager.release(workspace, ReleaseMode.DISCARD);
                log.warn("Run {} aborted; workspace discarded", summary.runId());
            } catch (WorkspaceException e) {
                log.error("Discarding the workspace of {} failed: {}", summary.runId(), e.getMessage());
            }
        } else {
            log.warn("Run {} aborted; workspace kept at {} for inspection", summary.runId(), workspace.path());
        }
        return summary;
    }

    /**
     * Explicit integrate or discard of a workspace left behind by an earlier run.
     *
     * @return false when no workspace exists for {@code runId}
     */
    public boolean release(String runId, ReleaseMode mode) {
        var handle = workspaceManager.find(runId);
        if (handle.isEmpty()) {
            return false;
        }
        workspaceManager.release(handle.get(), mode);
        eventBus.publish(DevkitEvent.of("workspace.released", runId, null, Map.of("mode", mode.name())));
        return true;
    }

    /** Requests an abort of the run executing {@code runId} in another process. */
    public Path requestAbort(String runId) throws IOException {
        Path marker = abortMarker(runId);
        Files.createDirectories(marker.getParent());
        if (!Files.exists(marker)) {
            Files.createFile(marker);
        }
        log.info("Abort requested for {} via {}", runId, marker);
        return marker;
    }

    Path abortMarker(String runId) {
        return RunControl.markerFor(Path.of(properties.getRun().getStateDir()), runId);
    }

    private static void clearAbortMarker(RunControl control) {
        Path marker = control.abortMarker();
        if (marker == null) {
            return;
        }
        try {
            Files.deleteIfExists(marker);
        } catch (IOException e) {
            log.warn("Could not remove abort marker {}: {}", marker, e.getMessage());
        }
    }
}
