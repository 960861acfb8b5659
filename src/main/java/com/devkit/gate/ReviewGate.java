package com.devkit.gate;

import com.devkit.core.graph.TaskGraph;
import com.devkit.core.model.ExecutionResult;
import com.devkit.core.model.ReviewVerdict;
import com.devkit.core.model.Task;
import com.devkit.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.stream.Collectors;

/**
 * Asks the {@link JudgmentService} for a verdict on each task's change and, once all tasks are
 * done, on the cumulative change of the run. An error from the judgment service is a failing verdict.
 */
public class ReviewGate {

    private static final Logger log = LoggerFactory.getLogger(ReviewGate.class);

    private final JudgmentService judgmentService;
    private final boolean perTaskEnabled;

    public ReviewGate(JudgmentService judgmentService, boolean perTaskEnabled) {
        this.judgmentService = judgmentService;
        this.perTaskEnabled = perTaskEnabled;
    }

    public ReviewVerdict runPerTask(Task task, ExecutionResult result) {
        if (!perTaskEnabled) {
            return ReviewVerdict.approve("per-task review disabled");
        }
        String context = "Task " + task.id() + " [" + task.label() + "]: " + task.title()
                + "\n\n" + (task.description() == null ? "" : task.description());
        return evaluate("task " + task.id(), result.output(), context);
    }

    /**
     * Reviews the cumulative change of the run for cross-task consistency.
     *
     * @param cumulativeChange summary of every change since the base revision
     */
    public ReviewVerdict runFinal(TaskGraph graph, String cumulativeChange) {
        var completed = graph.tasksWithStatus(TaskStatus.COMPLETED);
        if (completed.isEmpty()) {
            return ReviewVerdict.approve("nothing to review");
        }
        String context = "Final review of " + completed.size() + " completed tasks. Look for duplicated logic "
                + "and inconsistencies between tasks.\n\n"
                + completed.stream()
                        .map(t -> "- " + t.id() + " [" + t.label() + "]: " + t.title())
                        .collect(Collectors.joining("\n"));
        return evaluate("final change", cumulativeChange, context);
    }

    private ReviewVerdict evaluate(String subject, String changeSummary, String context) {
        try {
            Judgment judgment = judgmentService.evaluate(changeSummary, context);
            log.info("Review of {} {}", subject, judgment.passed() ? "passed" : "failed");
            return new ReviewVerdict(judgment.passed(), judgment.findings());
        } catch (RuntimeException e) {
            log.warn("Review of {} could not be completed: {}", subject, e.getMessage());
            return ReviewVerdict.reject("review error: " + e.getMessage());
        }
    }
}
