package com.devkit.dispatch.cli;

import com.devkit.core.engine.RunEngine;
import com.devkit.core.engine.RunRequest;
import com.devkit.core.events.EventBus;
import com.devkit.core.graph.GraphValidationException;
import com.devkit.core.model.RunSummary;
import com.devkit.core.persistence.TicketStoreException;
import com.devkit.workspace.WorkspaceException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: devkit run &lt;parent-id&gt;
 * <p>
 * Executes (or resumes) every child task of the parent ticket. Exit code 0 when all tasks
 * completed and the final review passed, 1 when the run finished incomplete, 2 on a fatal error.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Execute or resume the tasks of a parent ticket")
@Component
public class RunCommand implements Callable<Integer> {

    static final int EXIT_FATAL = 2;

    @Parameters(index = "0", description = "Parent ticket id")
    private String parentId;

    @Option(names = {"--integrate", "-i"},
            description = "Hand the workspace branch off for merge when every task completed and the final review passed")
    private boolean integrate;

    @Option(names = "--discard-on-abort", description = "Discard the workspace if the run is aborted (default: keep it)")
    private boolean discardOnAbort;

    @Option(names = "--max-retries", description = "Failed attempts before a task is skipped (default: devkit.run.max-retries)")
    private Integer maxRetries;

    private final RunEngine runEngine;
    private final EventBus eventBus;

    public RunCommand(RunEngine runEngine, EventBus eventBus) {
        this.runEngine = runEngine;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        if (maxRetries != null && maxRetries < 1) {
            ConsoleOutput.error("--max-retries must be at least 1");
            return EXIT_FATAL;
        }

        var subscription = eventBus.subscribe(parentId, ConsoleOutput::event);
        RunSummary summary;
        try {
            summary = runEngine.execute(new RunRequest(parentId, integrate, discardOnAbort, maxRetries));
        } catch (GraphValidationException e) {
            ConsoleOutput.error("Invalid task graph: " + e.getMessage());
            ConsoleOutput.error("Offending tasks: " + e.getTaskIds());
            return EXIT_FATAL;
        } catch (WorkspaceException e) {
            ConsoleOutput.error("Workspace unavailable: " + e.getMessage());
            return EXIT_FATAL;
        } catch (TicketStoreException e) {
            ConsoleOutput.error("Ticket store error: " + e.getMessage());
            return EXIT_FATAL;
        } catch (Exception e) {
            ConsoleOutput.error("Run failed: " + rootCauseMessage(e));
            return EXIT_FATAL;
        } finally {
            subscription.unsubscribe();
        }

        ConsoleOutput.summary(summary);
        System.out.println();
        if (summary.fullySucceeded()) {
            ConsoleOutput.success(summary.integrated()
                    ? "All tasks completed; branch handed off for merge."
                    : "All tasks completed.");
        } else if (summary.aborted()) {
            ConsoleOutput.warn("Run aborted. Re-run to resume.");
        } else {
            ConsoleOutput.warn("Run incomplete. Fix the reported tasks and re-run to resume.");
        }
        return summary.exitCode();
    }

    static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
