package com.devkit.dispatch.cli;

import com.devkit.core.engine.RunEngine;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.util.concurrent.Callable;

/**
 * CLI command: devkit abort &lt;run-id&gt;
 * <p>
 * Asks a running {@code devkit run} to stop once its current task finishes.
 */
@Command(name = "abort", mixinStandardHelpOptions = true, description = "Stop a run after its current task")
@Component
public class AbortCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Run (parent ticket) id")
    private String runId;

    private final RunEngine runEngine;

    public AbortCommand(RunEngine runEngine) {
        this.runEngine = runEngine;
    }

    @Override
    public Integer call() {
        try {
            var marker = runEngine.requestAbort(runId);
            ConsoleOutput.info("Abort requested for " + runId + " (" + marker + ")");
            return 0;
        } catch (IOException e) {
            ConsoleOutput.error("Could not request abort: " + e.getMessage());
            return 1;
        }
    }
}
