package com.devkit.dispatch.cli;

import com.devkit.core.engine.RunEngine;
import com.devkit.core.model.ReleaseMode;
import com.devkit.workspace.WorkspaceException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: devkit release &lt;run-id&gt; --mode INTEGRATE|DISCARD
 */
@Command(name = "release", mixinStandardHelpOptions = true,
        description = "Integrate or discard the workspace of a finished or aborted run")
@Component
public class ReleaseCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Run (parent ticket) id")
    private String runId;

    @Option(names = {"--mode", "-m"}, required = true,
            description = "INTEGRATE (hand the branch off for merge) or DISCARD (delete checkout and branch)")
    private ReleaseMode mode;

    private final RunEngine runEngine;

    public ReleaseCommand(RunEngine runEngine) {
        this.runEngine = runEngine;
    }

    @Override
    public Integer call() {
        try {
            if (!runEngine.release(runId, mode)) {
                ConsoleOutput.error("No workspace found for " + runId);
                return 1;
            }
        } catch (WorkspaceException e) {
            ConsoleOutput.error("Release failed: " + e.getMessage());
            return 1;
        }
        ConsoleOutput.success("Workspace of " + runId + " released (" + mode + ")");
        return 0;
    }
}
