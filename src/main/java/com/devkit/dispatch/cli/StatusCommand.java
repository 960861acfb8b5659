package com.devkit.dispatch.cli;

import com.devkit.core.engine.RunEngine;
import com.devkit.core.graph.GraphValidationException;
import com.devkit.core.graph.TaskGraph;
import com.devkit.core.model.Task;
import com.devkit.core.model.TaskStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.Set;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * CLI command: devkit status &lt;parent-id&gt;
 * <p>
 * Validates the task graph and shows what a run would do next, without executing anything.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show task statuses of a parent ticket")
@Component
public class StatusCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Parent ticket id")
    private String parentId;

    private final RunEngine runEngine;

    public StatusCommand(RunEngine runEngine) {
        this.runEngine = runEngine;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        TaskGraph graph;
        try {
            graph = runEngine.plan(parentId);
        } catch (GraphValidationException e) {
            ConsoleOutput.error("Invalid task graph: " + e.getMessage());
            return RunCommand.EXIT_FATAL;
        } catch (RuntimeException e) {
            ConsoleOutput.error("Cannot load " + parentId + ": " + RunCommand.rootCauseMessage(e));
            return RunCommand.EXIT_FATAL;
        }

        Set<String> ready = graph.readyTasks().stream().map(Task::id).collect(Collectors.toSet());

        System.out.println();
        System.out.println("PARENT " + parentId);
        System.out.printf("  %-14s %-10s %-8s %-20s %s%n", "TASK", "STATUS", "LABEL", "DEPENDS ON", "TITLE");
        System.out.println("  " + "-".repeat(72));
        for (Task task : graph.tasks()) {
            TaskStatus shown = ready.contains(task.id()) ? TaskStatus.READY : task.status();
            System.out.printf("  %-14s %-10s %-8s %-20s %s%n", task.id(), shown, task.label(),
                    String.join(",", task.dependencies()), task.title());
        }

        int completed = graph.tasksWithStatus(TaskStatus.COMPLETED).size();
        System.out.println();
        ConsoleOutput.info(completed + "/" + graph.size() + " completed, " + ready.size() + " ready");
        return 0;
    }
}
