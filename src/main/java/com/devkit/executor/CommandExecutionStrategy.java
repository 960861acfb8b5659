package com.devkit.executor;

import com.devkit.core.model.ExecutionResult;
import com.devkit.core.model.TaskLabel;
import com.devkit.core.process.ProcessTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Executes a task by running an external command (typically a coding agent CLI) inside the
 * run's workspace. The task instruction is written to the command's stdin; exit code 0 means
 * success and the combined output becomes the change summary.
 */
public class CommandExecutionStrategy implements ExecutionStrategy {

    private static final Logger log = LoggerFactory.getLogger(CommandExecutionStrategy.class);

    private final TaskLabel label;
    private final List<String> command;
    private final Map<String, String> environment;

    public CommandExecutionStrategy(TaskLabel label, List<String> command, Map<String, String> environment) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Command for label " + label + " must not be empty");
        }
        this.label = label;
        this.command = List.copyOf(command);
        this.environment = Map.copyOf(environment);
    }

    @Override
    public TaskLabel label() {
        return label;
    }

    @Override
    public ExecutionResult execute(TaskContext context) {
        String instruction = InstructionBuilder.build(context);
        Path workDir = context.workspace().path();
        Path outputFile = null;
        Process process = null;
        try {
            outputFile = Files.createTempFile("devkit-" + context.task().id().replaceAll("[^A-Za-z0-9-]", "_") + "-", ".log");
            var builder = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(outputFile.toFile());
            builder.environment().putAll(environment);
            builder.environment().put("DEVKIT_TASK_ID", context.task().id());
            builder.environment().put("DEVKIT_TASK_LABEL", label.name());
            builder.environment().put("DEVKIT_ATTEMPT", String.valueOf(context.attempt()));

            log.debug("Running {} in {}", command, workDir);
            process = builder.start();
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(instruction.getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                log.debug("Command closed stdin early: {}", e.getMessage());
            }

            int exitCode = process.waitFor();
            String output = Files.readString(outputFile, StandardCharsets.UTF_8);
            if (exitCode == 0) {
                log.info("Command for task {} succeeded", context.task().id());
                return ExecutionResult.success(output);
            }
            log.warn("Command for task {} exited with code {}", context.task().id(), exitCode);
            return ExecutionResult.failure("Exit code " + exitCode + "\n" + output);
        } catch (IOException e) {
            log.error("Failed to run {} for task {}", command, context.task().id(), e);
            return ExecutionResult.failure("Failed to run " + command.get(0) + ": " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExecutionResult.failure("Interrupted");
        } finally {
            if (process != null && process.isAlive()) {
                log.warn("Killing command for task {} and its child processes", context.task().id());
                ProcessTree.destroy(process, ProcessTree.DEFAULT_GRACE);
            }
            if (outputFile != null) {
                try {
                    Files.deleteIfExists(outputFile);
                } catch (IOException e) {
                    log.debug("Could not delete {}: {}", outputFile, e.getMessage());
                }
            }
        }
    }
}
