package com.devkit.executor;

import com.devkit.core.model.Task;
import com.devkit.core.model.TaskLabel;
import com.devkit.core.model.TaskStatus;
import com.devkit.core.model.WorkspaceHandle;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisabledOnOs(OS.WINDOWS)
class CommandExecutionStrategyTest {

    @TempDir
    Path workspace;

    private TaskContext context() {
        var task = new Task("PROJ-3", "Fix quoting", "Quote fields with commas", TaskLabel.BUGFIX, List.of(),
                TaskStatus.RUNNING, 0, null);
        return new TaskContext(task, "", new WorkspaceHandle("PROJ-1", "devkit/PROJ-1", workspace, "main"), 1, 3);
    }

    @Test
    @DisplayName("exit code 0 is success; output, stdin and environment reach the command")
    void success() throws Exception {
        var strategy = new CommandExecutionStrategy(TaskLabel.BUGFIX,
                List.of("sh", "-c", "cat > instruction.md; echo \"$DEVKIT_TASK_ID $DEVKIT_ATTEMPT $EXTRA\""),
                Map.of("EXTRA", "yes"));

        var result = strategy.execute(context());

        assertTrue(result.success());
        assertEquals("PROJ-3 1 yes", result.output().trim());
        assertTrue(Files.readString(workspace.resolve("instruction.md")).startsWith("# Task: PROJ-3"));
    }

    @Test
    @DisplayName("non-zero exit code is a failure carrying the output")
    void failure() {
        var strategy = new CommandExecutionStrategy(TaskLabel.BUGFIX,
                List.of("sh", "-c", "echo compile error >&2; exit 3"), Map.of());

        var result = strategy.execute(context());

        assertFalse(result.success());
        assertTrue(result.output().startsWith("Exit code 3"));
        assertTrue(result.output().contains("compile error"));
    }

    @Test
    @DisplayName("missing executable is a failure, not an exception")
    void missingExecutable() {
        var strategy = new CommandExecutionStrategy(TaskLabel.BUGFIX, List.of("devkit-no-such-agent"), Map.of());

        var result = strategy.execute(context());

        assertFalse(result.success());
        assertTrue(result.output().contains("devkit-no-such-agent"));
    }

    @Test
    @DisplayName("timed-out attempt leaves no background process writing into the workspace")
    void timeoutKillsChildProcesses() throws Exception {
        var strategy = new CommandExecutionStrategy(TaskLabel.BUGFIX,
                List.of("sh", "-c", "(sleep 2; echo late > late.txt) & wait"), Map.of());
        var context = context();

        try (var dispatcher = new ExecutorDispatcher(List.of(strategy))) {
            var result = dispatcher.run(context.task(), context, Duration.ofMillis(500));
            assertFalse(result.success());
            assertTrue(result.output().startsWith("Timed out after"));
        }

        Thread.sleep(3_000);
        assertFalse(Files.exists(workspace.resolve("late.txt")));
    }

    @Test
    @DisplayName("empty command is rejected")
    void emptyCommand() {
        assertThrows(IllegalArgumentException.class,
                () -> new CommandExecutionStrategy(TaskLabel.CHORE, List.of(), Map.of()));
    }
}
