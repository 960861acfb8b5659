package com.devkit.gate;

import com.devkit.core.process.ProcessTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Runs checks as recipes of the {@code just} command runner ({@code just test}, {@code just lint}, ...).
 * <p>
 * A recipe the workspace's justfile does not define is skipped rather than failed. A check that
 * outlives the timeout is killed and fails.
 */
public class JustCheckRunner implements CheckRunner {

    private static final Logger log = LoggerFactory.getLogger(JustCheckRunner.class);

    private final String executable;
    private final Duration timeout;

    public JustCheckRunner(String executable, Duration timeout) {
        this.executable = executable;
        this.timeout = timeout;
    }

    @Override
    public CheckResult runCheck(String name, Path workingDirectory) {
        Set<String> recipes = listRecipes(workingDirectory);
        if (!recipes.contains(name)) {
            log.info("No '{}' recipe in {}, skipping check", name, workingDirectory);
            return CheckResult.skipped(name, "recipe '" + name + "' not defined");
        }

        log.info("Running check '{}' in {}", name, workingDirectory);
        long start = System.currentTimeMillis();
        var result = run(workingDirectory, List.of(executable, name), timeout);
        long elapsed = System.currentTimeMillis() - start;

        if (result.timedOut()) {
            log.warn("Check '{}' timed out after {}", name, timeout);
            return CheckResult.failed(name, "timed out after " + timeout + "\n" + result.output());
        }
        if (result.exitCode() != 0) {
            log.warn("Check '{}' failed with exit code {} ({}ms)", name, result.exitCode(), elapsed);
            return CheckResult.failed(name, result.output());
        }
        log.info("Check '{}' passed ({}ms)", name, elapsed);
        return CheckResult.passed(name, result.output());
    }

    /**
     * Recipe names defined by the justfile governing {@code workingDirectory}; empty when there is none.
     */
    Set<String> listRecipes(Path workingDirectory) {
        var result = run(workingDirectory, List.of(executable, "--summary"), Duration.ofSeconds(30));
        if (result.timedOut() || result.exitCode() != 0) {
            log.debug("'{} --summary' failed in {}: {}", executable, workingDirectory, result.output());
            return Set.of();
        }
        return parseSummary(result.output());
    }

    /** {@code just --summary} prints recipe names separated by whitespace on one line. */
    static Set<String> parseSummary(String output) {
        if (output == null || output.isBlank()) {
            return Set.of();
        }
        return new LinkedHashSet<>(Arrays.asList(output.trim().split("\\s+")));
    }

    record ProcessOutcome(int exitCode, String output, boolean timedOut) {}

    ProcessOutcome run(Path workingDirectory, List<String> command, Duration limit) {
        Path outputFile = null;
        Process process = null;
        try {
            outputFile = Files.createTempFile("devkit-check-", ".log");
            process = new ProcessBuilder(command)
                    .directory(workingDirectory.toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(outputFile.toFile())
                    .start();
            boolean finished = process.waitFor(limit.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                ProcessTree.destroy(process, ProcessTree.DEFAULT_GRACE);
                return new ProcessOutcome(-1, Files.readString(outputFile, StandardCharsets.UTF_8), true);
            }
            return new ProcessOutcome(process.exitValue(), Files.readString(outputFile, StandardCharsets.UTF_8), false);
        } catch (IOException e) {
            log.warn("Could not run {}: {}", command, e.getMessage());
            return new ProcessOutcome(-1, "could not run " + String.join(" ", command) + ": " + e.getMessage(), false);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new ProcessOutcome(-1, "interrupted", false);
        } finally {
            if (process != null && process.isAlive()) {
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
