package com.devkit.dispatch.cli;

import com.devkit.core.events.DevkitEvent;
import com.devkit.core.model.RunSummary;
import com.devkit.core.model.TaskOutcome;
import com.devkit.core.model.TaskStatus;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output for the devkit CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) DEVKIT ORCHESTRATOR v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [DEVKIT]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void event(DevkitEvent event) {
        String prefix = switch (event.eventType()) {
            case "run.started", "run.completed" -> "@|fg(cyan) [RUN]|@";
            case "run.aborted" -> "@|fg(red),bold [ABORT]|@";
            case "task.started" -> "@|fg(blue) [TASK]|@";
            case "task.completed" -> "@|fg(green) [DONE]|@";
            case "task.retry" -> "@|fg(yellow) [RETRY]|@";
            case "task.skipped" -> "@|fg(red) [SKIP]|@";
            case "task.blocked" -> "@|fg(red) [BLOCKED]|@";
            case "review.final.passed" -> "@|fg(green),bold [REVIEW]|@";
            case "review.final.failed" -> "@|fg(red),bold [REVIEW]|@";
            case "workspace.integrated", "workspace.released" -> "@|fg(magenta) [WORKSPACE]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        String subject = event.taskId() != null ? event.taskId() + " " : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + subject + event.payload()));
    }

    public static void summary(RunSummary summary) {
        System.out.println();
        System.out.println("RUN " + summary.runId());
        System.out.printf("  %-14s %-10s %-8s %s%n", "TASK", "STATUS", "ATTEMPTS", "TITLE");
        System.out.println("  " + "-".repeat(64));
        for (TaskOutcome outcome : summary.outcomes()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format("  %-14s %s %-8d %s",
                    outcome.taskId(), colored(outcome.status()), outcome.attempts(), outcome.title())));
            if (outcome.status() == TaskStatus.SKIPPED || outcome.status() == TaskStatus.BLOCKED) {
                System.out.println("      reason: " + firstLine(outcome.reason()));
            }
        }
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Completed: @|fg(green) " + summary.completed() + "|@"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Skipped:   @|fg(red) " + summary.skipped() + "|@"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Blocked:   @|fg(red) " + summary.blocked() + "|@"));
        if (!summary.pending().isEmpty()) {
            System.out.println("  Not run:   " + summary.pending());
        }
        if (!summary.unsyncedTaskIds().isEmpty()) {
            warn("Status not saved to the ticket store for " + summary.unsyncedTaskIds());
        }
        if (summary.finalReview() != null) {
            if (summary.finalReview().passed()) {
                success("Final review passed: " + firstLine(summary.finalReview().detail()));
            } else {
                error("Final review failed: " + summary.finalReview().detail());
            }
        }
    }

    private static String colored(TaskStatus status) {
        String padded = String.format("%-10s", status);
        return switch (status) {
            case COMPLETED -> "@|fg(green) " + padded + "|@";
            case SKIPPED, BLOCKED, FAILED -> "@|fg(red) " + padded + "|@";
            default -> "@|fg(yellow) " + padded + "|@";
        };
    }

    static String firstLine(String text) {
        if (text == null) {
            return "";
        }
        int newline = text.indexOf('\n');
        return newline < 0 ? text : text.substring(0, newline);
    }
}
