package com.devkit.executor;

import com.devkit.core.model.Task;

/**
 * Renders a task attempt as the markdown instruction handed to an execution strategy.
 * Pure function, no Spring dependencies.
 */
public final class InstructionBuilder {

    private InstructionBuilder() {}

    public static String build(TaskContext context) {
        Task task = context.task();
        var sb = new StringBuilder();

        sb.append("# Task: ").append(task.id()).append(" - ").append(task.title()).append("\n\n");
        sb.append("**Label:** ").append(task.label()).append("\n");
        sb.append("**Attempt:** ").append(context.attempt()).append(" of ").append(context.maxAttempts()).append("\n\n");

        sb.append("## Objective\n\n");
        sb.append(task.description() == null ? "" : task.description()).append("\n\n");

        sb.append("## Approach\n\n");
        switch (task.label()) {
            case FEATURE -> {
                sb.append("- Write a failing test for the new behaviour first, then make it pass\n");
                sb.append("- Keep the change limited to what the objective asks for\n");
            }
            case BUGFIX -> {
                sb.append("- Reproduce the defect with a test before changing any code\n");
                sb.append("- Fix the root cause, not the symptom\n");
            }
            case CHORE -> {
                sb.append("- Do not change observable behaviour\n");
                sb.append("- Existing tests must keep passing unchanged\n");
            }
        }
        sb.append("\n");

        if (context.parentContext() != null && !context.parentContext().isBlank()) {
            sb.append("## Parent Ticket\n\n");
            sb.append(context.parentContext().strip()).append("\n\n");
        }

        if (context.attempt() > 1 && task.reason() != null && !task.reason().isBlank()) {
            sb.append("## Previous Attempt\n\n");
            sb.append("The previous attempt was discarded. It failed with:\n\n```\n");
            sb.append(task.reason().strip()).append("\n```\n\n");
        }

        sb.append("## Constraints\n\n");
        sb.append("- Work only inside the current directory\n");
        sb.append("- Do not commit; changes are committed after verification\n");
        sb.append("- Tests, lint and build must pass when you finish\n");
        return sb.toString();
    }
}
