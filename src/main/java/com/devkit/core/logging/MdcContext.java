package com.devkit.core.logging;

import org.slf4j.MDC;

/**
 * MDC keys for run and task scoped logging. The logback pattern renders {@code runId} and {@code taskId}.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String TASK_ID = "taskId";
    public static final String LABEL = "label";
    public static final String ATTEMPT = "attempt";

    private MdcContext() {}

    /** Run id currently in the MDC, or null. */
    public static String runId() {
        return MDC.get(RUN_ID);
    }

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    public static void setTask(String runId, String taskId, String label, int attempt) {
        MDC.put(RUN_ID, runId);
        MDC.put(TASK_ID, taskId);
        MDC.put(LABEL, label);
        MDC.put(ATTEMPT, String.valueOf(attempt));
    }

    /** Drops task keys, keeping the run id. */
    public static void clearTask() {
        MDC.remove(TASK_ID);
        MDC.remove(LABEL);
        MDC.remove(ATTEMPT);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        clearTask();
    }
}
