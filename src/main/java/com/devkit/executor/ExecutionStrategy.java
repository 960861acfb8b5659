package com.devkit.executor;

import com.devkit.core.model.ExecutionResult;
import com.devkit.core.model.TaskLabel;

/**
 * Performs the work of tasks carrying one label. May be slow and may fail; the dispatcher
 * turns exceptions into failed results.
 */
public interface ExecutionStrategy {

    TaskLabel label();

    ExecutionResult execute(TaskContext context);
}
