package com.devkit.executor;

import com.devkit.core.model.ExecutionResult;
import com.devkit.core.model.Task;
import com.devkit.core.model.TaskLabel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Routes a task to the {@link ExecutionStrategy} registered for its label and waits for the outcome.
 * <p>
 * Always returns a result: a missing strategy, an exception, a timeout or an interrupt all come
 * back as a failed {@link ExecutionResult}. The time limit is chosen by the caller.
 */
public class ExecutorDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExecutorDispatcher.class);

    /** Max output size kept per attempt. Head and tail are preserved. */
    static final int MAX_OUTPUT_CHARS = 10_000;

    /** How long a cancelled attempt may take to kill its processes. */
    static final Duration TERMINATION_GRACE = Duration.ofSeconds(30);

    private final Map<TaskLabel, ExecutionStrategy> strategies = new EnumMap<>(TaskLabel.class);
    private final ExecutorService worker = Executors.newCachedThreadPool(r -> {
        var thread = new Thread(r, "devkit-executor");
        thread.setDaemon(true);
        return thread;
    });

    public ExecutorDispatcher(Collection<ExecutionStrategy> strategies) {
        for (ExecutionStrategy strategy : strategies) {
            if (this.strategies.put(strategy.label(), strategy) != null) {
                throw new IllegalArgumentException("More than one execution strategy for label " + strategy.label());
            }
        }
        log.info("Execution strategies registered for {}", this.strategies.keySet());
    }

    /**
     * Executes one attempt of {@code task}, waiting at most {@code timeout}.
     */
    public ExecutionResult run(Task task, TaskContext context, Duration timeout) {
        ExecutionStrategy strategy = strategies.get(task.label());
        if (strategy == null) {
            log.error("No execution strategy for label {} (task {})", task.label(), task.id());
            return ExecutionResult.failure("No execution strategy configured for label " + task.label());
        }

        log.info("Dispatching task {} [{}] attempt {}: {}", task.id(), task.label(), context.attempt(), task.title());
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        var claimed = new AtomicBoolean();
        var finished = new CountDownLatch(1);
        Future<ExecutionResult> future = worker.submit(() -> {
            if (!claimed.compareAndSet(false, true)) {
                return null;
            }
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return strategy.execute(context);
            } finally {
                MDC.clear();
                finished.countDown();
            }
        });

        try {
            ExecutionResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                return ExecutionResult.failure("Strategy for " + task.label() + " returned no result");
            }
            return new ExecutionResult(result.success(), truncateOutput(result.output()));
        } catch (TimeoutException e) {
            log.warn("Task {} timed out after {}", task.id(), timeout);
            cancelAndAwait(task, future, claimed, finished);
            return ExecutionResult.failure("Timed out after " + timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Strategy for task {} threw: {}", task.id(), cause.getMessage(), cause);
            return ExecutionResult.failure("Execution error: " + cause.getMessage());
        } catch (InterruptedException e) {
            cancelAndAwait(task, future, claimed, finished);
            Thread.currentThread().interrupt();
            return ExecutionResult.failure("Interrupted while waiting for task " + task.id());
        }
    }

    /**
     * Interrupts the attempt and blocks until its strategy has returned, so that nothing started
     * for the attempt is still touching the workspace when the caller moves on.
     */
    private void cancelAndAwait(Task task, Future<ExecutionResult> future, AtomicBoolean claimed,
                                CountDownLatch finished) {
        future.cancel(true);
        if (claimed.compareAndSet(false, true)) {
            // The strategy never started.
            return;
        }
        boolean interrupted = Thread.interrupted();
        try {
            while (true) {
                try {
                    if (!finished.await(TERMINATION_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                        log.error("Strategy for task {} still running {} after cancellation", task.id(), TERMINATION_GRACE);
                    }
                    return;
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Truncates output to ~10K chars keeping the head and tail for context.
     */
    static String truncateOutput(String output) {
        if (output == null || output.length() <= MAX_OUTPUT_CHARS) return output;
        int headSize = MAX_OUTPUT_CHARS / 2;
        int tailSize = MAX_OUTPUT_CHARS / 2;
        return output.substring(0, headSize)
                + "\n\n... [truncated " + (output.length() - MAX_OUTPUT_CHARS) + " chars] ...\n\n"
                + output.substring(output.length() - tailSize);
    }

    @Override
    public void close() {
        worker.shutdownNow();
    }
}
