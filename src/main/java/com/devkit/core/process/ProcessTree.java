package com.devkit.core.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Kills an external command together with every process it started.
 * <p>
 * Agent CLIs and build tools fork workers that outlive their parent when only the parent is
 * killed; those workers would keep writing into the run's workspace.
 */
public final class ProcessTree {

    private static final Logger log = LoggerFactory.getLogger(ProcessTree.class);

    public static final Duration DEFAULT_GRACE = Duration.ofSeconds(10);

    private ProcessTree() {}

    /**
     * Forcibly destroys {@code process} and its descendants and waits up to {@code grace}
     * for each of them to exit. The caller's interrupt status is preserved but does not cut
     * the wait short.
     *
     * @return true when every process of the tree has exited
     */
    public static boolean destroy(Process process, Duration grace) {
        return destroy(process.toHandle(), grace);
    }

    public static boolean destroy(ProcessHandle root, Duration grace) {
        // Snapshot first: once the root dies its children are reparented and no longer listed.
        List<ProcessHandle> tree = new ArrayList<>(root.descendants().toList());
        tree.add(0, root);
        for (ProcessHandle handle : tree) {
            handle.destroyForcibly();
        }

        boolean interrupted = Thread.interrupted();
        boolean allExited = true;
        long deadline = System.nanoTime() + grace.toNanos();
        try {
            for (ProcessHandle handle : tree) {
                long remaining = Math.max(0, deadline - System.nanoTime());
                while (true) {
                    try {
                        handle.onExit().get(remaining, TimeUnit.NANOSECONDS);
                        break;
                    } catch (InterruptedException e) {
                        interrupted = true;
                        remaining = Math.max(0, deadline - System.nanoTime());
                    } catch (TimeoutException | ExecutionException e) {
                        log.warn("Process {} did not exit within {}", handle.pid(), grace);
                        allExited = false;
                        break;
                    }
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
        if (allExited) {
            log.debug("Destroyed process tree of {} ({} processes)", root.pid(), tree.size());
        }
        return allExited;
    }
}
