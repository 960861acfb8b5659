package com.devkit.core.scheduler;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Operator abort switch for a run, checked by the scheduler between tasks.
 * <p>
 * An abort is requested either in process via {@link #requestAbort()} or from another process by
 * creating the marker file ({@code devkit abort <runId>}).
 */
public class RunControl {

    private final AtomicBoolean abortRequested = new AtomicBoolean();
    private final Path abortMarker;

    public RunControl() {
        this(null);
    }

    public RunControl(Path abortMarker) {
        this.abortMarker = abortMarker;
    }

    /** Marker file location for {@code runId} under the state directory. */
    public static Path markerFor(Path stateDir, String runId) {
        return stateDir.resolve("abort").resolve(runId.replaceAll("[^A-Za-z0-9._-]", "_"));
    }

    public void requestAbort() {
        abortRequested.set(true);
    }

    public boolean isAbortRequested() {
        return abortRequested.get() || (abortMarker != null && Files.exists(abortMarker));
    }

    public Path abortMarker() {
        return abortMarker;
    }
}
