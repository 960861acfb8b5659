package com.devkit.workspace;

import com.devkit.core.model.ReleaseMode;
import com.devkit.core.model.WorkspaceHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the single isolated workspace of each run.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>Run starts: {@link #acquire} creates the workspace, or reuses the one an interrupted run left behind</li>
 *   <li>Per completed task: {@link #commit} records the task's changes; a failed attempt is dropped with {@link #reset}</li>
 *   <li>Run ends: {@link #release} integrates or discards it</li>
 * </ol>
 */
public class WorkspaceManager {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceManager.class);

    private final WorkspaceProvider provider;
    private final String baseRevision;

    private final ConcurrentHashMap<String, WorkspaceHandle> handles = new ConcurrentHashMap<>();

    public WorkspaceManager(WorkspaceProvider provider, String baseRevision) {
        this.provider = provider;
        this.baseRevision = baseRevision;
    }

    /**
     * Returns the workspace of {@code runId}, creating it when none exists. An existing
     * workspace is reused only when it is valid; a corrupted one is reported, never replaced,
     * since it may hold the work of completed tasks.
     *
     * @throws WorkspaceAcquisitionException when no valid workspace can be provided
     */
    public WorkspaceHandle acquire(String runId) {
        WorkspaceHandle cached = handles.get(runId);
        if (cached != null && provider.isValid(cached.path(), baseRevision)) {
            log.debug("Reusing workspace for {} at {}", runId, cached.path());
            return cached;
        }

        Path path = provider.environmentPath(runId);
        if (Files.exists(path)) {
            if (!provider.isValid(path, baseRevision)) {
                throw new WorkspaceAcquisitionException("Workspace for " + runId + " at " + path
                        + " exists but is not a valid checkout of " + baseRevision
                        + "; inspect it or release it with mode DISCARD");
            }
            log.info("Resuming existing workspace for {} at {}", runId, path);
        } else {
            try {
                path = provider.createIsolatedEnvironment(baseRevision, runId);
            } catch (WorkspaceException e) {
                throw new WorkspaceAcquisitionException("Cannot create workspace for " + runId + ": " + e.getMessage(), e);
            }
            log.info("Created workspace for {} at {}", runId, path);
        }

        var handle = new WorkspaceHandle(runId, provider.branchName(runId), path, baseRevision);
        handles.put(runId, handle);
        return handle;
    }

    /** The workspace of {@code runId} if one exists on disk, without creating or validating it. */
    public Optional<WorkspaceHandle> find(String runId) {
        WorkspaceHandle cached = handles.get(runId);
        if (cached != null) {
            return Optional.of(cached);
        }
        Path path = provider.environmentPath(runId);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        return Optional.of(new WorkspaceHandle(runId, provider.branchName(runId), path, baseRevision));
    }

    public boolean commit(WorkspaceHandle handle, String message) {
        return provider.commit(handle.path(), message);
    }

    public void reset(WorkspaceHandle handle) {
        provider.reset(handle.path());
    }

    /** Cumulative change of the run relative to its base revision. */
    public String diffSummary(WorkspaceHandle handle) {
        return provider.diffStat(handle.path(), handle.baseRevision());
    }

    /**
     * Integrates or discards the workspace and removes the checkout. On INTEGRATE the branch is
     * kept for merge; on DISCARD it is deleted as well.
     */
    public void release(WorkspaceHandle handle, ReleaseMode mode) {
        log.info("Releasing workspace for {} ({})", handle.runId(), mode);
        if (mode == ReleaseMode.INTEGRATE) {
            provider.integrate(handle.path(), handle.runId());
            provider.teardownEnvironment(handle.path(), handle.runId(), false);
        } else {
            provider.teardownEnvironment(handle.path(), handle.runId(), true);
        }
        handles.remove(handle.runId());
    }
}
