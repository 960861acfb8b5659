package com.devkit.core.model;

import java.io.Serializable;
import java.nio.file.Path;

/**
 * Isolated checkout owned by one run.
 *
 * @param runId        the parent ticket id the run executes
 * @param branchName   branch holding the run's commits
 * @param path         checkout directory
 * @param baseRevision revision the branch was created from
 */
public record WorkspaceHandle(
    String runId,
    String branchName,
    Path path,
    String baseRevision
) implements Serializable {}
