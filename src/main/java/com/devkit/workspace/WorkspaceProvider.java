package com.devkit.workspace;

import java.nio.file.Path;

/**
 * Creates and destroys isolated checkouts. Implementations throw {@link WorkspaceException}
 * when an operation cannot be completed.
 */
public interface WorkspaceProvider {

    /** Directory the environment called {@code name} lives in, whether or not it exists yet. */
    Path environmentPath(String name);

    /** Branch the environment called {@code name} commits to. */
    String branchName(String name);

    /**
     * Creates a fresh checkout of {@code baseRevision} for {@code name}.
     *
     * @return the checkout directory
     */
    Path createIsolatedEnvironment(String baseRevision, String name);

    /** True when {@code path} is an intact checkout whose history contains {@code baseRevision}. */
    boolean isValid(Path path, String baseRevision);

    /**
     * Records all current changes of the checkout as one commit.
     *
     * @return false when there was nothing to commit
     */
    boolean commit(Path path, String message);

    /** Summary of every change in the checkout relative to {@code baseRevision}. */
    String diffStat(Path path, String baseRevision);

    /** Drops every change made since the last commit, tracked or untracked. */
    void reset(Path path);

    /** Hands the environment's branch off for merge. */
    void integrate(Path path, String name);

    /**
     * Removes the checkout.
     *
     * @param deleteBranch also delete the environment's branch
     */
    void teardownEnvironment(Path path, String name, boolean deleteBranch);
}
