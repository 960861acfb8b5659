package com.devkit.core.model;

/**
 * How a run's workspace is released.
 */
public enum ReleaseMode {
    /** Hand the workspace branch off for merge, then remove the checkout. */
    INTEGRATE,
    /** Remove the checkout and its branch. */
    DISCARD
}
