package com.devkit.workspace;

/**
 * No valid workspace could be provided for a run. Fatal: the run stops before its first task.
 */
public class WorkspaceAcquisitionException extends WorkspaceException {

    public WorkspaceAcquisitionException(String message) {
        super(message);
    }

    public WorkspaceAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
