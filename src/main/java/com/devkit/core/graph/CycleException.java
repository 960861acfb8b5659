package com.devkit.core.graph;

import java.util.List;

/**
 * The dependency relation contains at least one cycle.
 */
public class CycleException extends GraphValidationException {

    public CycleException(List<String> taskIds) {
        super("Dependency cycle among tasks " + taskIds, taskIds);
    }
}
