package com.devkit.core.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One or more tasks depend on ids that are not part of the graph.
 */
public class DanglingReferenceException extends GraphValidationException {

    private final Map<String, List<String>> missingByTask;

    public DanglingReferenceException(Map<String, List<String>> missingByTask) {
        super("Unknown dependencies " + missingByTask, new ArrayList<>(missingByTask.keySet()));
        this.missingByTask = Collections.unmodifiableMap(new LinkedHashMap<>(missingByTask));
    }

    /** Missing dependency ids, keyed by the task that declares them. */
    public Map<String, List<String>> getMissingByTask() {
        return missingByTask;
    }
}
