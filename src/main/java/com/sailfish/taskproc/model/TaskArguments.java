package com.sailfish.taskproc.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Positional and keyword arguments of a task as they travel through the broker.
 */
public final class TaskArguments implements Serializable {

    private static final long serialVersionUID = 1L;

    private final ArrayList<Object> args;
    private final LinkedHashMap<String, Object> kwargs;

    public TaskArguments(List<?> args, Map<String, ?> kwargs) {
        this.args = args == null ? new ArrayList<>() : new ArrayList<>(args);
        this.kwargs = kwargs == null ? new LinkedHashMap<>() : new LinkedHashMap<>(kwargs);
    }

    public List<Object> getArgs() {
        return Collections.unmodifiableList(args);
    }

    public Map<String, Object> getKwargs() {
        return Collections.unmodifiableMap(kwargs);
    }

    @Override
    public String toString() {
        return "TaskArguments{args=" + args + ", kwargs=" + kwargs + '}';
    }
}
