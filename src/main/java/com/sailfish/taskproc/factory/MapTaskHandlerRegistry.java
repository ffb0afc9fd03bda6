package com.sailfish.taskproc.factory;

import com.sailfish.taskproc.TaskHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A simple implementation of {@link TaskHandlerRegistry} using a Map.
 * Handlers are registered before the consumer starts; lookups happen on consumer threads.
 */
public class MapTaskHandlerRegistry implements TaskHandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(MapTaskHandlerRegistry.class);

    private final Map<String, TaskHandler> handlers = new ConcurrentHashMap<>();

    /**
     * Registers a handler under its own {@link TaskHandler#name()}.
     *
     * @return the name the handler was registered under.
     * @throws IllegalArgumentException if the name is the generated class name of a lambda.
     */
    public String register(TaskHandler handler) {
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        String name = handler.name();
        Class<?> type = handler.getClass();
        if ((type.isSynthetic() || type.isHidden()) && type.getName().equals(name)) {
            throw new IllegalArgumentException("Handler " + name + " has no stable name; register it with an explicit task name");
        }
        return register(name, handler);
    }

    /**
     * Registers a handler under the given task name, replacing any previous registration.
     *
     * @return the name the handler was registered under.
     */
    public String register(String taskName, TaskHandler handler) {
        if (taskName == null || taskName.trim().isEmpty()) {
            throw new IllegalArgumentException("taskName cannot be blank");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        TaskHandler previous = handlers.put(taskName, handler);
        if (previous != null) {
            log.warn("Replaced handler registered for task '{}'", taskName);
        } else {
            log.info("Registering handler for task '{}': {}", taskName, handler.getClass().getName());
        }
        return taskName;
    }

    @Override
    public Optional<TaskHandler> getHandler(String taskName) {
        if (taskName == null) {
            return Optional.empty();
        }
        TaskHandler handler = handlers.get(taskName);
        if (handler == null) {
            log.warn("No handler found for task: {}", taskName);
        }
        return Optional.ofNullable(handler);
    }

    @Override
    public Set<String> getTaskNames() {
        return Collections.unmodifiableSet(new TreeSet<>(handlers.keySet()));
    }
}
