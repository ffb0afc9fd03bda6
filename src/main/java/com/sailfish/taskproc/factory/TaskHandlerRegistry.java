package com.sailfish.taskproc.factory;

import com.sailfish.taskproc.TaskHandler;

import java.util.Optional;
import java.util.Set;

/**
 * Resolves the {@link TaskHandler} registered under a task name.
 */
public interface TaskHandlerRegistry {

    /**
     * Retrieves the handler registered under the given name.
     *
     * @param taskName The task name as carried by the delivered message.
     * @return An Optional containing the handler if found, empty otherwise.
     */
    Optional<TaskHandler> getHandler(String taskName);

    /**
     * @return the names of all registered handlers.
     */
    Set<String> getTaskNames();
}
