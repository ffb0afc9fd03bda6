package com.sailfish.taskproc;

import java.util.List;
import java.util.Map;

/**
 * Business logic executed by a consumer for one named task.
 * Delivery is at-least-once, so implementations should be idempotent.
 */
@FunctionalInterface
public interface TaskHandler {

    /**
     * Executes the task logic.
     *
     * @param args   positional arguments as submitted, never null.
     * @param kwargs keyword arguments as submitted, never null.
     * @return the task result; must be {@link java.io.Serializable} (or null) so it can be stored.
     * @throws Exception if the task execution fails. The failure is retried per the adapter's retry policy.
     */
    Object execute(List<Object> args, Map<String, Object> kwargs) throws Exception;

    /**
     * Name used when the handler is registered without an explicit one.
     * Lambdas and method references have no stable class name, so they must either be
     * registered under an explicit name or override this method.
     */
    default String name() {
        return getClass().getName();
    }
}
