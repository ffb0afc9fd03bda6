package com.sailfish.taskproc.factory;

import com.sailfish.taskproc.config.BackendConfig;
import com.sailfish.taskproc.config.JpaBackendConfig;
import com.sailfish.taskproc.config.TaskProcessorConfig;
import com.sailfish.taskproc.exception.UnknownBackendException;
import com.sailfish.taskproc.service.TaskProcessorAdapter;
import com.sailfish.taskproc.service.impl.JpaTaskProcessorAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Builds the adapter matching the backend variant of a configuration.
 * Adapters are returned initialized; a failed initialization is propagated and nothing is returned.
 */
public final class TaskProcessorAdapterFactory {

    private static final Logger log = LoggerFactory.getLogger(TaskProcessorAdapterFactory.class);

    private TaskProcessorAdapterFactory() {
    }

    /**
     * @param config the configuration to build an adapter for.
     * @return an initialized adapter whose backend matches {@code config.getBackendConfig()}.
     * @throws UnknownBackendException if no adapter implements the configured backend type.
     */
    public static TaskProcessorAdapter create(TaskProcessorConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        BackendConfig backendConfig = config.getBackendConfig();
        String backendType = backendConfig.getBackendType();

        TaskProcessorAdapter adapter;
        switch (backendType == null ? "" : backendType) {
            case JpaBackendConfig.BACKEND_TYPE:
                adapter = new JpaTaskProcessorAdapter(config);
                break;
            default:
                throw new UnknownBackendException(backendType, backendConfig.getClass());
        }

        adapter.initialize(config);
        log.info("Created {} task processor adapter for queue '{}'", backendType, config.getQueueName());
        return adapter;
    }
}
