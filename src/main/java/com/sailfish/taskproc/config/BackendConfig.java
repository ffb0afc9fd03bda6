package com.sailfish.taskproc.config;

/**
 * Backend-specific part of a {@link TaskProcessorConfig}.
 * Exactly one variant is populated per configuration; {@link #getBackendType()} is the tag
 * the adapter factory selects on.
 */
public interface BackendConfig {

    /**
     * @return the discriminator of this variant, e.g. {@code "jpa"}.
     */
    String getBackendType();
}
