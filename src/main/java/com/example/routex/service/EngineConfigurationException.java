package com.example.routex.service;

/**
 * A schedule or event cannot be processed because of how it is configured (unsupported trigger kind,
 * event template that does not render). Fatal to the operation that raised it, never to the scheduler.
 */
public class EngineConfigurationException extends RuntimeException {

    public EngineConfigurationException(String message) {
        super(message);
    }

    public EngineConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
