package com.stabilityengine.common.exception;

/**
 * Base exception for all stability engine exceptions.
 */
public class StabilityEngineException extends RuntimeException {

    public StabilityEngineException(String message) {
        super(message);
    }

    public StabilityEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
