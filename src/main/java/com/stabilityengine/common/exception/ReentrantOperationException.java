package com.stabilityengine.common.exception;

/**
 * Thrown when an engine operation is started while another one is still
 * running on the same thread, e.g. from a refund recipient's callback.
 */
public class ReentrantOperationException extends StabilityEngineException {

    public ReentrantOperationException(String operation, String running) {
        super(String.format("Cannot start %s while %s is in progress", operation, running));
    }
}
