package com.stabilityengine.common.exception;

/**
 * Thrown when an operation needs the buffer pool before any deposit created it.
 */
public class BufferPoolNotInitializedException extends StabilityEngineException {

    public BufferPoolNotInitializedException() {
        super("Buffer pool has not been initialized");
    }
}
