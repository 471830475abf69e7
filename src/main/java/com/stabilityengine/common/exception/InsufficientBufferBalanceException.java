package com.stabilityengine.common.exception;

import java.math.BigInteger;

/**
 * Thrown when a withdrawal asks for more buffer units than the caller holds.
 */
public class InsufficientBufferBalanceException extends StabilityEngineException {

    public InsufficientBufferBalanceException(String holder, BigInteger required, BigInteger available) {
        super(String.format("Insufficient buffer units for %s. Required: %s, Available: %s",
            holder, required, available));
    }
}
