package com.stabilityengine.common.exception;

import java.math.BigInteger;

/**
 * Thrown when a native account cannot cover the value attached to an operation.
 */
public class InsufficientFundsException extends StabilityEngineException {

    public InsufficientFundsException(String address, BigInteger required, BigInteger available) {
        super(String.format("Insufficient funds in account %s. Required: %s, Available: %s",
            address, required, available));
    }
}
