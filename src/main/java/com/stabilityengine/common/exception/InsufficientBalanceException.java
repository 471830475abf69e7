package com.stabilityengine.common.exception;

import java.math.BigInteger;

/**
 * Thrown when a holder tries to burn more units than it holds on a ledger.
 */
public class InsufficientBalanceException extends StabilityEngineException {

    public InsufficientBalanceException(String ledger, String holder, BigInteger required, BigInteger available) {
        super(String.format("Insufficient %s balance for %s. Required: %s, Available: %s",
            ledger, holder, required, available));
    }
}
