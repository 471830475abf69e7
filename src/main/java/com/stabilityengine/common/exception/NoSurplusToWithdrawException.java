package com.stabilityengine.common.exception;

import java.math.BigInteger;

/**
 * Thrown when buffer units are redeemed while there is no surplus backing them.
 */
public class NoSurplusToWithdrawException extends StabilityEngineException {

    public NoSurplusToWithdrawException(BigInteger deficitOrSurplus) {
        super("No surplus to withdraw: " + deficitOrSurplus);
    }
}
