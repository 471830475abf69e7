package com.stabilityengine.common.exception;

import java.math.BigInteger;

/**
 * Thrown when stable units are redeemed while the collateral is worth less than
 * the outstanding stable supply.
 */
public class DeficitException extends StabilityEngineException {

    private final BigInteger deficit;

    public DeficitException(BigInteger deficitOrSurplus) {
        super("Cannot burn while in deficit: " + deficitOrSurplus.negate());
        this.deficit = deficitOrSurplus.negate();
    }

    public BigInteger getDeficit() {
        return deficit;
    }
}
