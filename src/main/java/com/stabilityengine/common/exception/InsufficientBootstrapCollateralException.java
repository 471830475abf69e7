package com.stabilityengine.common.exception;

import java.math.BigInteger;

/**
 * Thrown when a buffer deposit cannot cover the current deficit plus the
 * initial collateral ratio. Carries the smallest deposit that would succeed
 * at the price used.
 */
public class InsufficientBootstrapCollateralException extends StabilityEngineException {

    private final BigInteger deposited;
    private final BigInteger minimumDeposit;

    public InsufficientBootstrapCollateralException(BigInteger deposited, BigInteger minimumDeposit) {
        super(String.format("Initial collateral ratio not met. Deposited: %s, minimum is: %s",
            deposited, minimumDeposit));
        this.deposited = deposited;
        this.minimumDeposit = minimumDeposit;
    }

    public BigInteger getDeposited() {
        return deposited;
    }

    public BigInteger getMinimumDeposit() {
        return minimumDeposit;
    }
}
