package com.stabilityengine.engine;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Fee charged on stable mints and redemptions, in native units.
 *
 * No fee is charged until the buffer pool exists and holds units, which keeps
 * the engine free to use while it bootstraps. The fee rounds down.
 */
@Component
@Slf4j
public class FeePolicy {

    private static final BigInteger HUNDRED = BigInteger.valueOf(100);

    private final int feeRatePercentage;

    public FeePolicy(@Value("${stability-engine.fee-rate-percentage:3}") int feeRatePercentage) {
        if (feeRatePercentage < 0 || feeRatePercentage > 100) {
            throw new IllegalArgumentException("Fee rate percentage must be between 0 and 100: " + feeRatePercentage);
        }
        this.feeRatePercentage = feeRatePercentage;
    }

    public int getFeeRatePercentage() {
        return feeRatePercentage;
    }

    public BigInteger fee(BigInteger nativeAmount, boolean bufferPoolExists, BigInteger bufferSupply) {
        return fee(nativeAmount, bufferPoolExists, bufferSupply, feeRatePercentage);
    }

    public static BigInteger fee(BigInteger nativeAmount, boolean bufferPoolExists, BigInteger bufferSupply,
                                 int feeRatePercentage) {
        if (!bufferPoolExists || bufferSupply.signum() == 0) {
            return BigInteger.ZERO;
        }
        return BigInteger.valueOf(feeRatePercentage).multiply(nativeAmount).divide(HUNDRED);
    }
}
