package com.stabilityengine.engine;

import com.stabilityengine.common.FixedPointMath;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Values the native collateral against the outstanding stable supply and
 * prices buffer units off the resulting surplus.
 *
 * Stateless: every figure is a function of its arguments. Callers pass the
 * collateral excluding any value attached to the operation being evaluated.
 */
@Component
public class CollateralAccountant {

    /**
     * Signed difference between the collateral's value and the stable supply.
     * Positive is a surplus, zero or negative is a deficit.
     *
     * @param collateralNativeAmount reserve balance, excluding attached value
     * @param stableTotalSupply outstanding stable units
     * @param price wad price of one native unit in stable units
     */
    public BigInteger deficitOrSurplus(BigInteger collateralNativeAmount, BigInteger stableTotalSupply,
                                       BigInteger price) {
        return FixedPointMath.toStable(collateralNativeAmount, price).subtract(stableTotalSupply);
    }

    /**
     * Buffer units per stable unit of surplus, as a wad.
     *
     * @throws IllegalStateException if there is no surplus to price against
     */
    public BigInteger bufferUnitPrice(BigInteger bufferTotalSupply, BigInteger surplusInStable) {
        if (surplusInStable.signum() <= 0) {
            throw new IllegalStateException("Buffer unit price is undefined without a surplus");
        }
        return FixedPointMath.fromRatio(bufferTotalSupply, surplusInStable);
    }

    /**
     * Stable-unit value of {@code bufferAmount} buffer units out of a pool of
     * {@code bufferTotalSupply} units backed by {@code surplusInStable}.
     *
     * Never exceeds the surplus, so a redemption cannot dip into the collateral
     * that backs the stable supply.
     */
    public BigInteger surplusShare(BigInteger bufferAmount, BigInteger bufferTotalSupply,
                                   BigInteger surplusInStable) {
        BigInteger unitPrice = bufferUnitPrice(bufferTotalSupply, surplusInStable);
        BigInteger share = unitPrice.signum() == 0
            // pool so thin that the wad truncates to zero
            ? surplusInStable.multiply(bufferAmount).divide(bufferTotalSupply)
            : FixedPointMath.divFrac(bufferAmount, unitPrice);
        return share.min(surplusInStable);
    }
}
