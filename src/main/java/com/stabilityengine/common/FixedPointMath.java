package com.stabilityengine.common;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Fixed-point arithmetic at 1e18 scale ("wad").
 *
 * All amounts handled by the engine are integers in base units, where one whole
 * unit is {@link #WAD} base units. Ratios and prices are carried as wads so that
 * chains of multiplications keep their precision. Every division truncates
 * toward zero; none of these helpers round up.
 */
public final class FixedPointMath {

    public static final int DECIMALS = 18;

    public static final BigInteger WAD = BigInteger.TEN.pow(DECIMALS);

    private FixedPointMath() {
    }

    /**
     * Multiply {@code amount} by the fraction expressed by {@code wad}.
     */
    public static BigInteger mulFrac(BigInteger amount, BigInteger wad) {
        return amount.multiply(wad).divide(WAD);
    }

    /**
     * Divide {@code amount} by the fraction expressed by {@code wad}.
     *
     * @throws ArithmeticException if {@code wad} is zero
     */
    public static BigInteger divFrac(BigInteger amount, BigInteger wad) {
        return amount.multiply(WAD).divide(wad);
    }

    /**
     * Build the wad for {@code numerator / denominator}.
     *
     * @throws ArithmeticException if {@code denominator} is zero
     */
    public static BigInteger fromRatio(BigInteger numerator, BigInteger denominator) {
        return numerator.multiply(WAD).divide(denominator);
    }

    /**
     * Value a native amount in stable units at a wad price.
     */
    public static BigInteger toStable(BigInteger nativeAmount, BigInteger price) {
        return mulFrac(nativeAmount, price);
    }

    /**
     * Convert a stable-unit amount back to native units at a wad price.
     */
    public static BigInteger toNative(BigInteger stableAmount, BigInteger price) {
        return divFrac(stableAmount, price);
    }

    /**
     * Scale a decimal amount of whole units to base units, dropping anything
     * below the smallest base unit.
     */
    public static BigInteger toBaseUnits(BigDecimal wholeUnits) {
        if (wholeUnits == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }
        return wholeUnits.movePointRight(DECIMALS).toBigInteger();
    }

    public static BigInteger toBaseUnits(String wholeUnits) {
        return toBaseUnits(new BigDecimal(wholeUnits));
    }

    /**
     * Render base units as a plain decimal of whole units.
     */
    public static BigDecimal toWholeUnits(BigInteger baseUnits) {
        BigDecimal whole = new BigDecimal(baseUnits, DECIMALS).stripTrailingZeros();
        return whole.scale() < 0 ? whole.setScale(0) : whole;
    }

    public static void requirePositive(BigInteger amount, String name) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
