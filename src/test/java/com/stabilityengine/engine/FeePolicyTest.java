package com.stabilityengine.engine;

import com.stabilityengine.common.FixedPointMath;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the mint/redeem fee.
 */
class FeePolicyTest {

    private final FeePolicy feePolicy = new FeePolicy(3);

    @Test
    void testNoFeeWithoutBufferPool() {
        assertEquals(BigInteger.ZERO, feePolicy.fee(FixedPointMath.WAD, false, BigInteger.ZERO));
    }

    @Test
    void testNoFeeWithEmptyBufferPool() {
        assertEquals(BigInteger.ZERO, feePolicy.fee(FixedPointMath.WAD, true, BigInteger.ZERO));
    }

    @Test
    void testPercentageFeeWithFundedPool() {
        BigInteger fee = feePolicy.fee(FixedPointMath.WAD, true, FixedPointMath.toBaseUnits("2000"));
        assertEquals(FixedPointMath.toBaseUnits("0.03"), fee);
    }

    @Test
    void testFeeRoundsDown() {
        // 3% of 99 base units is 2.97
        assertEquals(BigInteger.TWO, feePolicy.fee(BigInteger.valueOf(99), true, BigInteger.ONE));
        assertEquals(BigInteger.ZERO, feePolicy.fee(BigInteger.valueOf(33), true, BigInteger.ONE));
    }

    @Test
    void testFeeNeverExceedsAmount() {
        for (int rate = 0; rate <= 100; rate += 7) {
            for (long amount : new long[]{0, 1, 99, 100, 12345, 1_000_000_007L}) {
                BigInteger value = BigInteger.valueOf(amount);
                BigInteger fee = FeePolicy.fee(value, true, BigInteger.TEN, rate);
                assertTrue(fee.compareTo(value) <= 0, "rate " + rate + " amount " + amount);
                assertTrue(fee.signum() >= 0);
            }
        }
        assertEquals(BigInteger.valueOf(500), FeePolicy.fee(BigInteger.valueOf(500), true, BigInteger.TEN, 100));
    }

    @Test
    void testRejectsOutOfRangeRate() {
        assertThrows(IllegalArgumentException.class, () -> new FeePolicy(-1));
        assertThrows(IllegalArgumentException.class, () -> new FeePolicy(101));
        assertEquals(0, new FeePolicy(0).getFeeRatePercentage());
        assertEquals(100, new FeePolicy(100).getFeeRatePercentage());
    }
}
