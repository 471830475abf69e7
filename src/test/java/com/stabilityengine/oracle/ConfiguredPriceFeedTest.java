package com.stabilityengine.oracle;

import com.stabilityengine.common.FixedPointMath;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class ConfiguredPriceFeedTest {

    @Test
    void testInitialPriceIsScaledToWad() {
        ConfiguredPriceFeed feed = new ConfiguredPriceFeed(new BigDecimal("4000"));

        assertEquals(BigInteger.valueOf(4000).multiply(FixedPointMath.WAD), feed.currentPrice());
    }

    @Test
    void testUpdatePriceKeepsFraction() {
        ConfiguredPriceFeed feed = new ConfiguredPriceFeed(new BigDecimal("4000"));

        feed.updatePrice(new BigDecimal("1234.5"));

        assertEquals(new BigInteger("1234500000000000000000"), feed.currentPrice());
    }

    @Test
    void testRejectsNonPositivePrice() {
        ConfiguredPriceFeed feed = new ConfiguredPriceFeed(new BigDecimal("4000"));

        assertThrows(IllegalArgumentException.class, () -> feed.updatePrice(BigDecimal.ZERO));
        assertThrows(IllegalArgumentException.class, () -> feed.updatePrice(new BigDecimal("-1")));
        // below one base unit
        assertThrows(IllegalArgumentException.class, () -> feed.updatePrice(new BigDecimal("1e-19")));

        assertEquals(BigInteger.valueOf(4000).multiply(FixedPointMath.WAD), feed.currentPrice());
    }

    @Test
    void testRejectsInvalidInitialPrice() {
        assertThrows(IllegalArgumentException.class, () -> new ConfiguredPriceFeed(BigDecimal.ZERO));
    }
}
