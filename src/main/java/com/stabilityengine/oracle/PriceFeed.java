package com.stabilityengine.oracle;

import java.math.BigInteger;

/**
 * Source of the native asset's exchange rate in stable units.
 *
 * In production, this would be backed by an external oracle such as:
 * - Chainlink
 * - Pyth
 * - An exchange index price
 */
public interface PriceFeed {

    /**
     * Current price of one native unit in stable units, as a wad.
     * Always positive.
     */
    BigInteger currentPrice();
}
