package com.stabilityengine.engine;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Point-in-time view of the engine's books.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EngineState {

    private BigInteger price;
    private int feeRatePercentage;
    private int initialCollateralRatioPercentage;
    private BigInteger collateral;
    private BigInteger stableTotalSupply;
    private boolean bufferPoolInitialized;
    private BigInteger bufferTotalSupply;
    private BigInteger deficitOrSurplus;

    /**
     * Null while the pool is empty or there is no surplus.
     */
    private BigInteger bufferUnitPrice;
}
