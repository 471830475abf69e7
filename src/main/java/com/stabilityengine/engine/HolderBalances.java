package com.stabilityengine.engine;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Stable and buffer holdings of one account.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HolderBalances {

    private String holder;
    private BigInteger stableBalance;
    private BigInteger bufferBalance;
}
