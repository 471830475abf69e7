package com.stabilityengine.engine;

import lombok.Value;

import java.math.BigInteger;

/**
 * Published when a deposit mints buffer units against an existing surplus.
 */
@Value
public class BufferUnitMintedEvent {
    String transactionId;
    String holder;
    BigInteger amount;
    BigInteger bufferUnitPrice;
}
