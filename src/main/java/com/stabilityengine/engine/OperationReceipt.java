package com.stabilityengine.engine;

import com.stabilityengine.ledger.TransactionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Outcome of a committed engine operation. All amounts are in base units.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OperationReceipt {

    private String transactionId;
    private TransactionType operation;
    private String caller;

    /**
     * Native value attached, or units burned.
     */
    private BigInteger amountIn;

    /**
     * Units minted, or native value refunded.
     */
    private BigInteger amountOut;

    /**
     * Native fee retained by the reserve.
     */
    private BigInteger fee;

    private BigInteger price;

    /**
     * Buffer units per stable unit of surplus used for pricing; null when the
     * operation did not price against the pool.
     */
    private BigInteger bufferUnitPrice;

    private Instant completedAt;
}
