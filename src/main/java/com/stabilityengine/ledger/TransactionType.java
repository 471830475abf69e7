package com.stabilityengine.ledger;

/**
 * Engine operations that produce ledger entries.
 */
public enum TransactionType {
    /**
     * Stable units minted against attached native value.
     */
    MINT_STABLE,

    /**
     * Stable units burned and redeemed for native value.
     */
    BURN_STABLE,

    /**
     * Buffer units minted against a collateral buffer deposit.
     */
    DEPOSIT_BUFFER,

    /**
     * Buffer units burned and redeemed for a share of the surplus.
     */
    WITHDRAW_BUFFER
}
