package com.stabilityengine.ledger;

/**
 * The two fungible-unit ledgers managed by the engine.
 */
public enum LedgerSymbol {
    /**
     * Value-pegged unit minted against native collateral.
     * Exists for the whole lifetime of the engine.
     */
    STABLE("Stable Unit"),

    /**
     * Share of the collateral surplus.
     * Created by the first successful buffer deposit and never removed.
     */
    BUFFER("Buffer Unit");

    private final String displayName;

    LedgerSymbol(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
