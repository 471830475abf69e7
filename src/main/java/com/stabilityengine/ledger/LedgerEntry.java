package com.stabilityengine.ledger;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable journal entry for one mint or burn on a ledger.
 *
 * All entries written by a single engine operation share its transaction id.
 * Entries are never updated or deleted - they are append-only.
 */
@Entity
@Table(name = "ledger_entries", indexes = {
    @Index(name = "idx_ledger_transaction_id", columnList = "transaction_id"),
    @Index(name = "idx_ledger_holder", columnList = "holder"),
    @Index(name = "idx_ledger_created_at", columnList = "created_at")
})
@Data
@NoArgsConstructor
public class LedgerEntry {

    @Id
    private String entryId;

    /**
     * The engine operation this entry belongs to.
     */
    @Column(name = "transaction_id", nullable = false)
    private String transactionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "ledger_symbol", nullable = false)
    private LedgerSymbol ledgerSymbol;

    /**
     * The holder whose balance changed.
     */
    @Column(nullable = false)
    private String holder;

    @Enumerated(EnumType.STRING)
    private EntryType entryType;

    @Column(precision = 78, scale = 0, nullable = false)
    private BigInteger amount;

    @Enumerated(EnumType.STRING)
    private TransactionType transactionType;

    /**
     * Supply of the ledger right after this entry was applied.
     */
    @Column(name = "supply_after", precision = 78, scale = 0)
    private BigInteger supplyAfter;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public LedgerEntry(String transactionId, LedgerSymbol ledgerSymbol, String holder,
                       EntryType entryType, BigInteger amount, TransactionType transactionType,
                       BigInteger supplyAfter) {
        this.entryId = UUID.randomUUID().toString();
        this.transactionId = transactionId;
        this.ledgerSymbol = ledgerSymbol;
        this.holder = holder;
        this.entryType = entryType;
        this.amount = amount;
        this.transactionType = transactionType;
        this.supplyAfter = supplyAfter;
        this.createdAt = Instant.now();
    }

    public enum EntryType {
        MINT,
        BURN
    }
}
