package com.stabilityengine.ledger;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Supply counter of one fungible-unit ledger.
 *
 * The row for a ledger doubles as its existence flag: the buffer ledger has no
 * row until the first buffer deposit creates it.
 */
@Entity
@Table(name = "token_ledgers")
@Data
@NoArgsConstructor
public class TokenLedger {

    @Id
    @Enumerated(EnumType.STRING)
    private LedgerSymbol symbol;

    private String name;

    @Column(name = "total_supply", precision = 78, scale = 0, nullable = false)
    private BigInteger totalSupply;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public TokenLedger(LedgerSymbol symbol) {
        this.symbol = symbol;
        this.name = symbol.getDisplayName();
        this.totalSupply = BigInteger.ZERO;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    public void increaseSupply(BigInteger amount) {
        this.totalSupply = totalSupply.add(amount);
        this.updatedAt = Instant.now();
    }

    public void decreaseSupply(BigInteger amount) {
        if (totalSupply.compareTo(amount) < 0) {
            throw new IllegalStateException(
                String.format("Supply of %s would become negative: %s - %s", symbol, totalSupply, amount));
        }
        this.totalSupply = totalSupply.subtract(amount);
        this.updatedAt = Instant.now();
    }
}
