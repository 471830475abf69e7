package com.stabilityengine.ledger;

import com.stabilityengine.common.exception.InsufficientBalanceException;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Balance of one holder on one ledger.
 */
@Entity
@Table(name = "token_balances", uniqueConstraints = {
    @UniqueConstraint(name = "uk_token_balance_holder", columnNames = {"ledger_symbol", "holder"})
})
@Data
@NoArgsConstructor
public class TokenBalance {

    @Id
    private String balanceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "ledger_symbol", nullable = false)
    private LedgerSymbol ledgerSymbol;

    @Column(nullable = false)
    private String holder;

    @Column(precision = 78, scale = 0, nullable = false)
    private BigInteger balance;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public TokenBalance(LedgerSymbol ledgerSymbol, String holder) {
        this.balanceId = UUID.randomUUID().toString();
        this.ledgerSymbol = ledgerSymbol;
        this.holder = holder;
        this.balance = BigInteger.ZERO;
        this.updatedAt = Instant.now();
    }

    public void credit(BigInteger amount) {
        this.balance = balance.add(amount);
        this.updatedAt = Instant.now();
    }

    public void debit(BigInteger amount) {
        if (balance.compareTo(amount) < 0) {
            throw new InsufficientBalanceException(ledgerSymbol.name(), holder, amount, balance);
        }
        this.balance = balance.subtract(amount);
        this.updatedAt = Instant.now();
    }
}
