package com.stabilityengine.accounts;

import com.stabilityengine.common.exception.InsufficientFundsException;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Holder of the native asset, in base units.
 *
 * The engine's own reserve is a native account too; its balance is the
 * collateral backing the stable supply.
 */
@Entity
@Table(name = "native_accounts")
@Data
@NoArgsConstructor
public class NativeAccount {

    @Id
    private String address;

    @Column(precision = 78, scale = 0, nullable = false)
    private BigInteger balance;

    /**
     * Whether inbound transfers are accepted. An account that refuses them
     * makes every refund addressed to it fail.
     */
    @Column(name = "accepts_transfers", nullable = false)
    private boolean acceptsTransfers;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public NativeAccount(String address, BigInteger initialBalance, boolean acceptsTransfers) {
        this.address = address;
        this.balance = initialBalance;
        this.acceptsTransfers = acceptsTransfers;
        this.createdAt = Instant.now();
        this.updatedAt = Instant.now();
    }

    public void credit(BigInteger amount) {
        this.balance = balance.add(amount);
        this.updatedAt = Instant.now();
    }

    public void debit(BigInteger amount) {
        if (balance.compareTo(amount) < 0) {
            throw new InsufficientFundsException(address, amount, balance);
        }
        this.balance = balance.subtract(amount);
        this.updatedAt = Instant.now();
    }
}
