package com.stabilityengine.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for per-holder balances.
 */
@Repository
public interface TokenBalanceRepository extends JpaRepository<TokenBalance, String> {

    Optional<TokenBalance> findByLedgerSymbolAndHolder(LedgerSymbol ledgerSymbol, String holder);
}
