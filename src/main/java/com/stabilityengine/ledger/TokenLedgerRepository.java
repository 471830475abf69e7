package com.stabilityengine.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for ledger supply rows.
 */
@Repository
public interface TokenLedgerRepository extends JpaRepository<TokenLedger, LedgerSymbol> {
}
