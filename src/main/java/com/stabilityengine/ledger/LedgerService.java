package com.stabilityengine.ledger;

import com.stabilityengine.common.FixedPointMath;
import com.stabilityengine.common.exception.BufferPoolNotInitializedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Fungible-unit ledgers for the stable and buffer units.
 *
 * Each ledger keeps a supply counter and per-holder balances; every mint and
 * burn also appends a {@link LedgerEntry} so the journal can be replayed
 * against the supply. Supply and balances never go negative.
 *
 * The stable ledger is created on first use. The buffer ledger only exists
 * once {@link #createLedger(LedgerSymbol)} has been called for it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private final TokenLedgerRepository tokenLedgerRepository;
    private final TokenBalanceRepository tokenBalanceRepository;
    private final LedgerRepository ledgerRepository;

    @Transactional(readOnly = true)
    public Optional<TokenLedger> findLedger(LedgerSymbol symbol) {
        return tokenLedgerRepository.findById(symbol);
    }

    /**
     * Create a ledger, or return it unchanged if it already exists.
     */
    @Transactional
    public TokenLedger createLedger(LedgerSymbol symbol) {
        Optional<TokenLedger> existing = tokenLedgerRepository.findById(symbol);
        if (existing.isPresent()) {
            return existing.get();
        }
        TokenLedger ledger = tokenLedgerRepository.save(new TokenLedger(symbol));
        log.info("Created {} ledger", symbol);
        return ledger;
    }

    @Transactional(readOnly = true)
    public BigInteger totalSupply(LedgerSymbol symbol) {
        return tokenLedgerRepository.findById(symbol)
            .map(TokenLedger::getTotalSupply)
            .orElse(BigInteger.ZERO);
    }

    @Transactional(readOnly = true)
    public BigInteger balanceOf(LedgerSymbol symbol, String holder) {
        return tokenBalanceRepository.findByLedgerSymbolAndHolder(symbol, holder)
            .map(TokenBalance::getBalance)
            .orElse(BigInteger.ZERO);
    }

    /**
     * Mint {@code amount} units to {@code holder}.
     *
     * @throws BufferPoolNotInitializedException if minting buffer units before the pool exists
     */
    @Transactional
    public LedgerEntry mint(LedgerSymbol symbol, String holder, BigInteger amount,
                            String transactionId, TransactionType transactionType) {
        FixedPointMath.requirePositive(amount, "Mint amount");

        TokenLedger ledger = requireLedger(symbol);
        TokenBalance balance = tokenBalanceRepository.findByLedgerSymbolAndHolder(symbol, holder)
            .orElseGet(() -> new TokenBalance(symbol, holder));

        balance.credit(amount);
        ledger.increaseSupply(amount);
        tokenBalanceRepository.save(balance);
        tokenLedgerRepository.save(ledger);

        LedgerEntry entry = ledgerRepository.save(new LedgerEntry(
            transactionId,
            symbol,
            holder,
            LedgerEntry.EntryType.MINT,
            amount,
            transactionType,
            ledger.getTotalSupply()
        ));

        log.info("Recorded MINT: txn={}, ledger={}, holder={}, amount={}, supply={}",
            transactionId, symbol, holder, amount, ledger.getTotalSupply());
        return entry;
    }

    /**
     * Burn {@code amount} units from {@code holder}.
     *
     * @throws com.stabilityengine.common.exception.InsufficientBalanceException if the holder has less
     */
    @Transactional
    public LedgerEntry burn(LedgerSymbol symbol, String holder, BigInteger amount,
                            String transactionId, TransactionType transactionType) {
        FixedPointMath.requirePositive(amount, "Burn amount");

        TokenLedger ledger = requireLedger(symbol);
        TokenBalance balance = tokenBalanceRepository.findByLedgerSymbolAndHolder(symbol, holder)
            .orElseGet(() -> new TokenBalance(symbol, holder));

        balance.debit(amount);
        ledger.decreaseSupply(amount);
        tokenBalanceRepository.save(balance);
        tokenLedgerRepository.save(ledger);

        LedgerEntry entry = ledgerRepository.save(new LedgerEntry(
            transactionId,
            symbol,
            holder,
            LedgerEntry.EntryType.BURN,
            amount,
            transactionType,
            ledger.getTotalSupply()
        ));

        log.info("Recorded BURN: txn={}, ledger={}, holder={}, amount={}, supply={}",
            transactionId, symbol, holder, amount, ledger.getTotalSupply());
        return entry;
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> getHolderJournal(String holder) {
        return ledgerRepository.findByHolderOrderByCreatedAtDesc(holder);
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> getTransactionJournal(String transactionId) {
        return ledgerRepository.findByTransactionId(transactionId);
    }

    private TokenLedger requireLedger(LedgerSymbol symbol) {
        if (symbol == LedgerSymbol.STABLE) {
            return createLedger(symbol);
        }
        return tokenLedgerRepository.findById(symbol)
            .orElseThrow(BufferPoolNotInitializedException::new);
    }
}
