package com.stabilityengine.ledger;

import com.stabilityengine.common.FixedPointMath;
import com.stabilityengine.common.exception.BufferPoolNotInitializedException;
import com.stabilityengine.common.exception.InsufficientBalanceException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the fungible-unit ledgers.
 */
@SpringBootTest
@ActiveProfiles("test")
@Transactional
class LedgerServiceTest {

    @Autowired
    private LedgerService ledgerService;

    private static BigInteger units(String amount) {
        return FixedPointMath.toBaseUnits(amount);
    }

    private static String txn() {
        return UUID.randomUUID().toString();
    }

    @Test
    void testStableLedgerCreatedOnFirstMint() {
        assertTrue(ledgerService.findLedger(LedgerSymbol.STABLE).isEmpty());
        assertEquals(BigInteger.ZERO, ledgerService.totalSupply(LedgerSymbol.STABLE));

        ledgerService.mint(LedgerSymbol.STABLE, "alice", units("100"), txn(), TransactionType.MINT_STABLE);

        assertTrue(ledgerService.findLedger(LedgerSymbol.STABLE).isPresent());
        assertEquals(units("100"), ledgerService.totalSupply(LedgerSymbol.STABLE));
        assertEquals(units("100"), ledgerService.balanceOf(LedgerSymbol.STABLE, "alice"));
    }

    @Test
    void testBufferMintRequiresLedger() {
        assertThrows(BufferPoolNotInitializedException.class, () ->
            ledgerService.mint(LedgerSymbol.BUFFER, "bob", units("1"), txn(), TransactionType.DEPOSIT_BUFFER));

        ledgerService.createLedger(LedgerSymbol.BUFFER);
        ledgerService.mint(LedgerSymbol.BUFFER, "bob", units("1"), txn(), TransactionType.DEPOSIT_BUFFER);

        assertEquals(units("1"), ledgerService.totalSupply(LedgerSymbol.BUFFER));
    }

    @Test
    void testCreateLedgerIsIdempotent() {
        TokenLedger first = ledgerService.createLedger(LedgerSymbol.BUFFER);
        ledgerService.mint(LedgerSymbol.BUFFER, "bob", units("5"), txn(), TransactionType.DEPOSIT_BUFFER);

        TokenLedger second = ledgerService.createLedger(LedgerSymbol.BUFFER);

        assertEquals(first.getCreatedAt(), second.getCreatedAt());
        assertEquals(units("5"), second.getTotalSupply());
    }

    @Test
    void testBurnBeyondBalanceFails() {
        ledgerService.mint(LedgerSymbol.STABLE, "alice", units("10"), txn(), TransactionType.MINT_STABLE);

        assertThrows(InsufficientBalanceException.class, () ->
            ledgerService.burn(LedgerSymbol.STABLE, "alice", units("11"), txn(), TransactionType.BURN_STABLE));
        assertThrows(InsufficientBalanceException.class, () ->
            ledgerService.burn(LedgerSymbol.STABLE, "nobody", units("1"), txn(), TransactionType.BURN_STABLE));
    }

    @Test
    void testRejectsNonPositiveAmounts() {
        assertThrows(IllegalArgumentException.class, () ->
            ledgerService.mint(LedgerSymbol.STABLE, "alice", BigInteger.ZERO, txn(), TransactionType.MINT_STABLE));
        assertThrows(IllegalArgumentException.class, () ->
            ledgerService.burn(LedgerSymbol.STABLE, "alice", units("-1"), txn(), TransactionType.BURN_STABLE));
    }

    @Test
    void testSupplyConservation() {
        BigInteger minted = BigInteger.ZERO;
        BigInteger burned = BigInteger.ZERO;
        String[] holders = {"alice", "bob", "carol"};

        for (int i = 1; i <= 12; i++) {
            String holder = holders[i % holders.length];
            BigInteger amount = units(String.valueOf(i * 7));
            ledgerService.mint(LedgerSymbol.STABLE, holder, amount, txn(), TransactionType.MINT_STABLE);
            minted = minted.add(amount);

            if (i % 3 == 0) {
                BigInteger burn = amount.divide(BigInteger.TWO);
                ledgerService.burn(LedgerSymbol.STABLE, holder, burn, txn(), TransactionType.BURN_STABLE);
                burned = burned.add(burn);
            }
        }

        BigInteger supply = ledgerService.totalSupply(LedgerSymbol.STABLE);
        assertEquals(minted.subtract(burned), supply);

        BigInteger sumOfBalances = BigInteger.ZERO;
        for (String holder : holders) {
            sumOfBalances = sumOfBalances.add(ledgerService.balanceOf(LedgerSymbol.STABLE, holder));
        }
        assertEquals(supply, sumOfBalances);
    }

    @Test
    void testJournalRecordsEveryChange() {
        String mintTxn = txn();
        String burnTxn = txn();
        ledgerService.mint(LedgerSymbol.STABLE, "alice", units("100"), mintTxn, TransactionType.MINT_STABLE);
        ledgerService.burn(LedgerSymbol.STABLE, "alice", units("40"), burnTxn, TransactionType.BURN_STABLE);

        List<LedgerEntry> journal = ledgerService.getHolderJournal("alice");
        assertEquals(2, journal.size());

        List<LedgerEntry> burnEntries = ledgerService.getTransactionJournal(burnTxn);
        assertEquals(1, burnEntries.size());
        LedgerEntry burn = burnEntries.get(0);
        assertEquals(LedgerEntry.EntryType.BURN, burn.getEntryType());
        assertEquals(TransactionType.BURN_STABLE, burn.getTransactionType());
        assertEquals(units("40"), burn.getAmount());
        assertEquals(units("60"), burn.getSupplyAfter());
    }
}
