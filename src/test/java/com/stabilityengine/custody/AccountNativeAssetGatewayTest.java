package com.stabilityengine.custody;

import com.stabilityengine.accounts.NativeAccount;
import com.stabilityengine.accounts.NativeAccountRepository;
import com.stabilityengine.common.exception.AccountNotFoundException;
import com.stabilityengine.common.exception.InsufficientFundsException;
import com.stabilityengine.common.exception.RefundTransferException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AccountNativeAssetGateway.
 *
 * Uses a mocked repository so the escrow and transfer bookkeeping can be
 * checked without a database.
 */
@ExtendWith(MockitoExtension.class)
class AccountNativeAssetGatewayTest {

    private static final String RESERVE = "reserve";

    @Mock
    private NativeAccountRepository accountRepository;

    @Mock
    private NativeTransferListener transferListener;

    private AccountNativeAssetGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = new AccountNativeAssetGateway(accountRepository, List.of(transferListener), RESERVE);
    }

    @Test
    void testReserveBalanceIsZeroBeforeFirstEscrow() {
        when(accountRepository.findById(RESERVE)).thenReturn(Optional.empty());

        assertEquals(BigInteger.ZERO, gateway.reserveBalance());
    }

    @Test
    void testEscrowMovesValueIntoReserve() {
        NativeAccount payer = new NativeAccount("alice", BigInteger.valueOf(1000), true);
        when(accountRepository.findById("alice")).thenReturn(Optional.of(payer));
        when(accountRepository.findById(RESERVE)).thenReturn(Optional.empty());

        gateway.escrow("alice", BigInteger.valueOf(400));

        assertEquals(BigInteger.valueOf(600), payer.getBalance());
        verify(accountRepository).save(payer);
        verify(accountRepository).save(argThat(account ->
            account.getAddress().equals(RESERVE) && account.getBalance().equals(BigInteger.valueOf(400))));
    }

    @Test
    void testEscrowInsufficientFunds() {
        NativeAccount payer = new NativeAccount("alice", BigInteger.valueOf(100), true);
        when(accountRepository.findById("alice")).thenReturn(Optional.of(payer));
        when(accountRepository.findById(RESERVE)).thenReturn(Optional.empty());

        assertThrows(InsufficientFundsException.class, () -> gateway.escrow("alice", BigInteger.valueOf(400)));
        verify(accountRepository, never()).save(any());
    }

    @Test
    void testEscrowUnknownPayer() {
        when(accountRepository.findById("ghost")).thenReturn(Optional.empty());

        assertThrows(AccountNotFoundException.class, () -> gateway.escrow("ghost", BigInteger.ONE));
    }

    @Test
    void testTransferCreditsRecipientAndNotifiesListeners() {
        NativeAccount reserve = new NativeAccount(RESERVE, BigInteger.valueOf(1000), true);
        NativeAccount recipient = new NativeAccount("bob", BigInteger.ZERO, true);
        when(accountRepository.findById(RESERVE)).thenReturn(Optional.of(reserve));
        when(accountRepository.findById("bob")).thenReturn(Optional.of(recipient));

        gateway.transfer("bob", BigInteger.valueOf(250));

        assertEquals(BigInteger.valueOf(750), reserve.getBalance());
        assertEquals(BigInteger.valueOf(250), recipient.getBalance());
        verify(transferListener).onTransferReceived("bob", BigInteger.valueOf(250));
    }

    @Test
    void testTransferRejectedByRecipient() {
        NativeAccount recipient = new NativeAccount("bob", BigInteger.ZERO, false);
        when(accountRepository.findById("bob")).thenReturn(Optional.of(recipient));

        RefundTransferException e = assertThrows(RefundTransferException.class,
            () -> gateway.transfer("bob", BigInteger.TEN));

        assertEquals("bob", e.getRecipient());
        assertEquals(BigInteger.TEN, e.getAmount());
        verify(accountRepository, never()).save(any());
        verifyNoInteractions(transferListener);
    }

    @Test
    void testTransferToUnknownRecipient() {
        when(accountRepository.findById("ghost")).thenReturn(Optional.empty());

        assertThrows(RefundTransferException.class, () -> gateway.transfer("ghost", BigInteger.TEN));
    }

    @Test
    void testListenerFailureRejectsTransfer() {
        NativeAccount reserve = new NativeAccount(RESERVE, BigInteger.valueOf(1000), true);
        NativeAccount recipient = new NativeAccount("bob", BigInteger.ZERO, true);
        when(accountRepository.findById(RESERVE)).thenReturn(Optional.of(reserve));
        when(accountRepository.findById("bob")).thenReturn(Optional.of(recipient));
        IllegalStateException hookFailure = new IllegalStateException("receive hook reverted");
        doThrow(hookFailure).when(transferListener).onTransferReceived(any(), any());

        RefundTransferException e = assertThrows(RefundTransferException.class,
            () -> gateway.transfer("bob", BigInteger.TEN));

        assertSame(hookFailure, e.getCause());
        assertTrue(e.getMessage().contains("receive hook reverted"));
    }

    @Test
    void testReserveCannotBeCounterparty() {
        assertThrows(IllegalArgumentException.class, () -> gateway.escrow(RESERVE, BigInteger.TEN));
        assertThrows(IllegalArgumentException.class, () -> gateway.transfer(RESERVE, BigInteger.TEN));

        verifyNoInteractions(accountRepository);
        verifyNoInteractions(transferListener);
    }
}
