package com.stabilityengine.custody;

import com.stabilityengine.accounts.NativeAccount;
import com.stabilityengine.accounts.NativeAccountRepository;
import com.stabilityengine.common.exception.AccountNotFoundException;
import com.stabilityengine.common.exception.RefundTransferException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.util.List;

/**
 * Native custody backed by {@link NativeAccount} rows.
 *
 * The reserve is an ordinary native account identified by
 * {@code stability-engine.reserve-account-id}; it is opened on the first
 * escrow. Registered {@link NativeTransferListener}s run after the recipient
 * is credited, and any exception they raise turns into a
 * {@link RefundTransferException}. The reserve itself can never pay in or
 * receive a refund.
 */
@Component
@Slf4j
public class AccountNativeAssetGateway implements NativeAssetGateway {

    private final NativeAccountRepository accountRepository;
    private final List<NativeTransferListener> transferListeners;
    private final String reserveAccountId;

    public AccountNativeAssetGateway(NativeAccountRepository accountRepository,
                                     List<NativeTransferListener> transferListeners,
                                     @Value("${stability-engine.reserve-account-id:stability-engine-reserve}")
                                     String reserveAccountId) {
        this.accountRepository = accountRepository;
        this.transferListeners = transferListeners;
        this.reserveAccountId = reserveAccountId;
    }

    @Override
    @Transactional(readOnly = true)
    public BigInteger reserveBalance() {
        return accountRepository.findById(reserveAccountId)
            .map(NativeAccount::getBalance)
            .orElse(BigInteger.ZERO);
    }

    @Override
    @Transactional
    public void escrow(String from, BigInteger amount) {
        requireNotReserve(from);
        NativeAccount payer = accountRepository.findById(from)
            .orElseThrow(() -> new AccountNotFoundException(from));
        NativeAccount reserve = accountRepository.findById(reserveAccountId)
            .orElseGet(() -> new NativeAccount(reserveAccountId, BigInteger.ZERO, true));

        payer.debit(amount);
        reserve.credit(amount);
        accountRepository.save(payer);
        accountRepository.save(reserve);

        log.debug("Escrowed {} from {} into reserve {}", amount, from, reserveAccountId);
    }

    @Override
    @Transactional
    public void transfer(String to, BigInteger amount) {
        requireNotReserve(to);
        NativeAccount recipient = accountRepository.findById(to)
            .orElseThrow(() -> new RefundTransferException(to, amount, "recipient has no native account"));
        if (!recipient.isAcceptsTransfers()) {
            log.warn("Recipient {} rejected transfer of {}", to, amount);
            throw new RefundTransferException(to, amount, "recipient does not accept transfers");
        }
        NativeAccount reserve = accountRepository.findById(reserveAccountId)
            .orElseThrow(() -> new RefundTransferException(to, amount, "reserve account is empty"));

        reserve.debit(amount);
        recipient.credit(amount);
        accountRepository.save(reserve);
        accountRepository.save(recipient);

        for (NativeTransferListener listener : transferListeners) {
            try {
                listener.onTransferReceived(to, amount);
            } catch (RuntimeException e) {
                log.warn("Receive hook of {} rejected transfer of {}: {}", to, amount, e.getMessage());
                throw new RefundTransferException(to, amount, e.getMessage(), e);
            }
        }

        log.debug("Transferred {} from reserve {} to {}", amount, reserveAccountId, to);
    }

    private void requireNotReserve(String address) {
        if (reserveAccountId.equals(address)) {
            throw new IllegalArgumentException("The reserve account cannot be a counterparty: " + address);
        }
    }
}
