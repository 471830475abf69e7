package com.stabilityengine.accounts;

import com.stabilityengine.common.FixedPointMath;
import com.stabilityengine.common.exception.AccountNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;

/**
 * Service for managing native accounts.
 *
 * The engine reserve is a native account too, but it is owned by the custody
 * gateway: it cannot be opened, funded or reconfigured from here.
 */
@Service
@Slf4j
public class NativeAccountService {

    private final NativeAccountRepository accountRepository;
    private final String reserveAccountId;

    public NativeAccountService(NativeAccountRepository accountRepository,
                                @Value("${stability-engine.reserve-account-id:stability-engine-reserve}")
                                String reserveAccountId) {
        this.accountRepository = accountRepository;
        this.reserveAccountId = reserveAccountId;
    }

    @Transactional
    public NativeAccount openAccount(String address, BigInteger initialBalance, boolean acceptsTransfers) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("Address is required");
        }
        requireUserAccount(address);
        if (initialBalance == null || initialBalance.signum() < 0) {
            throw new IllegalArgumentException("Initial balance cannot be negative");
        }
        if (accountRepository.existsById(address)) {
            throw new IllegalArgumentException("Account already exists: " + address);
        }
        NativeAccount account = accountRepository.save(
            new NativeAccount(address, initialBalance, acceptsTransfers));
        log.info("Opened native account {} with balance {} (acceptsTransfers={})",
            address, initialBalance, acceptsTransfers);
        return account;
    }

    @Transactional(readOnly = true)
    public NativeAccount getAccount(String address) {
        return accountRepository.findById(address)
            .orElseThrow(() -> new AccountNotFoundException(address));
    }

    @Transactional
    public NativeAccount fund(String address, BigInteger amount) {
        FixedPointMath.requirePositive(amount, "Funding amount");
        requireUserAccount(address);
        NativeAccount account = getAccount(address);
        account.credit(amount);
        accountRepository.save(account);
        log.info("Funded native account {} with {}", address, amount);
        return account;
    }

    @Transactional
    public NativeAccount setAcceptsTransfers(String address, boolean acceptsTransfers) {
        requireUserAccount(address);
        NativeAccount account = getAccount(address);
        account.setAcceptsTransfers(acceptsTransfers);
        accountRepository.save(account);
        log.info("Native account {} now acceptsTransfers={}", address, acceptsTransfers);
        return account;
    }

    private void requireUserAccount(String address) {
        if (reserveAccountId.equals(address)) {
            throw new IllegalArgumentException("Address is reserved for the engine: " + address);
        }
    }
}
