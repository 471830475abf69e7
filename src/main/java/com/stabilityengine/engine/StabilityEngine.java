package com.stabilityengine.engine;

import com.stabilityengine.common.FixedPointMath;
import com.stabilityengine.common.exception.BufferPoolNotInitializedException;
import com.stabilityengine.common.exception.DeficitException;
import com.stabilityengine.common.exception.InsufficientBootstrapCollateralException;
import com.stabilityengine.common.exception.InsufficientBufferBalanceException;
import com.stabilityengine.common.exception.NoSurplusToWithdrawException;
import com.stabilityengine.custody.NativeAssetGateway;
import com.stabilityengine.ledger.LedgerService;
import com.stabilityengine.ledger.LedgerSymbol;
import com.stabilityengine.ledger.TokenLedger;
import com.stabilityengine.ledger.TransactionType;
import com.stabilityengine.oracle.PriceFeed;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Mints and redeems stable and buffer units against native collateral.
 *
 * Operation flow:
 * 1. Take the operation guard (serializes operations, refuses re-entry)
 * 2. Open a transaction
 * 3. Escrow attached value, check invariants, mutate the ledgers
 * 4. Send any refund last
 * 5. Commit, then release the guard
 *
 * Any exception rolls back every ledger and native balance change of the
 * operation, including the escrow and a burn whose refund was rejected.
 */
@Service
@Slf4j
public class StabilityEngine {

    public static final int INITIAL_COLLATERAL_RATIO_PERCENTAGE = 10;

    private static final BigInteger HUNDRED = BigInteger.valueOf(100);

    private final LedgerService ledgerService;
    private final NativeAssetGateway nativeAssetGateway;
    private final PriceFeed priceFeed;
    private final CollateralAccountant collateralAccountant;
    private final FeePolicy feePolicy;
    private final OperationGuard operationGuard;
    private final ApplicationEventPublisher eventPublisher;
    private final TransactionTemplate transactionTemplate;

    public StabilityEngine(LedgerService ledgerService,
                           NativeAssetGateway nativeAssetGateway,
                           PriceFeed priceFeed,
                           CollateralAccountant collateralAccountant,
                           FeePolicy feePolicy,
                           OperationGuard operationGuard,
                           ApplicationEventPublisher eventPublisher,
                           PlatformTransactionManager transactionManager) {
        this.ledgerService = ledgerService;
        this.nativeAssetGateway = nativeAssetGateway;
        this.priceFeed = priceFeed;
        this.collateralAccountant = collateralAccountant;
        this.feePolicy = feePolicy;
        this.operationGuard = operationGuard;
        this.eventPublisher = eventPublisher;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Mint stable units for the native value attached by {@code caller}.
     * Always permitted: the new units are fully backed at the current price.
     */
    public OperationReceipt mintStable(String caller, BigInteger nativeValue) {
        FixedPointMath.requirePositive(nativeValue, "Attached value");

        return operationGuard.execute(TransactionType.MINT_STABLE, () -> inTransaction(transactionId -> {
            nativeAssetGateway.escrow(caller, nativeValue);

            BigInteger price = priceFeed.currentPrice();
            BigInteger fee = currentFee(nativeValue);
            BigInteger mintAmount = FixedPointMath.toStable(nativeValue.subtract(fee), price);
            if (mintAmount.signum() == 0) {
                throw new IllegalArgumentException("Attached value is too small to mint any stable units");
            }

            ledgerService.mint(LedgerSymbol.STABLE, caller, mintAmount, transactionId, TransactionType.MINT_STABLE);

            log.info("MINT_STABLE {}: caller={}, value={}, fee={}, minted={}, price={}",
                transactionId, caller, nativeValue, fee, mintAmount, price);

            return receipt(transactionId, TransactionType.MINT_STABLE, caller)
                .amountIn(nativeValue)
                .amountOut(mintAmount)
                .fee(fee)
                .price(price)
                .build();
        }));
    }

    /**
     * Burn stable units and refund their native value, less the fee.
     *
     * @throws DeficitException if the collateral is worth less than the stable supply
     * @throws com.stabilityengine.common.exception.InsufficientBalanceException if the caller holds less
     * @throws com.stabilityengine.common.exception.RefundTransferException if the caller rejects the refund
     */
    public OperationReceipt burnStable(String caller, BigInteger burnAmount) {
        FixedPointMath.requirePositive(burnAmount, "Burn amount");

        return operationGuard.execute(TransactionType.BURN_STABLE, () -> inTransaction(transactionId -> {
            BigInteger price = priceFeed.currentPrice();
            BigInteger deficitOrSurplus = collateralAccountant.deficitOrSurplus(
                nativeAssetGateway.reserveBalance(),
                ledgerService.totalSupply(LedgerSymbol.STABLE),
                price);
            if (deficitOrSurplus.signum() < 0) {
                throw new DeficitException(deficitOrSurplus);
            }

            ledgerService.burn(LedgerSymbol.STABLE, caller, burnAmount, transactionId, TransactionType.BURN_STABLE);

            BigInteger refund = FixedPointMath.toNative(burnAmount, price);
            BigInteger fee = currentFee(refund);
            BigInteger netRefund = refund.subtract(fee);

            // interaction last: the burn is already visible to the recipient
            if (netRefund.signum() > 0) {
                nativeAssetGateway.transfer(caller, netRefund);
            }

            log.info("BURN_STABLE {}: caller={}, burned={}, refund={}, fee={}, price={}",
                transactionId, caller, burnAmount, netRefund, fee, price);

            return receipt(transactionId, TransactionType.BURN_STABLE, caller)
                .amountIn(burnAmount)
                .amountOut(netRefund)
                .fee(fee)
                .price(price)
                .build();
        }));
    }

    /**
     * Deposit native value into the collateral buffer and mint buffer units.
     *
     * While the engine is in deficit, or no units of the pool are outstanding,
     * the deposit must cover the deficit plus the initial collateral ratio of
     * the stable supply, and the buffer is (re)seeded at one unit per stable
     * unit of new surplus. Otherwise units are priced off the current surplus.
     *
     * @throws InsufficientBootstrapCollateralException if a bootstrap deposit is too small
     */
    public OperationReceipt depositBuffer(String caller, BigInteger nativeValue) {
        FixedPointMath.requirePositive(nativeValue, "Attached value");

        return operationGuard.execute(TransactionType.DEPOSIT_BUFFER, () -> inTransaction(transactionId -> {
            nativeAssetGateway.escrow(caller, nativeValue);

            BigInteger price = priceFeed.currentPrice();
            BigInteger stableSupply = ledgerService.totalSupply(LedgerSymbol.STABLE);
            BigInteger collateral = nativeAssetGateway.reserveBalance().subtract(nativeValue);
            BigInteger deficitOrSurplus = collateralAccountant.deficitOrSurplus(collateral, stableSupply, price);

            Optional<TokenLedger> pool = ledgerService.findLedger(LedgerSymbol.BUFFER);
            boolean poolFunded = pool.map(ledger -> ledger.getTotalSupply().signum() > 0).orElse(false);

            if (deficitOrSurplus.signum() <= 0 || !poolFunded) {
                return bootstrapBuffer(transactionId, caller, nativeValue, deficitOrSurplus, stableSupply, price);
            }
            return depositIntoSurplus(transactionId, caller, nativeValue, deficitOrSurplus,
                pool.get().getTotalSupply(), price);
        }));
    }

    /**
     * Burn buffer units and refund their share of the surplus.
     *
     * @throws BufferPoolNotInitializedException if no buffer deposit ever succeeded
     * @throws InsufficientBufferBalanceException if the caller holds less
     * @throws NoSurplusToWithdrawException if the collateral does not exceed the stable supply
     * @throws com.stabilityengine.common.exception.RefundTransferException if the caller rejects the refund
     */
    public OperationReceipt withdrawBuffer(String caller, BigInteger burnAmount) {
        FixedPointMath.requirePositive(burnAmount, "Burn amount");

        return operationGuard.execute(TransactionType.WITHDRAW_BUFFER, () -> inTransaction(transactionId -> {
            TokenLedger pool = ledgerService.findLedger(LedgerSymbol.BUFFER)
                .orElseThrow(BufferPoolNotInitializedException::new);

            BigInteger held = ledgerService.balanceOf(LedgerSymbol.BUFFER, caller);
            if (held.compareTo(burnAmount) < 0) {
                throw new InsufficientBufferBalanceException(caller, burnAmount, held);
            }

            BigInteger poolSupply = pool.getTotalSupply();
            ledgerService.burn(LedgerSymbol.BUFFER, caller, burnAmount, transactionId,
                TransactionType.WITHDRAW_BUFFER);

            BigInteger price = priceFeed.currentPrice();
            BigInteger deficitOrSurplus = collateralAccountant.deficitOrSurplus(
                nativeAssetGateway.reserveBalance(),
                ledgerService.totalSupply(LedgerSymbol.STABLE),
                price);
            if (deficitOrSurplus.signum() <= 0) {
                throw new NoSurplusToWithdrawException(deficitOrSurplus);
            }

            BigInteger bufferUnitPrice = collateralAccountant.bufferUnitPrice(poolSupply, deficitOrSurplus);
            BigInteger refundInStable = collateralAccountant.surplusShare(burnAmount, poolSupply, deficitOrSurplus);
            BigInteger refundInNative = FixedPointMath.toNative(refundInStable, price);

            if (refundInNative.signum() > 0) {
                nativeAssetGateway.transfer(caller, refundInNative);
            }

            log.info("WITHDRAW_BUFFER {}: caller={}, burned={}, refund={}, unitPrice={}, price={}",
                transactionId, caller, burnAmount, refundInNative, bufferUnitPrice, price);

            return receipt(transactionId, TransactionType.WITHDRAW_BUFFER, caller)
                .amountIn(burnAmount)
                .amountOut(refundInNative)
                .fee(BigInteger.ZERO)
                .price(price)
                .bufferUnitPrice(bufferUnitPrice)
                .build();
        }));
    }

    public int getFeeRatePercentage() {
        return feePolicy.getFeeRatePercentage();
    }

    public boolean isBufferPoolInitialized() {
        return ledgerService.findLedger(LedgerSymbol.BUFFER).isPresent();
    }

    public BigInteger currentPrice() {
        return priceFeed.currentPrice();
    }

    public BigInteger stableTotalSupply() {
        return ledgerService.totalSupply(LedgerSymbol.STABLE);
    }

    public BigInteger bufferTotalSupply() {
        return ledgerService.totalSupply(LedgerSymbol.BUFFER);
    }

    public HolderBalances balancesOf(String holder) {
        return HolderBalances.builder()
            .holder(holder)
            .stableBalance(ledgerService.balanceOf(LedgerSymbol.STABLE, holder))
            .bufferBalance(ledgerService.balanceOf(LedgerSymbol.BUFFER, holder))
            .build();
    }

    public EngineState getState() {
        BigInteger price = priceFeed.currentPrice();
        BigInteger collateral = nativeAssetGateway.reserveBalance();
        BigInteger stableSupply = ledgerService.totalSupply(LedgerSymbol.STABLE);
        Optional<TokenLedger> pool = ledgerService.findLedger(LedgerSymbol.BUFFER);
        BigInteger bufferSupply = pool.map(TokenLedger::getTotalSupply).orElse(BigInteger.ZERO);
        BigInteger deficitOrSurplus = collateralAccountant.deficitOrSurplus(collateral, stableSupply, price);

        BigInteger bufferUnitPrice = null;
        if (bufferSupply.signum() > 0 && deficitOrSurplus.signum() > 0) {
            bufferUnitPrice = collateralAccountant.bufferUnitPrice(bufferSupply, deficitOrSurplus);
        }

        return EngineState.builder()
            .price(price)
            .feeRatePercentage(feePolicy.getFeeRatePercentage())
            .initialCollateralRatioPercentage(INITIAL_COLLATERAL_RATIO_PERCENTAGE)
            .collateral(collateral)
            .stableTotalSupply(stableSupply)
            .bufferPoolInitialized(pool.isPresent())
            .bufferTotalSupply(bufferSupply)
            .deficitOrSurplus(deficitOrSurplus)
            .bufferUnitPrice(bufferUnitPrice)
            .build();
    }

    private OperationReceipt bootstrapBuffer(String transactionId, String caller, BigInteger nativeValue,
                                             BigInteger deficitOrSurplus, BigInteger stableSupply,
                                             BigInteger price) {
        BigInteger deficitInNative = deficitOrSurplus.signum() < 0
            ? FixedPointMath.toNative(deficitOrSurplus.negate(), price)
            : BigInteger.ZERO;
        BigInteger requiredInitialSurplusInStable = stableSupply
            .multiply(BigInteger.valueOf(INITIAL_COLLATERAL_RATIO_PERCENTAGE))
            .divide(HUNDRED);
        BigInteger requiredInitialSurplusInNative = FixedPointMath.toNative(requiredInitialSurplusInStable, price);
        BigInteger minimumDeposit = deficitInNative.add(requiredInitialSurplusInNative);

        if (nativeValue.compareTo(minimumDeposit) < 0) {
            log.info("DEPOSIT_BUFFER {} rejected: caller={}, value={}, minimum={}",
                transactionId, caller, nativeValue, minimumDeposit);
            throw new InsufficientBootstrapCollateralException(nativeValue, minimumDeposit);
        }

        BigInteger newSurplusInNative = nativeValue.subtract(deficitInNative);
        BigInteger newSurplusInStable = FixedPointMath.toStable(newSurplusInNative, price);
        if (newSurplusInStable.signum() == 0) {
            throw new IllegalArgumentException("Deposit is too small to mint any buffer units");
        }

        ledgerService.createLedger(LedgerSymbol.BUFFER);
        ledgerService.mint(LedgerSymbol.BUFFER, caller, newSurplusInStable, transactionId,
            TransactionType.DEPOSIT_BUFFER);

        log.info("DEPOSIT_BUFFER {} (bootstrap): caller={}, value={}, deficitCovered={}, minted={}, price={}",
            transactionId, caller, nativeValue, deficitInNative, newSurplusInStable, price);

        return receipt(transactionId, TransactionType.DEPOSIT_BUFFER, caller)
            .amountIn(nativeValue)
            .amountOut(newSurplusInStable)
            .fee(BigInteger.ZERO)
            .price(price)
            .build();
    }

    private OperationReceipt depositIntoSurplus(String transactionId, String caller, BigInteger nativeValue,
                                                BigInteger surplusInStable, BigInteger bufferSupply,
                                                BigInteger price) {
        BigInteger bufferUnitPrice = collateralAccountant.bufferUnitPrice(bufferSupply, surplusInStable);
        BigInteger depositInStable = FixedPointMath.toStable(nativeValue, price);
        BigInteger mintAmount = FixedPointMath.mulFrac(depositInStable, bufferUnitPrice);
        if (mintAmount.signum() == 0) {
            throw new IllegalArgumentException("Deposit is too small to mint any buffer units");
        }

        log.debug("Buffer pricing: supply={}, surplus={}, unitPrice={}, depositInStable={}",
            bufferSupply, surplusInStable, bufferUnitPrice, depositInStable);

        ledgerService.mint(LedgerSymbol.BUFFER, caller, mintAmount, transactionId, TransactionType.DEPOSIT_BUFFER);
        eventPublisher.publishEvent(new BufferUnitMintedEvent(transactionId, caller, mintAmount, bufferUnitPrice));

        log.info("DEPOSIT_BUFFER {}: caller={}, value={}, minted={}, unitPrice={}, price={}",
            transactionId, caller, nativeValue, mintAmount, bufferUnitPrice, price);

        return receipt(transactionId, TransactionType.DEPOSIT_BUFFER, caller)
            .amountIn(nativeValue)
            .amountOut(mintAmount)
            .fee(BigInteger.ZERO)
            .price(price)
            .bufferUnitPrice(bufferUnitPrice)
            .build();
    }

    private BigInteger currentFee(BigInteger nativeAmount) {
        Optional<TokenLedger> pool = ledgerService.findLedger(LedgerSymbol.BUFFER);
        BigInteger fee = feePolicy.fee(
            nativeAmount,
            pool.isPresent(),
            pool.map(TokenLedger::getTotalSupply).orElse(BigInteger.ZERO));
        log.debug("Fee on {}: {}", nativeAmount, fee);
        return fee;
    }

    private OperationReceipt inTransaction(Function<String, OperationReceipt> operation) {
        String transactionId = UUID.randomUUID().toString();
        return transactionTemplate.execute(status -> operation.apply(transactionId));
    }

    private static OperationReceipt.OperationReceiptBuilder receipt(String transactionId, TransactionType operation,
                                                                   String caller) {
        return OperationReceipt.builder()
            .transactionId(transactionId)
            .operation(operation)
            .caller(caller)
            .completedAt(Instant.now());
    }
}
