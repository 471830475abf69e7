package com.stabilityengine.custody;

import java.math.BigInteger;

/**
 * Custody of the native asset backing the stable supply.
 *
 * The engine never touches native balances directly. Attached value is pulled
 * into the reserve with {@link #escrow}, refunds leave it through
 * {@link #transfer}. The recipient of a transfer may run its own logic and may
 * refuse the value; implementations must surface that as a failure rather than
 * silently keeping the funds.
 */
public interface NativeAssetGateway {

    /**
     * Native balance currently held by the engine reserve, including value
     * escrowed by the operation in progress.
     */
    BigInteger reserveBalance();

    /**
     * Move value attached to an operation from the caller into the reserve.
     *
     * @param from the caller's native account
     * @param amount value attached to the operation
     * @throws com.stabilityengine.common.exception.InsufficientFundsException if the caller cannot cover it
     * @throws com.stabilityengine.common.exception.AccountNotFoundException if the caller has no account
     */
    void escrow(String from, BigInteger amount);

    /**
     * Send value out of the reserve.
     *
     * @param to recipient native account
     * @param amount value to send
     * @throws com.stabilityengine.common.exception.RefundTransferException if the recipient rejects it
     */
    void transfer(String to, BigInteger amount);
}
