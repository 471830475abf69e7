package com.stabilityengine.common.exception;

import java.math.BigInteger;

/**
 * Thrown when an outbound native transfer is rejected by its recipient.
 * The operation that issued the transfer is rolled back as a whole.
 */
public class RefundTransferException extends StabilityEngineException {

    private final String recipient;
    private final BigInteger amount;

    public RefundTransferException(String recipient, BigInteger amount, String reason) {
        super(String.format("Refund of %s to %s failed: %s", amount, recipient, reason));
        this.recipient = recipient;
        this.amount = amount;
    }

    public RefundTransferException(String recipient, BigInteger amount, String reason, Throwable cause) {
        super(String.format("Refund of %s to %s failed: %s", amount, recipient, reason), cause);
        this.recipient = recipient;
        this.amount = amount;
    }

    public String getRecipient() {
        return recipient;
    }

    public BigInteger getAmount() {
        return amount;
    }
}
