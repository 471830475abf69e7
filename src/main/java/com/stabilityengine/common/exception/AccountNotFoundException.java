package com.stabilityengine.common.exception;

/**
 * Thrown when a native account is not found.
 */
public class AccountNotFoundException extends StabilityEngineException {

    public AccountNotFoundException(String address) {
        super("Account not found: " + address);
    }
}
