package com.hvdc.ledger.exception;

/**
 * A required column role or setting cannot be resolved. Fatal for the run:
 * nothing is computed once this is thrown.
 */
public class LedgerConfigurationException extends RuntimeException {

    public LedgerConfigurationException(String message) {
        super(message);
    }

    public LedgerConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
