package com.hvdc.ledger.exception;

/**
 * The case list workbook could not be opened or has no usable header.
 */
public class CaseTableReadException extends RuntimeException {

    public CaseTableReadException(String message) {
        super(message);
    }

    public CaseTableReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
