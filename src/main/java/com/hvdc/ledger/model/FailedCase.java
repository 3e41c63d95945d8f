package com.hvdc.ledger.model;

/**
 * Case whose processing threw; reported and excluded from the ledgers.
 */
public record FailedCase(
        String caseId,
        String errorMessage,
        String exceptionType
) {}
