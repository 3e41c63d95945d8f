package com.hvdc.ledger.config;

/**
 * What a ledger count measures.
 */
public enum LedgerUnit {
    /** One per case. */
    CASES,
    /** Case quantity. */
    QUANTITY
}
