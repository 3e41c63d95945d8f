package com.hvdc.ledger.model;

/**
 * Lifecycle status of a case, derived from its full event sequence.
 */
public enum CaseStatus {
    /** No parseable location date at all. */
    NOT_RECEIVED,
    /** Seen in the network but never delivered to a site. */
    PENDING,
    /** Reached a site. */
    COMPLETED
}
