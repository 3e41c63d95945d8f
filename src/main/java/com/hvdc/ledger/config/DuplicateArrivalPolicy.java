package com.hvdc.ledger.config;

/**
 * Handling of a warehouse stamp for the warehouse a case already sits in.
 * Both policies record the event as a {@code DUPLICATE_ARRIVAL} anomaly.
 */
public enum DuplicateArrivalPolicy {
    /** No delta, state unchanged. */
    IGNORE,
    /** Outbound and inbound on the same warehouse in the stamp's month. */
    TRANSFER
}
