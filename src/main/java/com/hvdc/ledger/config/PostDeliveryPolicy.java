package com.hvdc.ledger.config;

/**
 * Handling of stamps that come after a case was delivered to a site.
 * Both policies record the event as a {@code POST_DELIVERY_EVENT} anomaly.
 */
public enum PostDeliveryPolicy {
    /** Keep the case closed; the event stays in the timeline for audit only. */
    IGNORE,
    /** Reopen the case as if it arrived from outside the network. */
    REOPEN
}
