package com.hvdc.ledger.model;

/**
 * Recent-window totals for one location.
 * For sites {@code outbound} is always zero and {@code closing} is the cumulative inbound.
 */
public record LocationSummary(
        String location,
        LocationClass locationClass,
        long inbound,
        long outbound,
        long closing
) {}
