package com.hvdc.ledger.model;

/**
 * Named urgency tier applied to dead stock at or above {@code minDays}.
 */
public record UrgencyTier(String name, long minDays) {

    public static final String STANDARD = "standard";

    public UrgencyTier {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tier name must not be blank");
        }
        if (minDays < 0) {
            throw new IllegalArgumentException("Tier minDays must be >= 0: " + minDays);
        }
    }
}
