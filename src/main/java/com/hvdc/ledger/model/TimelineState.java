package com.hvdc.ledger.model;

import java.time.LocalDate;

/**
 * Where a case is while its events are folded.
 *
 * @param phase    current phase
 * @param location warehouse held in, or site delivered to; {@code null} while {@link Phase#NO_LOCATION}
 * @param since    date the case entered this phase at this location
 */
public record TimelineState(Phase phase, String location, LocalDate since) {

    public enum Phase {
        NO_LOCATION,
        AT_WAREHOUSE,
        DELIVERED
    }

    public static final TimelineState NO_LOCATION = new TimelineState(Phase.NO_LOCATION, null, null);

    public static TimelineState atWarehouse(String warehouse, LocalDate since) {
        return new TimelineState(Phase.AT_WAREHOUSE, warehouse, since);
    }

    public static TimelineState delivered(String site, LocalDate on) {
        return new TimelineState(Phase.DELIVERED, site, on);
    }

    public boolean isAtWarehouse() {
        return phase == Phase.AT_WAREHOUSE;
    }

    public boolean isDelivered() {
        return phase == Phase.DELIVERED;
    }
}
