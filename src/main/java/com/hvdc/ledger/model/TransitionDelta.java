package com.hvdc.ledger.model;

import java.time.YearMonth;

/**
 * A single ledger movement produced by the transition classifier.
 * A site inbound is a delta with {@link LocationClass#SITE} and {@link Direction#INBOUND}.
 */
public record TransitionDelta(
        String location,
        LocationClass locationClass,
        Direction direction,
        YearMonth month,
        String caseId,
        int quantity
) {

    public static TransitionDelta warehouseInbound(String warehouse, YearMonth month, String caseId, int quantity) {
        return new TransitionDelta(warehouse, LocationClass.WAREHOUSE, Direction.INBOUND, month, caseId, quantity);
    }

    public static TransitionDelta warehouseOutbound(String warehouse, YearMonth month, String caseId, int quantity) {
        return new TransitionDelta(warehouse, LocationClass.WAREHOUSE, Direction.OUTBOUND, month, caseId, quantity);
    }

    public static TransitionDelta siteInbound(String site, YearMonth month, String caseId, int quantity) {
        return new TransitionDelta(site, LocationClass.SITE, Direction.INBOUND, month, caseId, quantity);
    }
}
