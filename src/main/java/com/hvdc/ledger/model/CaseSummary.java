package com.hvdc.ledger.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Per-case output row.
 *
 * @param elapsedDays  days since the last warehouse arrival, only for {@link CaseStatus#PENDING}
 * @param leadTimeDays delivery lead time, only for {@link CaseStatus#COMPLETED} cases with a warehouse stamp
 * @param stampedLocations every warehouse and site the row carries a date for, in processing order
 */
public record CaseSummary(
        String caseId,
        CaseStatus status,
        Long elapsedDays,
        Long leadTimeDays,
        String lastKnownLocation,
        LocationClass lastKnownClass,
        LocalDate lastWarehouseDate,
        String initialWarehouse,
        String category,
        int quantity,
        List<String> stampedLocations
) {

    public CaseSummary {
        stampedLocations = stampedLocations == null ? List.of() : List.copyOf(stampedLocations);
    }

    public boolean wasStampedAt(String location) {
        return stampedLocations.contains(location);
    }

    public boolean isPending() {
        return status == CaseStatus.PENDING;
    }

    public boolean isCompleted() {
        return status == CaseStatus.COMPLETED;
    }
}
