package com.hvdc.ledger.model;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Result of folding one case's events through the transition rules.
 *
 * @param events             every extracted event in processing order, including ignored ones
 * @param deltas             ledger movements in emission order
 * @param finalState         state after the last event
 * @param firstArrivalDate   date of the first warehouse arrival that was applied, if any
 * @param anomalies          audit entries raised while folding
 * @param unparseableColumns location columns whose cell held a value that was not a date
 */
public record CaseTimeline(
        String caseId,
        int quantity,
        String category,
        List<LocationEvent> events,
        List<TransitionDelta> deltas,
        TimelineState finalState,
        LocalDate firstArrivalDate,
        List<TimelineAnomaly> anomalies,
        List<String> unparseableColumns
) {

    public CaseTimeline {
        events = List.copyOf(events);
        deltas = List.copyOf(deltas);
        anomalies = List.copyOf(anomalies);
        unparseableColumns = List.copyOf(unparseableColumns);
    }

    public boolean hasEvents() {
        return !events.isEmpty();
    }

    public boolean isDelivered() {
        return finalState.isDelivered();
    }

    public boolean isHeldInWarehouse() {
        return finalState.isAtWarehouse();
    }

    /**
     * True once any site delivery was applied, even if a later event reopened the case.
     */
    public boolean everDelivered() {
        return deltas.stream().anyMatch(d -> d.locationClass() == LocationClass.SITE);
    }

    /**
     * First site stamp in processing order. It is always applied: nothing before it can close the case.
     */
    public Optional<LocationEvent> firstDelivery() {
        return events.stream().filter(LocationEvent::isSite).findFirst();
    }

    /**
     * Earliest warehouse stamp anywhere in the case, ignored events included.
     */
    public Optional<LocationEvent> earliestWarehouseEvent() {
        return events.stream()
                .filter(LocationEvent::isWarehouse)
                .min(LocationEvent.CHRONOLOGICAL);
    }

    /**
     * Latest site stamp anywhere in the case, ignored events included.
     */
    public Optional<LocalDate> latestSiteDate() {
        return events.stream()
                .filter(LocationEvent::isSite)
                .map(LocationEvent::date)
                .max(Comparator.naturalOrder());
    }
}
