package com.hvdc.ledger.service.status;

import com.hvdc.ledger.config.LeadTimeMode;
import com.hvdc.ledger.config.LedgerSettings;
import com.hvdc.ledger.model.CaseStatus;
import com.hvdc.ledger.model.CaseSummary;
import com.hvdc.ledger.model.CaseTimeline;
import com.hvdc.ledger.model.LocationClass;
import com.hvdc.ledger.model.LocationEvent;
import com.hvdc.ledger.model.TimelineState;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Derives status, staleness and lead time for one case timeline.
 *
 * Pending cases age from the arrival at the warehouse they sit in. Lead time follows
 * {@link LeadTimeMode}: {@code SPAN} measures latest site stamp minus earliest warehouse
 * stamp, {@code TRANSITION_CHAIN} measures first delivery minus first applied arrival.
 */
@Component
public class CaseStatusClassifier {

    private final LeadTimeMode leadTimeMode;

    public CaseStatusClassifier(LedgerSettings settings) {
        this.leadTimeMode = settings.leadTimeMode();
    }

    public CaseSummary summarize(CaseTimeline timeline, LocalDate referenceDate) {
        String initialWarehouse = timeline.earliestWarehouseEvent().map(LocationEvent::location).orElse(null);

        if (!timeline.hasEvents()) {
            return new CaseSummary(timeline.caseId(), CaseStatus.NOT_RECEIVED, null, null, null, null, null,
                    null, timeline.category(), timeline.quantity(), List.of());
        }
        List<String> stamped = timeline.events().stream().map(LocationEvent::location).toList();

        TimelineState state = timeline.finalState();
        LocationClass lastClass = state.isDelivered() ? LocationClass.SITE : LocationClass.WAREHOUSE;
        LocalDate lastWarehouseDate = state.isAtWarehouse() ? state.since() : null;

        if (timeline.everDelivered()) {
            return new CaseSummary(timeline.caseId(), CaseStatus.COMPLETED, null, leadTime(timeline),
                    state.location(), lastClass, lastWarehouseDate, initialWarehouse,
                    timeline.category(), timeline.quantity(), stamped);
        }

        long elapsed = ChronoUnit.DAYS.between(state.since(), referenceDate);
        return new CaseSummary(timeline.caseId(), CaseStatus.PENDING, elapsed, null,
                state.location(), lastClass, lastWarehouseDate, initialWarehouse,
                timeline.category(), timeline.quantity(), stamped);
    }

    Long leadTime(CaseTimeline timeline) {
        return switch (leadTimeMode) {
            case SPAN -> timeline.earliestWarehouseEvent()
                    .flatMap(first -> timeline.latestSiteDate()
                            .map(last -> ChronoUnit.DAYS.between(first.date(), last)))
                    .orElse(null);
            case TRANSITION_CHAIN -> timeline.firstArrivalDate() == null ? null
                    : timeline.firstDelivery()
                            .map(delivery -> ChronoUnit.DAYS.between(timeline.firstArrivalDate(), delivery.date()))
                            .orElse(null);
        };
    }
}
