package com.hvdc.ledger.service.timeline;

import com.hvdc.ledger.config.DuplicateArrivalPolicy;
import com.hvdc.ledger.config.LedgerSettings;
import com.hvdc.ledger.config.LedgerUnit;
import com.hvdc.ledger.config.PostDeliveryPolicy;
import com.hvdc.ledger.model.AnomalyKind;
import com.hvdc.ledger.model.CaseRecord;
import com.hvdc.ledger.model.CaseTimeline;
import com.hvdc.ledger.model.LocationEvent;
import com.hvdc.ledger.model.TimelineAnomaly;
import com.hvdc.ledger.model.TimelineState;
import com.hvdc.ledger.model.TransitionDelta;
import com.hvdc.ledger.service.extraction.ExtractedEvents;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

/**
 * Replays one case's events in time order and emits the ledger deltas they imply.
 *
 * <pre>
 *   NO_LOCATION --warehouse w--> AT_WAREHOUSE(w)        +in(w)
 *   AT_WAREHOUSE(p) --warehouse w != p--> AT_WAREHOUSE(w)  +out(p) +in(w)   (transfer, same month)
 *   AT_WAREHOUSE(p) --site s--> DELIVERED               +out(p) +siteIn(s)
 *   NO_LOCATION --site s--> DELIVERED                   +siteIn(s)
 * </pre>
 *
 * A repeated stamp for the current warehouse and anything after delivery are
 * handled by the configured {@link DuplicateArrivalPolicy} and {@link PostDeliveryPolicy}
 * and always leave an audit anomaly. The classifier keeps no state between cases.
 */
@Component
@Slf4j
public class TransitionClassifier {

    private final DuplicateArrivalPolicy duplicateArrivalPolicy;
    private final PostDeliveryPolicy postDeliveryPolicy;
    private final LedgerUnit ledgerUnit;

    public TransitionClassifier(LedgerSettings settings) {
        this.duplicateArrivalPolicy = settings.duplicateArrivalPolicy();
        this.postDeliveryPolicy = settings.postDeliveryPolicy();
        this.ledgerUnit = settings.ledgerUnit();
    }

    /**
     * Folds the extracted events of {@code record} into a timeline.
     */
    public CaseTimeline classify(CaseRecord record, ExtractedEvents extracted) {
        String caseId = record.caseId();
        int weight = ledgerUnit == LedgerUnit.QUANTITY ? record.quantity() : 1;

        List<LocationEvent> ordered = extracted.events().stream()
                .sorted(LocationEvent.CHRONOLOGICAL)
                .toList();

        TimelineState state = TimelineState.NO_LOCATION;
        LocalDate firstArrival = null;
        List<TransitionDelta> deltas = new ArrayList<>();
        List<TimelineAnomaly> anomalies = new ArrayList<>();

        LocationEvent previous = null;
        for (LocationEvent event : ordered) {
            if (previous != null && previous.date().equals(event.date())) {
                anomalies.add(new TimelineAnomaly(caseId, AnomalyKind.SAME_TIMESTAMP, event,
                        "Same date as " + previous.location() + ", applied after it by column order"));
            }
            Step step = step(state, event, caseId, weight);
            deltas.addAll(step.deltas());
            if (step.anomaly() != null) {
                anomalies.add(step.anomaly());
            }
            if (firstArrival == null && step.state().isAtWarehouse()) {
                firstArrival = step.state().since();
            }
            state = step.state();
            previous = event;
        }

        if (!anomalies.isEmpty()) {
            log.debug("Case {}: {} timeline anomalies", caseId, anomalies.size());
        }
        return new CaseTimeline(caseId, record.quantity(), record.category(), ordered, deltas, state,
                firstArrival, anomalies, extracted.unparseableColumns());
    }

    /**
     * One transition: the state after {@code event} and the deltas it emits.
     */
    public Step step(TimelineState state, LocationEvent event, String caseId, int weight) {
        YearMonth month = event.month();
        String location = event.location();

        return switch (state.phase()) {
            case NO_LOCATION -> arriveFromOutside(event, caseId, weight);

            case AT_WAREHOUSE -> {
                String current = state.location();
                if (event.isSite()) {
                    yield new Step(TimelineState.delivered(location, event.date()), List.of(
                            TransitionDelta.warehouseOutbound(current, month, caseId, weight),
                            TransitionDelta.siteInbound(location, month, caseId, weight)), null);
                }
                if (!current.equals(location)) {
                    yield new Step(TimelineState.atWarehouse(location, event.date()), List.of(
                            TransitionDelta.warehouseOutbound(current, month, caseId, weight),
                            TransitionDelta.warehouseInbound(location, month, caseId, weight)), null);
                }
                TimelineAnomaly duplicate = new TimelineAnomaly(caseId, AnomalyKind.DUPLICATE_ARRIVAL, event,
                        "Already at " + current + " since " + state.since());
                yield switch (duplicateArrivalPolicy) {
                    case IGNORE -> new Step(state, List.of(), duplicate);
                    case TRANSFER -> new Step(TimelineState.atWarehouse(location, event.date()), List.of(
                            TransitionDelta.warehouseOutbound(current, month, caseId, weight),
                            TransitionDelta.warehouseInbound(location, month, caseId, weight)), duplicate);
                };
            }

            case DELIVERED -> {
                TimelineAnomaly late = new TimelineAnomaly(caseId, AnomalyKind.POST_DELIVERY_EVENT, event,
                        "Delivered to " + state.location() + " on " + state.since());
                yield switch (postDeliveryPolicy) {
                    case IGNORE -> new Step(state, List.of(), late);
                    case REOPEN -> {
                        Step reopened = arriveFromOutside(event, caseId, weight);
                        yield new Step(reopened.state(), reopened.deltas(), late);
                    }
                };
            }
        };
    }

    private static Step arriveFromOutside(LocationEvent event, String caseId, int weight) {
        if (event.isWarehouse()) {
            return new Step(TimelineState.atWarehouse(event.location(), event.date()),
                    List.of(TransitionDelta.warehouseInbound(event.location(), event.month(), caseId, weight)), null);
        }
        return new Step(TimelineState.delivered(event.location(), event.date()),
                List.of(TransitionDelta.siteInbound(event.location(), event.month(), caseId, weight)), null);
    }

    /**
     * Output of a single transition.
     *
     * @param anomaly audit entry, or {@code null} when the event applied cleanly
     */
    public record Step(
            TimelineState state,
            List<TransitionDelta> deltas,
            TimelineAnomaly anomaly
    ) {}
}
