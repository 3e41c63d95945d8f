package com.hvdc.ledger.service.extraction;

import com.hvdc.ledger.model.LocationEvent;

import java.util.List;

/**
 * Events found in one case row, in column order (not yet chronological).
 *
 * @param unparseableColumns location columns whose non-blank value was not a date
 */
public record ExtractedEvents(
        String caseId,
        List<LocationEvent> events,
        List<String> unparseableColumns
) {

    public ExtractedEvents {
        events = List.copyOf(events);
        unparseableColumns = List.copyOf(unparseableColumns);
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }
}
