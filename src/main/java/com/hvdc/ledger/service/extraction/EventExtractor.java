package com.hvdc.ledger.service.extraction;

import com.hvdc.ledger.model.CaseRecord;
import com.hvdc.ledger.model.LocationEvent;
import com.hvdc.ledger.service.schema.ColumnBinding;
import com.hvdc.ledger.service.schema.ColumnSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds the location events of one case from its warehouse and site date cells.
 * A cell that does not parse only drops that one event.
 */
@Component
@Slf4j
public class EventExtractor {

    public ExtractedEvents extract(CaseRecord record, ColumnSchema schema) {
        List<LocationEvent> events = new ArrayList<>();
        List<String> unparseable = new ArrayList<>();

        for (ColumnBinding binding : schema.all()) {
            Object value = record.cell(binding.column());
            if (DateCellParser.isBlank(value)) {
                continue;
            }
            Optional<LocalDate> date = DateCellParser.parse(value);
            if (date.isPresent()) {
                events.add(new LocationEvent(date.get(), binding.location(), binding.locationClass(),
                        binding.declarationOrder()));
            } else {
                log.debug("Case {}: unparseable date '{}' in column '{}'", record.caseId(), value, binding.column());
                unparseable.add(binding.column());
            }
        }

        return new ExtractedEvents(record.caseId(), events, unparseable);
    }
}
