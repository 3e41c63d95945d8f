package com.hvdc.ledger.service.extraction;

import com.hvdc.ledger.TestFixtures;
import com.hvdc.ledger.model.CaseRecord;
import com.hvdc.ledger.model.LocationClass;
import com.hvdc.ledger.model.LocationEvent;
import com.hvdc.ledger.service.schema.ColumnSchema;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static com.hvdc.ledger.TestFixtures.caseRow;
import static com.hvdc.ledger.TestFixtures.caseRowWith;
import static org.assertj.core.api.Assertions.assertThat;

class EventExtractorTest {

    private final EventExtractor extractor = new EventExtractor();
    private final ColumnSchema schema = TestFixtures.schema();

    @Test
    @DisplayName("Should emit one event per dated warehouse and site cell")
    void shouldEmitEventPerDatedCell() {
        CaseRecord record = caseRow("C1", "WH1", "2023-01-05", "WH2", "2023-03-10", "S1", "2023-05-01");

        ExtractedEvents extracted = extractor.extract(record, schema);

        assertThat(extracted.events()).containsExactlyInAnyOrder(
                new LocationEvent(LocalDate.of(2023, 1, 5), "WH1", LocationClass.WAREHOUSE, 0),
                new LocationEvent(LocalDate.of(2023, 3, 10), "WH2", LocationClass.WAREHOUSE, 1),
                new LocationEvent(LocalDate.of(2023, 5, 1), "S1", LocationClass.SITE, 3));
        assertThat(extracted.unparseableColumns()).isEmpty();
    }

    @Test
    @DisplayName("Should drop only the unparseable cell and report its column")
    void shouldDropUnparseableCell() {
        CaseRecord record = caseRow("C5", "WH1", "2023-01-05", "WH2", "soon", "S1", "2023-05-01");

        ExtractedEvents extracted = extractor.extract(record, schema);

        assertThat(extracted.events()).extracting(LocationEvent::location).containsExactlyInAnyOrder("WH1", "S1");
        assertThat(extracted.unparseableColumns()).containsExactly("WH2");
    }

    @Test
    @DisplayName("Should return no events for a case without dates")
    void shouldReturnEmptyForUndatedCase() {
        CaseRecord record = caseRow("C3", "WH1", "not a date", "S2", "TBD");

        ExtractedEvents extracted = extractor.extract(record, schema);

        assertThat(extracted.isEmpty()).isTrue();
        assertThat(extracted.unparseableColumns()).containsExactly("WH1", "S2");
    }

    @Test
    @DisplayName("Should not read metadata columns as events")
    void shouldIgnoreMetadata() {
        CaseRecord record = caseRowWith("C9", 3, "Electrical", "WH3", "2024-06-30");

        ExtractedEvents extracted = extractor.extract(record, schema);

        assertThat(extracted.events()).singleElement()
                .satisfies(e -> assertThat(e.location()).isEqualTo("WH3"));
    }
}
