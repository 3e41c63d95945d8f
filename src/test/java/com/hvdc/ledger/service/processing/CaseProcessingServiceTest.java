package com.hvdc.ledger.service.processing;

import com.hvdc.ledger.TestFixtures;
import com.hvdc.ledger.model.CaseRecord;
import com.hvdc.ledger.model.CaseTimeline;
import com.hvdc.ledger.model.FailedCase;
import com.hvdc.ledger.service.extraction.EventExtractor;
import com.hvdc.ledger.service.processing.CaseProcessingService.ProcessingOutput;
import com.hvdc.ledger.service.schema.ColumnSchema;
import com.hvdc.ledger.service.timeline.TransitionClassifier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static com.hvdc.ledger.TestFixtures.caseRow;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;

/**
 * Unit tests for CaseProcessingService.
 *
 * Tests verify:
 * - Cases are classified in parallel and returned in input order
 * - A failing case is isolated into the failure list
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CaseProcessingServiceTest {

    @Spy
    private EventExtractor eventExtractor;

    private final ColumnSchema schema = TestFixtures.schema();
    private CaseProcessingService service;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        service = new CaseProcessingService(eventExtractor, new TransitionClassifier(TestFixtures.settings()), 5);
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Should classify a single case")
    void shouldProcessSingleCase() {
        // Given
        List<CaseRecord> cases = List.of(caseRow("C1", "WH1", "2023-01-05", "S1", "2023-05-01"));

        // When
        ProcessingOutput output = service.process(cases, schema, executor);

        // Then
        assertThat(output.timelines()).hasSize(1);
        assertThat(output.failures()).isEmpty();
        assertThat(output.timelines().get(0).deltas()).hasSize(3);
    }

    @Test
    @DisplayName("Should classify many cases in parallel and keep input order")
    @Timeout(value = 5, unit = TimeUnit.SECONDS)
    void shouldKeepInputOrder() {
        // Given
        List<CaseRecord> cases = IntStream.range(0, 200)
                .mapToObj(i -> caseRow(String.format("C%03d", i), "WH" + (i % 3 + 1), "2023-0" + (i % 9 + 1) + "-15"))
                .toList();

        // When
        ProcessingOutput output = service.process(cases, schema, executor);

        // Then
        assertThat(output.failures()).isEmpty();
        assertThat(output.timelines()).extracting(CaseTimeline::caseId)
                .containsExactlyElementsOf(cases.stream().map(CaseRecord::caseId).toList());
        assertThat(output.timelines()).allMatch(CaseTimeline::isHeldInWarehouse);
    }

    @Test
    @DisplayName("Should isolate a failing case and process the others")
    void shouldIsolateFailures() {
        // Given
        doThrow(new IllegalStateException("corrupt row"))
                .when(eventExtractor).extract(argThat(r -> r != null && r.caseId().equals("BAD")), any());
        List<CaseRecord> cases = List.of(
                caseRow("C1", "WH1", "2023-01-05"),
                caseRow("BAD", "WH2", "2023-02-05"),
                caseRow("C3", "S1", "2023-03-05"));

        // When
        ProcessingOutput output = service.process(cases, schema, executor);

        // Then
        assertThat(output.timelines()).extracting(CaseTimeline::caseId).containsExactly("C1", "C3");
        assertThat(output.failures()).containsExactly(
                new FailedCase("BAD", "corrupt row", "IllegalStateException"));
    }

    @Test
    @DisplayName("Should return empty output for an empty batch")
    void shouldHandleEmptyBatch() {
        ProcessingOutput output = service.process(List.of(), schema, executor);

        assertThat(output.timelines()).isEmpty();
        assertThat(output.failures()).isEmpty();
    }
}
