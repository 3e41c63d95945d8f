package com.hvdc.ledger.runner;

import com.hvdc.ledger.TestFixtures;
import com.hvdc.ledger.exception.LedgerConfigurationException;
import com.hvdc.ledger.model.CaseFilter;
import com.hvdc.ledger.model.CaseStatus;
import com.hvdc.ledger.model.CaseTable;
import com.hvdc.ledger.model.ConsolidatedReport;
import com.hvdc.ledger.model.FilteredCases;
import com.hvdc.ledger.model.LedgerReport;
import com.hvdc.ledger.model.StorageClass;
import com.hvdc.ledger.repository.CaseTableReader;
import com.hvdc.ledger.service.LedgerAnalysisOrchestrator;
import com.hvdc.ledger.service.consolidation.SupplierConsolidationService;
import com.hvdc.ledger.service.consolidation.SupplierConsolidationService.SupplierInput;
import com.hvdc.ledger.service.filter.CaseFilterService;
import com.hvdc.ledger.service.publishing.LedgerReportWriter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.env.MockEnvironment;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LedgerAnalysisRunnerTest {

    @Mock private CaseTableReader caseTableReader;
    @Mock private LedgerAnalysisOrchestrator orchestrator;
    @Mock private SupplierConsolidationService consolidationService;
    @Mock private CaseFilterService caseFilterService;
    @Mock private LedgerReportWriter reportWriter;

    private LedgerAnalysisRunner runner(MockEnvironment environment) {
        return new LedgerAnalysisRunner(caseTableReader, orchestrator, consolidationService, caseFilterService,
                reportWriter, TestFixtures.settings(), environment);
    }

    @Test
    @DisplayName("Should read, analyze and write in order using the configured paths")
    void shouldRunBatch() {
        // Given
        MockEnvironment environment = new MockEnvironment()
                .withProperty("app.ledger.input-file", "data/cases.xlsx")
                .withProperty("app.ledger.output-file", "out/report.json");
        CaseTable table = TestFixtures.scenarioTable();
        LedgerReport report = mock(LedgerReport.class);
        when(caseTableReader.read(Path.of("data/cases.xlsx"), CaseTableReader.DEFAULT_SHEET)).thenReturn(table);
        when(orchestrator.analyze(table)).thenReturn(report);

        // When
        runner(environment).run();

        // Then
        InOrder inOrder = inOrder(caseTableReader, orchestrator, reportWriter);
        inOrder.verify(caseTableReader).read(Path.of("data/cases.xlsx"), CaseTableReader.DEFAULT_SHEET);
        inOrder.verify(orchestrator).analyze(table);
        inOrder.verify(reportWriter).write(report, Path.of("out/report.json"));
        verifyNoInteractions(caseFilterService, consolidationService);
    }

    @Test
    @DisplayName("Should also write the filtered cases when a filter condition is set")
    void shouldWriteFilteredCases() {
        // Given
        MockEnvironment environment = new MockEnvironment()
                .withProperty("app.ledger.input-file", "data/cases.xlsx")
                .withProperty("app.ledger.filter.storage-class", "dangerous")
                .withProperty("app.ledger.filter.status", "pending")
                .withProperty("app.ledger.filter.output-file", "out/filtered.json");
        CaseTable table = TestFixtures.scenarioTable();
        LedgerReport report = mock(LedgerReport.class);
        FilteredCases filtered = mock(FilteredCases.class);
        CaseFilter expected = CaseFilter.builder().storageClass(StorageClass.DANGEROUS).status(CaseStatus.PENDING).build();
        when(caseTableReader.read(Path.of("data/cases.xlsx"), CaseTableReader.DEFAULT_SHEET)).thenReturn(table);
        when(orchestrator.analyze(table)).thenReturn(report);
        when(caseFilterService.filter(report, expected)).thenReturn(filtered);

        // When
        runner(environment).run();

        // Then
        verify(reportWriter).write(report, Path.of("outputs/ledger-report.json"));
        verify(reportWriter).write(filtered, Path.of("out/filtered.json"));
    }

    @Test
    @DisplayName("Should reject an unknown filter value")
    void shouldRejectUnknownFilterValue() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("app.ledger.filter.storage-class", "basement");

        assertThatThrownBy(() -> runner(environment).filter())
                .isInstanceOf(LedgerConfigurationException.class)
                .hasMessageContaining("app.ledger.filter.storage-class");
        assertThat(runner(new MockEnvironment()).filter()).isNull();
    }

    @Test
    @DisplayName("Should analyze each supplier with its own warehouses and write one consolidated report")
    void shouldRunConsolidated() {
        // Given
        MockEnvironment environment = new MockEnvironment()
                .withProperty("app.ledger.suppliers", "HITACHI, SIEMENS")
                .withProperty("app.ledger.supplier.HITACHI.input-file", "data/he.xlsx")
                .withProperty("app.ledger.supplier.HITACHI.warehouses", "WH1, WH2")
                .withProperty("app.ledger.supplier.SIEMENS.input-file", "data/sim.xlsx")
                .withProperty("app.ledger.supplier.SIEMENS.sheet", "SIM CASES")
                .withProperty("app.ledger.consolidated-output-file", "out/all.json");
        CaseTable hitachi = TestFixtures.table(TestFixtures.caseRow("H1", "WH1", "2023-01-05"));
        CaseTable siemens = TestFixtures.table(TestFixtures.caseRow("S1", "WH3", "2023-01-05"));
        ConsolidatedReport consolidated = mock(ConsolidatedReport.class);
        when(caseTableReader.read(Path.of("data/he.xlsx"), CaseTableReader.DEFAULT_SHEET)).thenReturn(hitachi);
        when(caseTableReader.read(Path.of("data/sim.xlsx"), "SIM CASES")).thenReturn(siemens);
        when(consolidationService.consolidate(any(), eq(TestFixtures.REFERENCE_DATE))).thenReturn(consolidated);

        // When
        runner(environment).run();

        // Then
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<SupplierInput>> inputs = ArgumentCaptor.forClass(List.class);
        verify(consolidationService).consolidate(inputs.capture(), eq(TestFixtures.REFERENCE_DATE));
        assertThat(inputs.getValue()).containsExactly(
                new SupplierInput("HITACHI", hitachi, List.of("WH1", "WH2")),
                new SupplierInput("SIEMENS", siemens, TestFixtures.WAREHOUSES));
        verify(reportWriter).write(consolidated, Path.of("out/all.json"));
        verify(orchestrator, never()).analyze(any());
    }

    @Test
    @DisplayName("Should fail when a listed supplier has no input file")
    void shouldRequireSupplierInputFile() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("app.ledger.suppliers", "HITACHI");

        assertThatThrownBy(() -> runner(environment).run())
                .isInstanceOf(LedgerConfigurationException.class)
                .hasMessageContaining("app.ledger.supplier.HITACHI.input-file");
        verifyNoInteractions(consolidationService);
    }
}
