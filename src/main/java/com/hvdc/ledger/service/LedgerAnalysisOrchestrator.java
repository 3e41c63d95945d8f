package com.hvdc.ledger.service;

import com.hvdc.ledger.config.AppMetrics;
import com.hvdc.ledger.config.LedgerSettings;
import com.hvdc.ledger.model.CaseStatus;
import com.hvdc.ledger.model.CaseSummary;
import com.hvdc.ledger.model.CaseTable;
import com.hvdc.ledger.model.CaseTimeline;
import com.hvdc.ledger.model.DeadStockRecord;
import com.hvdc.ledger.model.LedgerReport;
import com.hvdc.ledger.model.ReportingRange;
import com.hvdc.ledger.model.SiteKpi;
import com.hvdc.ledger.model.StorageLedger;
import com.hvdc.ledger.model.TimelineAnomaly;
import com.hvdc.ledger.service.cache.LedgerReportCache;
import com.hvdc.ledger.service.cache.SnapshotFingerprinter;
import com.hvdc.ledger.service.deadstock.DeadStockSelector;
import com.hvdc.ledger.service.ledger.LedgerBook;
import com.hvdc.ledger.service.ledger.MonthlyLedgerAggregator;
import com.hvdc.ledger.service.ledger.StorageClassifier;
import com.hvdc.ledger.service.processing.CaseProcessingService;
import com.hvdc.ledger.service.processing.CaseProcessingService.ProcessingOutput;
import com.hvdc.ledger.service.schema.ColumnSchema;
import com.hvdc.ledger.service.schema.SchemaClassifier;
import com.hvdc.ledger.service.status.CaseStatusClassifier;
import com.hvdc.ledger.service.status.LeadTimeStatistics;
import com.hvdc.ledger.service.status.SiteKpiCalculator;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * Runs the ledger pipeline over one case-list snapshot.
 *
 * 1. SchemaClassifier       - resolve warehouse/site columns (fails fast)
 * 2. CaseProcessingService  - per-case extraction + transition fold, in parallel
 * 3. MonthlyLedgerAggregator - month-keyed reduction into warehouse/site ledgers
 * 4. Status, lead time, site reach and dead stock over the per-case timelines
 *
 * Reports are cached by snapshot fingerprint; a changed snapshot is always recomputed.
 */
@Service
@Slf4j
public class LedgerAnalysisOrchestrator {

    static final String RUN_ID = "runId";

    private final SchemaClassifier schemaClassifier;
    private final CaseProcessingService caseProcessingService;
    private final MonthlyLedgerAggregator ledgerAggregator;
    private final CaseStatusClassifier statusClassifier;
    private final LeadTimeStatistics leadTimeStatistics;
    private final SiteKpiCalculator siteKpiCalculator;
    private final StorageClassifier storageClassifier;
    private final DeadStockSelector deadStockSelector;
    private final LedgerReportCache reportCache;
    private final SnapshotFingerprinter fingerprinter;
    private final LedgerSettings settings;
    private final AppMetrics metrics;
    private final ExecutorService executor;

    @Value("${app.cache.report.enabled:true}")
    private boolean reportCacheEnabled;

    public LedgerAnalysisOrchestrator(
            SchemaClassifier schemaClassifier,
            CaseProcessingService caseProcessingService,
            MonthlyLedgerAggregator ledgerAggregator,
            CaseStatusClassifier statusClassifier,
            LeadTimeStatistics leadTimeStatistics,
            SiteKpiCalculator siteKpiCalculator,
            StorageClassifier storageClassifier,
            DeadStockSelector deadStockSelector,
            LedgerReportCache reportCache,
            SnapshotFingerprinter fingerprinter,
            LedgerSettings settings,
            AppMetrics metrics,
            @Qualifier("caseProcessingExecutor") ExecutorService executor) {
        this.schemaClassifier = schemaClassifier;
        this.caseProcessingService = caseProcessingService;
        this.ledgerAggregator = ledgerAggregator;
        this.statusClassifier = statusClassifier;
        this.leadTimeStatistics = leadTimeStatistics;
        this.siteKpiCalculator = siteKpiCalculator;
        this.storageClassifier = storageClassifier;
        this.deadStockSelector = deadStockSelector;
        this.reportCache = reportCache;
        this.fingerprinter = fingerprinter;
        this.settings = settings;
        this.metrics = metrics;
        this.executor = executor;
    }

    /**
     * Analyze with the configured reference date (today when unset).
     */
    public LedgerReport analyze(CaseTable table) {
        return analyze(table, settings.effectiveReferenceDate());
    }

    /**
     * Analyze a snapshot as of {@code referenceDate}.
     *
     * @throws com.hvdc.ledger.exception.LedgerConfigurationException if the column roles cannot be resolved
     */
    public LedgerReport analyze(CaseTable table, LocalDate referenceDate) {
        return analyze(table, referenceDate, settings.warehouses());
    }

    /**
     * Analyze a snapshot whose workbook declares its own warehouse columns.
     */
    public LedgerReport analyze(CaseTable table, LocalDate referenceDate, List<String> warehouses) {
        ColumnSchema schema = schemaClassifier.classify(table.columns(), warehouses);
        LedgerSettings runSettings = warehouses.equals(settings.warehouses())
                ? settings : settings.toBuilder().warehouses(warehouses).build();
        String fingerprint = fingerprinter.fingerprint(table, runSettings, referenceDate);

        MDC.put(RUN_ID, fingerprint.substring(0, 12));
        try {
            return reportCacheEnabled
                    ? reportCache.getOrCompute(fingerprint, () -> compute(table, schema, referenceDate, fingerprint))
                    : compute(table, schema, referenceDate, fingerprint);
        } finally {
            MDC.remove(RUN_ID);
        }
    }

    /**
     * Dead stock of a finished report at a different threshold.
     */
    public List<DeadStockRecord> deadStock(LedgerReport report, long thresholdDays) {
        return deadStockSelector.select(report.cases(), thresholdDays);
    }

    LedgerReport compute(CaseTable table, ColumnSchema schema, LocalDate referenceDate, String fingerprint) {
        long startTime = System.currentTimeMillis();

        log.info("═══════════════════════════════════════════════════════════════");
        log.info("PIPELINE START: {} cases | reference date {}", table.cases().size(), referenceDate);
        log.info("═══════════════════════════════════════════════════════════════");
        if (table.isEmpty()) {
            log.warn("Case list is empty, ledgers will only hold zero months");
        }

        // STAGE 1: extraction + transition classification
        log.info("STAGE 1: Case classification");
        long classifyStart = System.currentTimeMillis();
        ProcessingOutput output = caseProcessingService.process(table.cases(), schema, executor);
        List<CaseTimeline> timelines = output.timelines();
        long classifyTime = System.currentTimeMillis() - classifyStart;
        metrics.recordClassificationTime(classifyTime);

        int parseWarnings = timelines.stream().mapToInt(t -> t.unparseableColumns().size()).sum();
        if (parseWarnings > 0) {
            log.warn("{} location cells could not be parsed as dates and were treated as absent", parseWarnings);
        }
        List<TimelineAnomaly> anomalies = timelines.stream()
                .flatMap(t -> t.anomalies().stream())
                .toList();
        if (!anomalies.isEmpty()) {
            log.warn("{} timeline anomalies recorded for audit", anomalies.size());
        }

        // STAGE 2: monthly ledgers
        log.info("STAGE 2: Monthly ledger aggregation");
        long aggregateStart = System.currentTimeMillis();
        ReportingRange range = MonthlyLedgerAggregator.resolveRange(
                settings.rangeStart(), settings.rangeEnd(), timelines, referenceDate);
        LedgerBook book = ledgerAggregator.aggregate(timelines, range, schema);
        List<StorageLedger> storageLedgers = ledgerAggregator.rollUpByStorage(book, storageClassifier);
        long aggregateTime = System.currentTimeMillis() - aggregateStart;
        metrics.recordAggregationTime(aggregateTime);

        // STAGE 3: status and lead time
        log.info("STAGE 3: Status and lead time");
        List<CaseSummary> summaries = timelines.stream()
                .map(t -> statusClassifier.summarize(t, referenceDate))
                .toList();
        Map<CaseStatus, Long> statusCounts = countByStatus(summaries);
        List<SiteKpi> siteKpis = siteKpiCalculator.calculate(timelines, schema.siteNames());
        long notReceived = statusCounts.get(CaseStatus.NOT_RECEIVED);
        if (notReceived > 0) {
            log.warn("{} cases have no location events and are excluded from the ledgers", notReceived);
        }

        // STAGE 4: dead stock
        log.info("STAGE 4: Dead stock (threshold {}d)", settings.deadStockThresholdDays());
        List<DeadStockRecord> deadStock = deadStockSelector.select(summaries, settings.deadStockThresholdDays());

        LedgerReport report = new LedgerReport(
                fingerprint,
                referenceDate,
                range,
                table.cases().size(),
                statusCounts,
                book.warehouses(),
                book.sites(),
                storageLedgers,
                ledgerAggregator.summarizeRecent(book, settings.recentWindowMonths()),
                summaries,
                deadStock,
                deadStockSelector.byWarehouse(deadStock),
                deadStockSelector.byStayPeriod(deadStock),
                leadTimeStatistics.byInitialWarehouse(summaries),
                leadTimeStatistics.byCategory(summaries),
                siteKpis,
                anomalies,
                output.failures(),
                book.droppedDeltas());

        long totalTime = System.currentTimeMillis() - startTime;
        metrics.recordTotalRunTime(totalTime);
        metrics.incrementCases(timelines.size(), (int) notReceived, output.failures().size());
        metrics.incrementParseWarnings(parseWarnings);
        metrics.incrementAnomalies(anomalies.size());

        log.info("═══════════════════════════════════════════════════════════════");
        log.info("PIPELINE COMPLETE | Total: {}ms", totalTime);
        log.info("  Classify: {}ms | Aggregate: {}ms | Range: {}..{}", classifyTime, aggregateTime,
                range.start(), range.end());
        log.info("  Status: {} | Dead stock: {} | Failures: {}", statusCounts, deadStock.size(),
                output.failures().size());
        log.info("═══════════════════════════════════════════════════════════════");

        return report;
    }

    private static Map<CaseStatus, Long> countByStatus(List<CaseSummary> summaries) {
        Map<CaseStatus, Long> counts = new LinkedHashMap<>();
        for (CaseStatus status : CaseStatus.values()) {
            counts.put(status, 0L);
        }
        summaries.forEach(s -> counts.merge(s.status(), 1L, Long::sum));
        return counts;
    }
}
