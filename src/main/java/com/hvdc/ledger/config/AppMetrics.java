package com.hvdc.ledger.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Run metrics for the ledger engine.
 *
 * Key metrics:
 * - ledger.case.classify    → per-run extraction + classification time
 * - ledger.aggregate        → monthly ledger fold time
 * - ledger.run.total        → end-to-end run time
 * - ledger.cases.*          → processed / not-received / failed cases
 * - ledger.parse.warnings   → date cells that did not parse
 * - ledger.anomalies        → timeline anomalies surfaced for audit
 * - ledger.report.cache.*   → report cache hits / misses
 */
@Component
@Getter
public class AppMetrics {

    private final Timer classificationTimer;
    private final Timer aggregationTimer;
    private final Timer totalRunTimer;

    private final Counter casesProcessedCounter;
    private final Counter casesNotReceivedCounter;
    private final Counter casesFailedCounter;
    private final Counter parseWarningsCounter;
    private final Counter anomaliesCounter;
    private final Counter reportCacheHitsCounter;
    private final Counter reportCacheMissesCounter;

    public AppMetrics(MeterRegistry registry) {
        this.classificationTimer = Timer.builder("ledger.case.classify")
                .description("Event extraction and transition classification for all cases of a run")
                .register(registry);

        this.aggregationTimer = Timer.builder("ledger.aggregate")
                .description("Monthly ledger aggregation time")
                .register(registry);

        this.totalRunTimer = Timer.builder("ledger.run.total")
                .description("Total ledger run time")
                .register(registry);

        this.casesProcessedCounter = Counter.builder("ledger.cases.processed")
                .description("Cases classified")
                .register(registry);

        this.casesNotReceivedCounter = Counter.builder("ledger.cases.not_received")
                .description("Cases without any parseable location date")
                .register(registry);

        this.casesFailedCounter = Counter.builder("ledger.cases.failed")
                .description("Cases whose processing failed")
                .register(registry);

        this.parseWarningsCounter = Counter.builder("ledger.parse.warnings")
                .description("Location cells that could not be parsed as dates")
                .register(registry);

        this.anomaliesCounter = Counter.builder("ledger.anomalies")
                .description("Timeline anomalies surfaced for audit")
                .register(registry);

        this.reportCacheHitsCounter = Counter.builder("ledger.report.cache.hits")
                .description("Runs served from the report cache")
                .register(registry);

        this.reportCacheMissesCounter = Counter.builder("ledger.report.cache.misses")
                .description("Runs that had to be computed")
                .register(registry);
    }

    public void recordClassificationTime(long millis) {
        classificationTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void recordAggregationTime(long millis) {
        aggregationTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void recordTotalRunTime(long millis) {
        totalRunTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void incrementCases(int processed, int notReceived, int failed) {
        casesProcessedCounter.increment(processed);
        casesNotReceivedCounter.increment(notReceived);
        casesFailedCounter.increment(failed);
    }

    public void incrementParseWarnings(int count) {
        parseWarningsCounter.increment(count);
    }

    public void incrementAnomalies(int count) {
        anomaliesCounter.increment(count);
    }

    public void incrementReportCacheHits() {
        reportCacheHitsCounter.increment();
    }

    public void incrementReportCacheMisses() {
        reportCacheMissesCounter.increment();
    }
}
