package com.hvdc.ledger.service.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.hvdc.ledger.config.AppMetrics;
import com.hvdc.ledger.model.LedgerReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;

/**
 * Cache-aside wrapper for finished reports.
 *
 * Read: look up the snapshot fingerprint → on miss compute the report → store it.
 * Reports are immutable, so a cached instance can be handed to any number of readers.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LedgerReportCache {

    private final Cache<String, LedgerReport> ledgerReportCache;
    private final AppMetrics metrics;

    public LedgerReport getOrCompute(String fingerprint, Supplier<LedgerReport> computation) {
        LedgerReport cached = ledgerReportCache.getIfPresent(fingerprint);
        if (cached != null) {
            log.info("Report cache hit for snapshot {}", shortId(fingerprint));
            metrics.incrementReportCacheHits();
            return cached;
        }

        metrics.incrementReportCacheMisses();
        LedgerReport report = computation.get();
        ledgerReportCache.put(fingerprint, report);
        return report;
    }

    public void invalidateAll() {
        ledgerReportCache.invalidateAll();
    }

    public CacheStats getStats() {
        var stats = ledgerReportCache.stats();
        return new CacheStats(ledgerReportCache.estimatedSize(), stats.hitCount(), stats.missCount(), stats.hitRate());
    }

    static String shortId(String fingerprint) {
        return fingerprint.length() > 12 ? fingerprint.substring(0, 12) : fingerprint;
    }

    /**
     * Statistics for the report cache.
     */
    public record CacheStats(
            long size,
            long hits,
            long misses,
            double hitRate
    ) {}
}
