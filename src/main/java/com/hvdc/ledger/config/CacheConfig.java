package com.hvdc.ledger.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.hvdc.ledger.model.LedgerReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Caffeine cache for finished reports, keyed by snapshot fingerprint.
 * A changed snapshot hashes to a new key, so stale entries are never served; the TTL only bounds memory.
 */
@Configuration
@Slf4j
public class CacheConfig {

    @Value("${app.cache.report.max-size:16}")
    private int reportMaxSize;

    @Value("${app.cache.report.ttl-minutes:60}")
    private int reportTtlMinutes;

    @Bean
    public Cache<String, LedgerReport> ledgerReportCache() {
        log.info("Creating ledger report cache: maxSize={}, ttl={}m", reportMaxSize, reportTtlMinutes);
        return Caffeine.newBuilder()
                .maximumSize(reportMaxSize)
                .expireAfterWrite(Duration.ofMinutes(reportTtlMinutes))
                .recordStats()
                .build();
    }
}
