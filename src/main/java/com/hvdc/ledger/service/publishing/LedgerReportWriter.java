package com.hvdc.ledger.service.publishing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hvdc.ledger.model.ConsolidatedReport;
import com.hvdc.ledger.model.FilteredCases;
import com.hvdc.ledger.model.LedgerReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes ledger, consolidated and filtered reports as JSON for the report, dashboard and map generators.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LedgerReportWriter {

    private final ObjectMapper objectMapper;

    public String toJson(LedgerReport report) {
        return serialize(report, "ledger report " + report.fingerprint());
    }

    public void write(LedgerReport report, Path target) {
        writeJson(serialize(report, "ledger report " + report.fingerprint()), target);
        log.info("Ledger report written to {} ({} warehouses, {} sites, {} cases)",
                target, report.warehouseLedgers().size(), report.siteLedgers().size(), report.cases().size());
    }

    public void write(ConsolidatedReport report, Path target) {
        writeJson(serialize(report, "consolidated report"), target);
        log.info("Consolidated report written to {} ({} suppliers)", target, report.suppliers().size());
    }

    public void write(FilteredCases filtered, Path target) {
        writeJson(serialize(filtered, "filtered cases"), target);
        log.info("Filtered cases written to {} ({} cases)", target, filtered.size());
    }

    private String serialize(Object value, String description) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + description, e);
        }
    }

    private static void writeJson(String json, Path target) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, json);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write report to " + target, e);
        }
    }
}
