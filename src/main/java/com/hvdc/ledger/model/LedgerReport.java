package com.hvdc.ledger.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Everything one run over a case-list snapshot produces.
 * Downstream report, dashboard and map generators read this without modifying it.
 */
public record LedgerReport(
        String fingerprint,
        LocalDate referenceDate,
        ReportingRange range,
        int totalCases,
        Map<CaseStatus, Long> statusCounts,
        List<WarehouseLedger> warehouseLedgers,
        List<SiteLedger> siteLedgers,
        List<StorageLedger> storageLedgers,
        List<LocationSummary> recentSummary,
        List<CaseSummary> cases,
        List<DeadStockRecord> deadStock,
        List<DurationStats> deadStockByWarehouse,
        List<DurationStats> deadStockByStayPeriod,
        List<DurationStats> leadTimeByWarehouse,
        List<DurationStats> leadTimeByCategory,
        List<SiteKpi> siteKpis,
        List<TimelineAnomaly> anomalies,
        List<FailedCase> failures,
        long droppedDeltas
) {

    public WarehouseLedger warehouse(String name) {
        return warehouseLedgers.stream()
                .filter(l -> l.warehouse().equals(name))
                .findFirst()
                .orElse(null);
    }

    public SiteLedger site(String name) {
        return siteLedgers.stream()
                .filter(l -> l.site().equals(name))
                .findFirst()
                .orElse(null);
    }

    public StorageLedger storage(StorageClass storageClass) {
        return storageLedgers.stream()
                .filter(l -> l.storageClass() == storageClass)
                .findFirst()
                .orElse(null);
    }

    public SiteKpi siteKpi(String site) {
        return siteKpis.stream()
                .filter(k -> k.site().equals(site))
                .findFirst()
                .orElse(null);
    }

    public CaseSummary caseSummary(String caseId) {
        return cases.stream()
                .filter(c -> c.caseId().equals(caseId))
                .findFirst()
                .orElse(null);
    }
}
