package com.hvdc.ledger.service.filter;

import com.hvdc.ledger.model.CaseFilter;
import com.hvdc.ledger.model.CaseStatus;
import com.hvdc.ledger.model.CaseSummary;
import com.hvdc.ledger.model.FilteredCases;
import com.hvdc.ledger.model.LedgerReport;
import com.hvdc.ledger.service.ledger.StorageClassifier;
import com.hvdc.ledger.service.status.LeadTimeStatistics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Narrows a finished report to the cases matching a {@link CaseFilter}.
 *
 * Warehouse and site conditions match any stamp on the row, ignored ones included.
 * Storage class is that of the initial warehouse, so site-only cases never match it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CaseFilterService {

    private final StorageClassifier storageClassifier;
    private final LeadTimeStatistics leadTimeStatistics;

    public FilteredCases filter(LedgerReport report, CaseFilter filter) {
        List<CaseSummary> matching = report.cases().stream()
                .filter(predicate(filter))
                .toList();
        log.info("Filter {} matched {} of {} cases", filter, matching.size(), report.cases().size());

        Map<CaseStatus, Long> counts = new LinkedHashMap<>();
        for (CaseStatus status : CaseStatus.values()) {
            counts.put(status, 0L);
        }
        matching.forEach(c -> counts.merge(c.status(), 1L, Long::sum));

        return new FilteredCases(filter, matching, counts,
                leadTimeStatistics.byInitialWarehouse(matching),
                leadTimeStatistics.byCategory(matching));
    }

    Predicate<CaseSummary> predicate(CaseFilter filter) {
        Predicate<CaseSummary> predicate = c -> true;
        if (filter.warehouse() != null) {
            predicate = predicate.and(c -> c.wasStampedAt(filter.warehouse()));
        }
        if (filter.site() != null) {
            predicate = predicate.and(c -> c.wasStampedAt(filter.site()));
        }
        if (filter.storageClass() != null) {
            predicate = predicate.and(c -> filter.storageClass() == storageClassifier.classify(c.initialWarehouse()));
        }
        if (filter.category() != null) {
            predicate = predicate.and(c -> c.category() != null
                    && c.category().trim().equalsIgnoreCase(filter.category().trim()));
        }
        if (filter.status() != null) {
            predicate = predicate.and(c -> c.status() == filter.status());
        }
        return predicate;
    }
}
