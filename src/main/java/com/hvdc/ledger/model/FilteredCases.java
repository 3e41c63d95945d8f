package com.hvdc.ledger.model;

import java.util.List;
import java.util.Map;

/**
 * Cases of a report matching a {@link CaseFilter}, with their status counts and lead times.
 */
public record FilteredCases(
        CaseFilter filter,
        List<CaseSummary> cases,
        Map<CaseStatus, Long> statusCounts,
        List<DurationStats> leadTimeByWarehouse,
        List<DurationStats> leadTimeByCategory
) {

    public int size() {
        return cases.size();
    }
}
