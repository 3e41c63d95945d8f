package com.hvdc.ledger.service.status;

import com.hvdc.ledger.model.CaseSummary;
import com.hvdc.ledger.model.DurationStats;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Lead-time statistics over completed cases that have a lead time.
 */
@Component
public class LeadTimeStatistics {

    static final String UNSPECIFIED = "Unspecified";

    public List<DurationStats> byInitialWarehouse(Collection<CaseSummary> cases) {
        return group(cases, CaseSummary::initialWarehouse);
    }

    public List<DurationStats> byCategory(Collection<CaseSummary> cases) {
        return group(cases, CaseSummary::category);
    }

    private List<DurationStats> group(Collection<CaseSummary> cases, Function<CaseSummary, String> key) {
        Map<String, List<Long>> groups = cases.stream()
                .filter(CaseSummary::isCompleted)
                .filter(c -> c.leadTimeDays() != null)
                .collect(Collectors.groupingBy(
                        c -> key.apply(c) != null && !key.apply(c).isBlank() ? key.apply(c) : UNSPECIFIED,
                        TreeMap::new,
                        Collectors.mapping(CaseSummary::leadTimeDays, Collectors.toList())));

        return groups.entrySet().stream()
                .map(e -> DurationStats.of(e.getKey(), e.getValue()))
                .toList();
    }
}
