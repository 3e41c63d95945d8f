package com.hvdc.ledger.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * In-memory snapshot of the case list: header columns plus one record per case.
 */
public record CaseTable(
        List<String> columns,
        List<CaseRecord> cases
) {

    public CaseTable {
        columns = List.copyOf(columns);
        cases = List.copyOf(cases);
    }

    public boolean isEmpty() {
        return cases.isEmpty();
    }

    /**
     * Case ids carried by more than one row, in first-seen order. Each row is still its own case.
     */
    public List<String> duplicateIds() {
        Map<String, Long> counts = cases.stream()
                .collect(Collectors.groupingBy(CaseRecord::caseId, LinkedHashMap::new, Collectors.counting()));
        return counts.entrySet().stream()
                .filter(e -> e.getValue() > 1)
                .map(Map.Entry::getKey)
                .toList();
    }
}
