package com.hvdc.ledger.model;

import java.util.Map;

/**
 * One row of the case list as loaded from the source table.
 * Cell values are kept raw; date parsing happens during event extraction.
 */
public record CaseRecord(
        String caseId,
        int quantity,
        String category,
        Map<String, Object> cells
) {

    public CaseRecord {
        quantity = Math.max(quantity, 1);
        cells = cells == null ? Map.of() : Map.copyOf(cells);
    }

    public Object cell(String column) {
        return cells.get(column);
    }
}
