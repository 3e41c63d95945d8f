package com.hvdc.ledger.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Per-supplier reports with their range totals and a grand total across suppliers.
 */
public record ConsolidatedReport(
        LocalDate referenceDate,
        Map<String, LedgerReport> reports,
        List<SupplierTotals> suppliers,
        SupplierTotals grandTotal
) {

    public static final String GRAND_TOTAL = "GRAND TOTAL";

    public SupplierTotals supplier(String name) {
        return suppliers.stream()
                .filter(s -> s.supplier().equals(name))
                .findFirst()
                .orElse(null);
    }
}
