package com.hvdc.ledger.model;

import java.time.YearMonth;
import java.util.List;

/**
 * Monthly inbound / outbound / running stock for one warehouse, ordered by month.
 */
public record WarehouseLedger(
        String warehouse,
        List<WarehouseMonth> months
) {

    public WarehouseLedger {
        months = List.copyOf(months);
    }

    public WarehouseMonth month(YearMonth month) {
        return months.stream()
                .filter(m -> m.month().equals(month))
                .findFirst()
                .orElse(null);
    }

    public long stockAt(YearMonth month) {
        WarehouseMonth row = month(month);
        return row != null ? row.stock() : 0;
    }

    public long closingStock() {
        return months.isEmpty() ? 0 : months.get(months.size() - 1).stock();
    }
}
