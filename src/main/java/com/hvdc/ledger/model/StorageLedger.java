package com.hvdc.ledger.model;

import java.util.List;

/**
 * Warehouse ledgers of one storage class summed month by month.
 */
public record StorageLedger(
        StorageClass storageClass,
        List<String> warehouses,
        List<WarehouseMonth> months
) {

    public StorageLedger {
        warehouses = List.copyOf(warehouses);
        months = List.copyOf(months);
    }

    public long closingStock() {
        return months.isEmpty() ? 0 : months.get(months.size() - 1).stock();
    }
}
