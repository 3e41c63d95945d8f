package com.hvdc.ledger.service.schema;

import java.util.List;
import java.util.stream.Stream;

/**
 * Resolved column roles for one table: warehouse columns, then site columns,
 * each in configured order.
 *
 * @param missing configured names that matched no column
 */
public record ColumnSchema(
        String idColumn,
        List<ColumnBinding> warehouses,
        List<ColumnBinding> sites,
        List<String> missing
) {

    public ColumnSchema {
        warehouses = List.copyOf(warehouses);
        sites = List.copyOf(sites);
        missing = List.copyOf(missing);
    }

    public List<ColumnBinding> all() {
        return Stream.concat(warehouses.stream(), sites.stream()).toList();
    }

    public List<String> warehouseNames() {
        return warehouses.stream().map(ColumnBinding::location).toList();
    }

    public List<String> siteNames() {
        return sites.stream().map(ColumnBinding::location).toList();
    }
}
