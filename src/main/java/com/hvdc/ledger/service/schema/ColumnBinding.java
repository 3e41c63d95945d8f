package com.hvdc.ledger.service.schema;

import com.hvdc.ledger.model.LocationClass;

/**
 * A configured location name bound to the table column that carries its dates.
 *
 * @param location         configured warehouse/site name
 * @param column           header text as it appears in the table
 * @param declarationOrder position across all bound columns, warehouses first
 */
public record ColumnBinding(
        String location,
        String column,
        LocationClass locationClass,
        int declarationOrder
) {}
