package com.hvdc.ledger.model;

/**
 * Range totals of one supplier's ledgers, or their sum across suppliers.
 *
 * @param warehouseInbound  inbound units over the range, all warehouses
 * @param warehouseOutbound outbound units over the range, all warehouses
 * @param warehouseStock    stock held at the range end, all warehouses
 * @param siteCumulative    cumulative site inbound at the range end, all sites
 */
public record SupplierTotals(
        String supplier,
        long warehouseInbound,
        long warehouseOutbound,
        long warehouseStock,
        long siteCumulative
) {

    public SupplierTotals plus(SupplierTotals other, String name) {
        return new SupplierTotals(name,
                warehouseInbound + other.warehouseInbound,
                warehouseOutbound + other.warehouseOutbound,
                warehouseStock + other.warehouseStock,
                siteCumulative + other.siteCumulative);
    }
}
