package com.hvdc.ledger.model;

import java.time.LocalDate;

/**
 * Pending case held beyond the staleness threshold.
 */
public record DeadStockRecord(
        String caseId,
        String lastWarehouse,
        LocalDate lastWarehouseDate,
        long elapsedDays,
        String tier
) {}
