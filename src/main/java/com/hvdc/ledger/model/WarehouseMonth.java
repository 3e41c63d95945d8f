package com.hvdc.ledger.model;

import java.time.YearMonth;

public record WarehouseMonth(
        YearMonth month,
        long inbound,
        long outbound,
        long stock
) {}
