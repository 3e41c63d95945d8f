package com.hvdc.ledger.model;

import java.time.YearMonth;

public record SiteMonth(
        YearMonth month,
        long inbound,
        long cumulative
) {}
