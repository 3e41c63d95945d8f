package com.hvdc.ledger.model;

import java.time.YearMonth;
import java.util.List;

/**
 * Monthly inbound and cumulative inbound for one site, ordered by month.
 */
public record SiteLedger(
        String site,
        List<SiteMonth> months
) {

    public SiteLedger {
        months = List.copyOf(months);
    }

    public SiteMonth month(YearMonth month) {
        return months.stream()
                .filter(m -> m.month().equals(month))
                .findFirst()
                .orElse(null);
    }

    public long cumulativeAt(YearMonth month) {
        SiteMonth row = month(month);
        return row != null ? row.cumulative() : 0;
    }
}
