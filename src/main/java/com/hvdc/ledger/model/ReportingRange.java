package com.hvdc.ledger.model;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

/**
 * Inclusive calendar-month horizon of a ledger run.
 */
public record ReportingRange(YearMonth start, YearMonth end) {

    public ReportingRange {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Reporting range needs both start and end");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Reporting range end " + end + " is before start " + start);
        }
    }

    public List<YearMonth> months() {
        List<YearMonth> months = new ArrayList<>();
        for (YearMonth m = start; !m.isAfter(end); m = m.plusMonths(1)) {
            months.add(m);
        }
        return months;
    }
}
