package com.hvdc.ledger.model;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Comparator;

/**
 * One dated location stamp taken from a case row.
 *
 * @param date             day the case was stamped at the location
 * @param location         warehouse or site name (the column it came from)
 * @param locationClass    warehouse or site
 * @param declarationOrder position of the column in the configured column order,
 *                         used to order events that share a date
 */
public record LocationEvent(
        LocalDate date,
        String location,
        LocationClass locationClass,
        int declarationOrder
) {

    /**
     * Ascending by date, then by column declaration order.
     */
    public static final Comparator<LocationEvent> CHRONOLOGICAL =
            Comparator.comparing(LocationEvent::date)
                    .thenComparingInt(LocationEvent::declarationOrder);

    public YearMonth month() {
        return YearMonth.from(date);
    }

    public boolean isWarehouse() {
        return locationClass == LocationClass.WAREHOUSE;
    }

    public boolean isSite() {
        return locationClass == LocationClass.SITE;
    }
}
