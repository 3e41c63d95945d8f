package com.hvdc.ledger.service.extraction;

import org.apache.poi.ss.usermodel.DateUtil;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Date;
import java.util.List;
import java.util.Optional;

/**
 * Turns a raw location cell into a calendar day.
 *
 * Accepts date objects, Excel serial numbers and the text layouts found in the
 * case lists. Time of day is dropped: ledgers work at day and month granularity.
 */
public final class DateCellParser {

    private static final List<DateTimeFormatter> TEXT_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            strict("uuuu-MM-dd HH:mm[:ss]"),
            strict("uuuu/MM/dd"),
            strict("dd/MM/uuuu"),
            strict("d/M/uuuu"),
            strict("dd-MM-uuuu"),
            strict("MM/dd/uuuu")
    );

    private DateCellParser() {
    }

    // impossible days such as 31/02 must fail, not roll back to the month end
    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }

    /**
     * True when the cell carries no value at all. Blank cells are absent stamps, not parse failures.
     */
    public static boolean isBlank(Object value) {
        return value == null || (value instanceof CharSequence text && text.toString().isBlank());
    }

    /**
     * @return the day, or empty when the value is blank or cannot be read as a date
     */
    public static Optional<LocalDate> parse(Object value) {
        if (isBlank(value)) {
            return Optional.empty();
        }
        if (value instanceof LocalDate date) {
            return Optional.of(date);
        }
        if (value instanceof LocalDateTime dateTime) {
            return Optional.of(dateTime.toLocalDate());
        }
        if (value instanceof Date date) {
            return Optional.of(date.toInstant().atZone(ZoneId.systemDefault()).toLocalDate());
        }
        if (value instanceof Number number) {
            double serial = number.doubleValue();
            if (serial < 1 || !DateUtil.isValidExcelDate(serial)) {
                return Optional.empty();
            }
            return Optional.of(DateUtil.getLocalDateTime(serial).toLocalDate());
        }
        return parseText(value.toString().trim());
    }

    private static Optional<LocalDate> parseText(String text) {
        // ISO date-time as written by most exporters
        int t = text.indexOf('T');
        if (t == 10) {
            text = text.substring(0, t);
        }
        for (DateTimeFormatter format : TEXT_FORMATS) {
            try {
                return Optional.of(LocalDate.parse(text, format));
            } catch (DateTimeParseException ignored) {
                // next layout
            }
        }
        return Optional.empty();
    }
}
