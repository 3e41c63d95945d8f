package com.hvdc.ledger.config;

import com.hvdc.ledger.exception.LedgerConfigurationException;
import com.hvdc.ledger.model.UrgencyTier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Binds the {@code app.ledger.*} properties into one {@link LedgerSettings} bean.
 *
 * Column names, policies and the reporting horizon are resolved here, once,
 * so a bad value fails the application at startup instead of mid-run.
 */
@Configuration
@Slf4j
public class LedgerConfig {

    @Value("${app.ledger.id-column:Case No.}")
    private String idColumn;

    @Value("${app.ledger.quantity-column:Quantity}")
    private String quantityColumn;

    @Value("${app.ledger.category-column:Material Category}")
    private String categoryColumn;

    @Value("${app.ledger.warehouses:DSV Indoor,DSV Al Markaz,DSV Outdoor,Hauler Indoor,DSV MZP,MOSB}")
    private String warehouses;

    @Value("${app.ledger.sites:MIR,SHU,DAS,AGI}")
    private String sites;

    @Value("${app.ledger.schema.strict:false}")
    private boolean strictSchema;

    @Value("${app.ledger.range.start:}")
    private String rangeStart;

    @Value("${app.ledger.range.end:}")
    private String rangeEnd;

    @Value("${app.ledger.reference-date:}")
    private String referenceDate;

    @Value("${app.ledger.ledger-unit:CASES}")
    private LedgerUnit ledgerUnit;

    @Value("${app.ledger.policy.duplicate-arrival:IGNORE}")
    private DuplicateArrivalPolicy duplicateArrivalPolicy;

    @Value("${app.ledger.policy.post-delivery:IGNORE}")
    private PostDeliveryPolicy postDeliveryPolicy;

    @Value("${app.ledger.lead-time-mode:SPAN}")
    private LeadTimeMode leadTimeMode;

    @Value("${app.ledger.dead-stock.threshold-days:90}")
    private long deadStockThresholdDays;

    @Value("${app.ledger.dead-stock.tiers:elevated:180,urgent:365}")
    private String urgencyTiers;

    @Value("${app.ledger.recent-window-months:12}")
    private int recentWindowMonths;

    @Value("${app.ledger.storage.indoor:DSV Indoor,Hauler Indoor,DSV Al Markaz,AAA Storage,DHL WH}")
    private String indoorWarehouses;

    @Value("${app.ledger.storage.dangerous:AAA Storage}")
    private String dangerousWarehouses;

    @Bean
    public LedgerSettings ledgerSettings() {
        YearMonth start = parseMonth("app.ledger.range.start", rangeStart);
        YearMonth end = parseMonth("app.ledger.range.end", rangeEnd);
        checkRange(start, end);

        LedgerSettings settings = LedgerSettings.builder()
                .idColumn(idColumn.trim())
                .quantityColumn(blankToNull(quantityColumn))
                .categoryColumn(blankToNull(categoryColumn))
                .warehouses(splitNames(warehouses))
                .sites(splitNames(sites))
                .strictSchema(strictSchema)
                .rangeStart(start)
                .rangeEnd(end)
                .referenceDate(parseDate("app.ledger.reference-date", referenceDate))
                .ledgerUnit(ledgerUnit)
                .duplicateArrivalPolicy(duplicateArrivalPolicy)
                .postDeliveryPolicy(postDeliveryPolicy)
                .leadTimeMode(leadTimeMode)
                .deadStockThresholdDays(deadStockThresholdDays)
                .urgencyTiers(parseTiers(urgencyTiers))
                .recentWindowMonths(recentWindowMonths)
                .indoorWarehouses(splitNames(indoorWarehouses))
                .dangerousWarehouses(splitNames(dangerousWarehouses))
                .build();

        log.info("Ledger settings: {} warehouses, {} sites, strict={}, unit={}, duplicate={}, postDelivery={}, leadTime={}",
                settings.warehouses().size(), settings.sites().size(), settings.strictSchema(),
                settings.ledgerUnit(), settings.duplicateArrivalPolicy(), settings.postDeliveryPolicy(),
                settings.leadTimeMode());
        log.info("Dead stock: threshold={}d, tiers={}", settings.deadStockThresholdDays(), settings.urgencyTiers());
        log.info("Storage classes: indoor={}, dangerous={}", settings.indoorWarehouses(), settings.dangerousWarehouses());
        return settings;
    }

    static List<String> splitNames(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .distinct()
                .toList();
    }

    /**
     * Parses {@code name:minDays} pairs, e.g. {@code elevated:180,urgent:365}.
     */
    static List<UrgencyTier> parseTiers(String value) {
        List<UrgencyTier> tiers = new ArrayList<>();
        for (String entry : splitNames(value)) {
            int sep = entry.lastIndexOf(':');
            if (sep <= 0 || sep == entry.length() - 1) {
                throw new LedgerConfigurationException("Invalid urgency tier '" + entry + "', expected name:minDays");
            }
            try {
                tiers.add(new UrgencyTier(entry.substring(0, sep).trim(),
                        Long.parseLong(entry.substring(sep + 1).trim())));
            } catch (IllegalArgumentException e) {
                throw new LedgerConfigurationException("Invalid urgency tier '" + entry + "': " + e.getMessage(), e);
            }
        }
        return tiers;
    }

    static YearMonth parseMonth(String property, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return YearMonth.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new LedgerConfigurationException(property + " must be yyyy-MM, got '" + value + "'", e);
        }
    }

    static void checkRange(YearMonth start, YearMonth end) {
        if (start != null && end != null && end.isBefore(start)) {
            throw new LedgerConfigurationException(
                    "app.ledger.range.end " + end + " is before app.ledger.range.start " + start);
        }
    }

    static LocalDate parseDate(String property, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new LedgerConfigurationException(property + " must be yyyy-MM-dd, got '" + value + "'", e);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
