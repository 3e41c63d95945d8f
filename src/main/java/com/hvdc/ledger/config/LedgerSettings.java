package com.hvdc.ledger.config;

import com.hvdc.ledger.model.UrgencyTier;
import lombok.Builder;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Comparator;
import java.util.List;

/**
 * Immutable run settings, resolved once from {@code app.ledger.*}.
 *
 * @param warehouses    declared warehouse columns; their order is the same-day tie-break order
 * @param sites         declared site columns, ordered after all warehouses
 * @param rangeStart    first reporting month, {@code null} for the earliest event month
 * @param rangeEnd      last reporting month, {@code null} for the reference month
 * @param referenceDate "now" for elapsed days, {@code null} for today
 * @param indoorWarehouses    warehouses rolled up as indoor storage, {@code null} for the HVDC defaults
 * @param dangerousWarehouses warehouses rolled up as dangerous-cargo storage; these win over indoor
 */
@Builder(toBuilder = true)
public record LedgerSettings(
        String idColumn,
        String quantityColumn,
        String categoryColumn,
        List<String> warehouses,
        List<String> sites,
        boolean strictSchema,
        YearMonth rangeStart,
        YearMonth rangeEnd,
        LocalDate referenceDate,
        LedgerUnit ledgerUnit,
        DuplicateArrivalPolicy duplicateArrivalPolicy,
        PostDeliveryPolicy postDeliveryPolicy,
        LeadTimeMode leadTimeMode,
        long deadStockThresholdDays,
        List<UrgencyTier> urgencyTiers,
        int recentWindowMonths,
        List<String> indoorWarehouses,
        List<String> dangerousWarehouses
) {

    public static final List<String> DEFAULT_WAREHOUSES =
            List.of("DSV Indoor", "DSV Al Markaz", "DSV Outdoor", "Hauler Indoor", "DSV MZP", "MOSB");
    public static final List<String> DEFAULT_SITES = List.of("MIR", "SHU", "DAS", "AGI");
    public static final List<String> DEFAULT_INDOOR_WAREHOUSES =
            List.of("DSV Indoor", "Hauler Indoor", "DSV Al Markaz", "AAA Storage", "DHL WH");
    public static final List<String> DEFAULT_DANGEROUS_WAREHOUSES = List.of("AAA Storage");

    public LedgerSettings {
        warehouses = warehouses == null ? List.of() : List.copyOf(warehouses);
        sites = sites == null ? List.of() : List.copyOf(sites);
        urgencyTiers = urgencyTiers == null ? List.of() : urgencyTiers.stream()
                .sorted(Comparator.comparingLong(UrgencyTier::minDays))
                .toList();
        if (ledgerUnit == null) ledgerUnit = LedgerUnit.CASES;
        if (duplicateArrivalPolicy == null) duplicateArrivalPolicy = DuplicateArrivalPolicy.IGNORE;
        if (postDeliveryPolicy == null) postDeliveryPolicy = PostDeliveryPolicy.IGNORE;
        if (leadTimeMode == null) leadTimeMode = LeadTimeMode.SPAN;
        if (deadStockThresholdDays < 0) {
            throw new IllegalArgumentException("Dead-stock threshold must be >= 0: " + deadStockThresholdDays);
        }
        if (recentWindowMonths <= 0) recentWindowMonths = 12;
        indoorWarehouses = indoorWarehouses == null ? DEFAULT_INDOOR_WAREHOUSES : List.copyOf(indoorWarehouses);
        dangerousWarehouses = dangerousWarehouses == null ? DEFAULT_DANGEROUS_WAREHOUSES : List.copyOf(dangerousWarehouses);
    }

    /**
     * Settings matching the case list layout of the HVDC warehouse workbook.
     */
    public static LedgerSettings defaults() {
        return LedgerSettings.builder()
                .idColumn("Case No.")
                .quantityColumn("Quantity")
                .categoryColumn("Material Category")
                .warehouses(DEFAULT_WAREHOUSES)
                .sites(DEFAULT_SITES)
                .deadStockThresholdDays(90)
                .urgencyTiers(List.of(new UrgencyTier("elevated", 180), new UrgencyTier("urgent", 365)))
                .recentWindowMonths(12)
                .build();
    }

    public LocalDate effectiveReferenceDate() {
        return referenceDate != null ? referenceDate : LocalDate.now();
    }
}
