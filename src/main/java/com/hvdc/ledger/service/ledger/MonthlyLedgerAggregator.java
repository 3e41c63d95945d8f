package com.hvdc.ledger.service.ledger;

import com.hvdc.ledger.model.CaseTimeline;
import com.hvdc.ledger.model.LocationClass;
import com.hvdc.ledger.model.LocationEvent;
import com.hvdc.ledger.model.LocationSummary;
import com.hvdc.ledger.model.ReportingRange;
import com.hvdc.ledger.model.SiteLedger;
import com.hvdc.ledger.model.SiteMonth;
import com.hvdc.ledger.model.StorageClass;
import com.hvdc.ledger.model.StorageLedger;
import com.hvdc.ledger.model.WarehouseLedger;
import com.hvdc.ledger.model.WarehouseMonth;
import com.hvdc.ledger.service.schema.ColumnSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Folds every case's deltas into monthly warehouse and site ledgers.
 *
 * Warehouse stock is a running sum of inbound minus outbound seeded at zero before
 * the range start; site cumulative is a running sum of inbound. Every month of the
 * range is present for every bound location, with zeros where nothing moved.
 */
@Component
@Slf4j
public class MonthlyLedgerAggregator {

    public LedgerBook aggregate(Collection<CaseTimeline> timelines, ReportingRange range, ColumnSchema schema) {
        DeltaAccumulator totals = timelines.parallelStream()
                .collect(DeltaAccumulator::new,
                        (acc, timeline) -> acc.addAll(timeline.deltas()),
                        DeltaAccumulator::merge);
        return toLedgers(totals, range, schema);
    }

    public LedgerBook toLedgers(DeltaAccumulator totals, ReportingRange range, ColumnSchema schema) {
        List<YearMonth> months = range.months();

        List<WarehouseLedger> warehouses = new ArrayList<>();
        for (String warehouse : schema.warehouseNames()) {
            List<WarehouseMonth> rows = new ArrayList<>(months.size());
            long stock = 0;
            for (YearMonth month : months) {
                long in = totals.inbound(warehouse, month);
                long out = totals.outbound(warehouse, month);
                stock += in - out;
                if (stock < 0) {
                    log.warn("Warehouse {} stock negative ({}) in {}", warehouse, stock, month);
                }
                rows.add(new WarehouseMonth(month, in, out, stock));
            }
            warehouses.add(new WarehouseLedger(warehouse, rows));
        }

        List<SiteLedger> sites = new ArrayList<>();
        for (String site : schema.siteNames()) {
            List<SiteMonth> rows = new ArrayList<>(months.size());
            long cumulative = 0;
            for (YearMonth month : months) {
                long in = totals.siteInbound(site, month);
                cumulative += in;
                rows.add(new SiteMonth(month, in, cumulative));
            }
            sites.add(new SiteLedger(site, rows));
        }

        long dropped = totals.unitsOutside(range.start(), range.end());
        if (dropped > 0) {
            log.warn("{} delta units fall outside {}..{} and are not in the ledgers", dropped, range.start(), range.end());
        }
        return new LedgerBook(warehouses, sites, dropped);
    }

    /**
     * Inbound/outbound totals over the last {@code windowMonths} of the range, with closing stock
     * (warehouses) or cumulative inbound (sites) at the range end.
     */
    public List<LocationSummary> summarizeRecent(LedgerBook book, int windowMonths) {
        List<LocationSummary> summaries = new ArrayList<>();
        for (WarehouseLedger ledger : book.warehouses()) {
            List<WarehouseMonth> recent = tail(ledger.months(), windowMonths);
            summaries.add(new LocationSummary(ledger.warehouse(), LocationClass.WAREHOUSE,
                    recent.stream().mapToLong(WarehouseMonth::inbound).sum(),
                    recent.stream().mapToLong(WarehouseMonth::outbound).sum(),
                    ledger.closingStock()));
        }
        for (SiteLedger ledger : book.sites()) {
            List<SiteMonth> recent = tail(ledger.months(), windowMonths);
            long closing = ledger.months().isEmpty() ? 0 : ledger.months().get(ledger.months().size() - 1).cumulative();
            summaries.add(new LocationSummary(ledger.site(), LocationClass.SITE,
                    recent.stream().mapToLong(SiteMonth::inbound).sum(), 0, closing));
        }
        return summaries;
    }

    /**
     * Warehouse ledgers summed per storage class, month by month. Classes without a bound
     * warehouse are left out; the rest follow {@link StorageClass} order.
     */
    public List<StorageLedger> rollUpByStorage(LedgerBook book, StorageClassifier classifier) {
        Map<StorageClass, List<WarehouseLedger>> byClass = new EnumMap<>(StorageClass.class);
        for (WarehouseLedger ledger : book.warehouses()) {
            byClass.computeIfAbsent(classifier.classify(ledger.warehouse()), c -> new ArrayList<>()).add(ledger);
        }

        List<StorageLedger> rollUp = new ArrayList<>();
        byClass.forEach((storageClass, ledgers) -> {
            List<WarehouseMonth> months = new ArrayList<>();
            List<WarehouseMonth> template = ledgers.get(0).months();
            for (int i = 0; i < template.size(); i++) {
                long in = 0;
                long out = 0;
                long stock = 0;
                for (WarehouseLedger ledger : ledgers) {
                    WarehouseMonth row = ledger.months().get(i);
                    in += row.inbound();
                    out += row.outbound();
                    stock += row.stock();
                }
                months.add(new WarehouseMonth(template.get(i).month(), in, out, stock));
            }
            rollUp.add(new StorageLedger(storageClass,
                    ledgers.stream().map(WarehouseLedger::warehouse).toList(), months));
        });
        return rollUp;
    }

    /**
     * Reporting range for a run. Configured bounds win; otherwise the range starts at the
     * earliest event month and ends at the later of the reference month and the latest event month.
     * A configured start alone never ends before itself.
     */
    public static ReportingRange resolveRange(YearMonth configuredStart, YearMonth configuredEnd,
                                              Collection<CaseTimeline> timelines, LocalDate referenceDate) {
        YearMonth referenceMonth = YearMonth.from(referenceDate);
        Optional<YearMonth> earliest = timelines.stream()
                .flatMap(t -> t.events().stream())
                .map(LocationEvent::month)
                .min(Comparator.naturalOrder());
        Optional<YearMonth> latest = timelines.stream()
                .flatMap(t -> t.events().stream())
                .map(LocationEvent::month)
                .max(Comparator.naturalOrder());

        YearMonth derivedEnd = latest.filter(m -> m.isAfter(referenceMonth)).orElse(referenceMonth);
        if (configuredStart != null) {
            YearMonth end = configuredEnd != null ? configuredEnd
                    : derivedEnd.isBefore(configuredStart) ? configuredStart : derivedEnd;
            return new ReportingRange(configuredStart, end);
        }
        YearMonth end = configuredEnd != null ? configuredEnd : derivedEnd;
        YearMonth start = earliest.filter(m -> !m.isAfter(end)).orElse(end);
        return new ReportingRange(start, end);
    }

    private static <T> List<T> tail(List<T> rows, int count) {
        return rows.subList(Math.max(0, rows.size() - count), rows.size());
    }
}
