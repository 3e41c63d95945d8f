package com.hvdc.ledger.service.deadstock;

import com.hvdc.ledger.config.LedgerSettings;
import com.hvdc.ledger.model.CaseSummary;
import com.hvdc.ledger.model.DeadStockRecord;
import com.hvdc.ledger.model.DurationStats;
import com.hvdc.ledger.model.UrgencyTier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Picks pending cases that have sat in a warehouse for at least the threshold and tags
 * them with an urgency tier. Raising the threshold can only remove cases from the result.
 */
@Component
@Slf4j
public class DeadStockSelector {

    /** Stay-period buckets, longest first. */
    private static final Map<String, Long> STAY_PERIODS = stayPeriods();

    private final List<UrgencyTier> tiers;

    public DeadStockSelector(LedgerSettings settings) {
        this.tiers = settings.urgencyTiers();
    }

    /**
     * @return dead stock at {@code thresholdDays}, longest stay first (ties by case id)
     */
    public List<DeadStockRecord> select(Collection<CaseSummary> cases, long thresholdDays) {
        List<DeadStockRecord> selected = cases.stream()
                .filter(CaseSummary::isPending)
                .filter(c -> c.elapsedDays() != null && c.elapsedDays() >= thresholdDays)
                .map(c -> new DeadStockRecord(c.caseId(), c.lastKnownLocation(), c.lastWarehouseDate(),
                        c.elapsedDays(), tierFor(c.elapsedDays())))
                .sorted(Comparator.comparingLong(DeadStockRecord::elapsedDays).reversed()
                        .thenComparing(DeadStockRecord::caseId))
                .toList();
        log.info("Dead stock at {}d: {} cases", thresholdDays, selected.size());
        return selected;
    }

    /**
     * Highest tier whose minimum the stay reaches, or {@value UrgencyTier#STANDARD}.
     */
    public String tierFor(long elapsedDays) {
        String tier = UrgencyTier.STANDARD;
        for (UrgencyTier candidate : tiers) {
            if (elapsedDays >= candidate.minDays()) {
                tier = candidate.name();
            }
        }
        return tier;
    }

    /**
     * Stay statistics per warehouse, most dead stock first.
     */
    public List<DurationStats> byWarehouse(Collection<DeadStockRecord> deadStock) {
        Map<String, List<Long>> groups = deadStock.stream()
                .collect(Collectors.groupingBy(DeadStockRecord::lastWarehouse, TreeMap::new,
                        Collectors.mapping(DeadStockRecord::elapsedDays, Collectors.toList())));
        return groups.entrySet().stream()
                .map(e -> DurationStats.of(e.getKey(), e.getValue()))
                .sorted(Comparator.comparingLong(DurationStats::count).reversed()
                        .thenComparing(DurationStats::key))
                .toList();
    }

    /**
     * Stay statistics per stay-period bucket, longest bucket first; empty buckets are left out.
     */
    public List<DurationStats> byStayPeriod(Collection<DeadStockRecord> deadStock) {
        Map<String, List<Long>> groups = new LinkedHashMap<>();
        STAY_PERIODS.keySet().forEach(bucket -> groups.put(bucket, new ArrayList<>()));
        for (DeadStockRecord record : deadStock) {
            groups.get(stayPeriod(record.elapsedDays())).add(record.elapsedDays());
        }
        return groups.entrySet().stream()
                .filter(e -> !e.getValue().isEmpty())
                .map(e -> DurationStats.of(e.getKey(), e.getValue()))
                .toList();
    }

    static String stayPeriod(long elapsedDays) {
        for (Map.Entry<String, Long> bucket : STAY_PERIODS.entrySet()) {
            if (elapsedDays >= bucket.getValue()) {
                return bucket.getKey();
            }
        }
        throw new IllegalStateException("No stay period for " + elapsedDays);
    }

    private static Map<String, Long> stayPeriods() {
        Map<String, Long> periods = new LinkedHashMap<>();
        periods.put("1y+", 365L);
        periods.put("9m-1y", 270L);
        periods.put("6m-9m", 180L);
        periods.put("3m-6m", 90L);
        periods.put("<3m", Long.MIN_VALUE);
        return periods;
    }
}
