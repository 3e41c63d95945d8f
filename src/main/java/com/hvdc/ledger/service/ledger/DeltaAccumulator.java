package com.hvdc.ledger.service.ledger;

import com.hvdc.ledger.model.Direction;
import com.hvdc.ledger.model.LocationClass;
import com.hvdc.ledger.model.TransitionDelta;

import java.time.YearMonth;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Month-keyed sums of transition deltas.
 *
 * Not thread-safe: give each worker its own instance and {@link #merge} them.
 * Adding and merging are order-independent, so any split of the cases yields the same totals.
 */
public final class DeltaAccumulator {

    private final Map<String, Map<YearMonth, Long>> warehouseInbound = new HashMap<>();
    private final Map<String, Map<YearMonth, Long>> warehouseOutbound = new HashMap<>();
    private final Map<String, Map<YearMonth, Long>> siteInbound = new HashMap<>();

    public DeltaAccumulator add(TransitionDelta delta) {
        Map<String, Map<YearMonth, Long>> target = target(delta.locationClass(), delta.direction());
        target.computeIfAbsent(delta.location(), k -> new HashMap<>())
                .merge(delta.month(), (long) delta.quantity(), Long::sum);
        return this;
    }

    public DeltaAccumulator addAll(Collection<TransitionDelta> deltas) {
        deltas.forEach(this::add);
        return this;
    }

    public DeltaAccumulator merge(DeltaAccumulator other) {
        mergeInto(warehouseInbound, other.warehouseInbound);
        mergeInto(warehouseOutbound, other.warehouseOutbound);
        mergeInto(siteInbound, other.siteInbound);
        return this;
    }

    public long inbound(String warehouse, YearMonth month) {
        return get(warehouseInbound, warehouse, month);
    }

    public long outbound(String warehouse, YearMonth month) {
        return get(warehouseOutbound, warehouse, month);
    }

    public long siteInbound(String site, YearMonth month) {
        return get(siteInbound, site, month);
    }

    /**
     * Number of delta units whose month falls outside [{@code start}, {@code end}].
     */
    public long unitsOutside(YearMonth start, YearMonth end) {
        long outside = 0;
        for (Map<String, Map<YearMonth, Long>> sums : List.of(warehouseInbound, warehouseOutbound, siteInbound)) {
            for (Map<YearMonth, Long> byMonth : sums.values()) {
                for (Map.Entry<YearMonth, Long> entry : byMonth.entrySet()) {
                    if (entry.getKey().isBefore(start) || entry.getKey().isAfter(end)) {
                        outside += entry.getValue();
                    }
                }
            }
        }
        return outside;
    }

    private Map<String, Map<YearMonth, Long>> target(LocationClass locationClass, Direction direction) {
        if (locationClass == LocationClass.SITE) {
            if (direction != Direction.INBOUND) {
                throw new IllegalArgumentException("Sites only take inbound deltas");
            }
            return siteInbound;
        }
        return direction == Direction.INBOUND ? warehouseInbound : warehouseOutbound;
    }

    private static long get(Map<String, Map<YearMonth, Long>> sums, String location, YearMonth month) {
        Map<YearMonth, Long> byMonth = sums.get(location);
        return byMonth != null ? byMonth.getOrDefault(month, 0L) : 0L;
    }

    private static void mergeInto(Map<String, Map<YearMonth, Long>> target, Map<String, Map<YearMonth, Long>> source) {
        source.forEach((location, byMonth) -> {
            Map<YearMonth, Long> into = target.computeIfAbsent(location, k -> new HashMap<>());
            byMonth.forEach((month, units) -> into.merge(month, units, Long::sum));
        });
    }
}
