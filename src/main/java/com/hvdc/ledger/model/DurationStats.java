package com.hvdc.ledger.model;

import java.util.List;

/**
 * Descriptive statistics over a group of day counts, rounded to one decimal.
 */
public record DurationStats(
        String key,
        long count,
        double mean,
        double median,
        double stdDev,
        long min,
        long max
) {

    /**
     * Build statistics for one group. Standard deviation is the sample deviation (n - 1),
     * zero for a single value.
     */
    public static DurationStats of(String key, List<Long> days) {
        if (days.isEmpty()) {
            return new DurationStats(key, 0, 0, 0, 0, 0, 0);
        }
        List<Long> sorted = days.stream().sorted().toList();
        int n = sorted.size();
        double mean = sorted.stream().mapToLong(Long::longValue).average().orElse(0);
        double median = n % 2 == 1
                ? sorted.get(n / 2)
                : (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2.0;
        double variance = n > 1
                ? sorted.stream().mapToDouble(d -> (d - mean) * (d - mean)).sum() / (n - 1)
                : 0;
        return new DurationStats(key, n, round(mean), round(median), round(Math.sqrt(variance)),
                sorted.get(0), sorted.get(n - 1));
    }

    private static double round(double value) {
        return Math.round(value * 10) / 10.0;
    }
}
