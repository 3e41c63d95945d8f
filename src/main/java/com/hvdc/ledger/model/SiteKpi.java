package com.hvdc.ledger.model;

/**
 * Delivery reach of one site.
 *
 * @param reachedCases      cases carrying a stamp at the site, whether or not it was applied
 * @param reachRatePercent  reached cases over all cases, as a percentage with two decimals
 * @param meanLeadTimeDays  mean of site date minus earliest warehouse date, {@code null} when no case has both
 */
public record SiteKpi(
        String site,
        long reachedCases,
        double reachRatePercent,
        Double meanLeadTimeDays
) {
}
