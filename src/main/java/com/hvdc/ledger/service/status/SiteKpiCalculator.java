package com.hvdc.ledger.service.status;

import com.hvdc.ledger.model.CaseTimeline;
import com.hvdc.ledger.model.LocationEvent;
import com.hvdc.ledger.model.SiteKpi;
import org.springframework.stereotype.Component;

import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Reach rate and mean lead time per site.
 *
 * A case reaches a site when its row carries a date for that site, applied or not.
 * Lead time to a site runs from the case's earliest warehouse stamp.
 */
@Component
public class SiteKpiCalculator {

    public List<SiteKpi> calculate(Collection<CaseTimeline> timelines, List<String> sites) {
        int total = timelines.size();
        List<SiteKpi> kpis = new ArrayList<>();
        for (String site : sites) {
            long reached = 0;
            List<Long> leadTimes = new ArrayList<>();
            for (CaseTimeline timeline : timelines) {
                Optional<LocationEvent> stamp = timeline.events().stream()
                        .filter(e -> e.isSite() && e.location().equals(site))
                        .findFirst();
                if (stamp.isEmpty()) {
                    continue;
                }
                reached++;
                timeline.earliestWarehouseEvent()
                        .map(first -> ChronoUnit.DAYS.between(first.date(), stamp.get().date()))
                        .ifPresent(leadTimes::add);
            }
            double rate = total == 0 ? 0 : Math.round(reached * 10000.0 / total) / 100.0;
            Double meanLeadTime = leadTimes.isEmpty() ? null
                    : Math.round(leadTimes.stream().mapToLong(Long::longValue).average().orElse(0) * 10) / 10.0;
            kpis.add(new SiteKpi(site, reached, rate, meanLeadTime));
        }
        return kpis;
    }
}
