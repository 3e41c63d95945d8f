package com.hvdc.ledger.service.status;

import com.hvdc.ledger.model.CaseStatus;
import com.hvdc.ledger.model.CaseSummary;
import com.hvdc.ledger.model.DurationStats;
import com.hvdc.ledger.model.LocationClass;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LeadTimeStatisticsTest {

    private final LeadTimeStatistics statistics = new LeadTimeStatistics();

    private static CaseSummary completed(String id, String warehouse, String category, Long leadTime) {
        return new CaseSummary(id, CaseStatus.COMPLETED, null, leadTime, "S1", LocationClass.SITE, null,
                warehouse, category, 1, warehouse == null ? List.of("S1") : List.of(warehouse, "S1"));
    }

    private static CaseSummary pending(String id, String warehouse) {
        return new CaseSummary(id, CaseStatus.PENDING, 400L, null, warehouse, LocationClass.WAREHOUSE, null,
                warehouse, null, 1, List.of(warehouse));
    }

    private final List<CaseSummary> cases = List.of(
            completed("C1", "WH1", "Electrical", 10L),
            completed("C2", "WH1", "Electrical", 20L),
            completed("C3", "WH1", "Cable", 60L),
            completed("C4", "WH2", " ", 5L),
            completed("C5", null, "Cable", null),
            pending("C6", "WH1"));

    @Test
    @DisplayName("Should group completed lead times by initial warehouse")
    void shouldGroupByInitialWarehouse() {
        List<DurationStats> stats = statistics.byInitialWarehouse(cases);

        assertThat(stats).extracting(DurationStats::key).containsExactly("WH1", "WH2");
        DurationStats wh1 = stats.get(0);
        assertThat(wh1.count()).isEqualTo(3);
        assertThat(wh1.mean()).isEqualTo(30.0);
        assertThat(wh1.median()).isEqualTo(20.0);
        assertThat(wh1.stdDev()).isEqualTo(26.5);
        assertThat(wh1.min()).isEqualTo(10);
        assertThat(wh1.max()).isEqualTo(60);
    }

    @Test
    @DisplayName("Should put blank categories under Unspecified")
    void shouldGroupByCategory() {
        List<DurationStats> stats = statistics.byCategory(cases);

        assertThat(stats).extracting(DurationStats::key)
                .containsExactly("Cable", "Electrical", LeadTimeStatistics.UNSPECIFIED);
        assertThat(stats.get(0).count()).isEqualTo(1);
        assertThat(stats.get(1).median()).isEqualTo(15.0);
        assertThat(stats.get(2).stdDev()).isZero();
    }
}
