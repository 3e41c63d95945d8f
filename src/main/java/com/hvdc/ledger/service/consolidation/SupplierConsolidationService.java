package com.hvdc.ledger.service.consolidation;

import com.hvdc.ledger.model.CaseTable;
import com.hvdc.ledger.model.ConsolidatedReport;
import com.hvdc.ledger.model.LedgerReport;
import com.hvdc.ledger.model.SiteLedger;
import com.hvdc.ledger.model.SupplierTotals;
import com.hvdc.ledger.model.WarehouseLedger;
import com.hvdc.ledger.model.WarehouseMonth;
import com.hvdc.ledger.service.LedgerAnalysisOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Analyzes one case list per supplier, each against its own warehouse columns,
 * and totals the results per supplier and across all of them.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SupplierConsolidationService {

    private final LedgerAnalysisOrchestrator orchestrator;

    /**
     * One supplier's case list and the warehouse columns its workbook carries.
     */
    public record SupplierInput(String supplier, CaseTable table, List<String> warehouses) {
    }

    public ConsolidatedReport consolidate(List<SupplierInput> inputs, LocalDate referenceDate) {
        Map<String, LedgerReport> reports = new LinkedHashMap<>();
        List<SupplierTotals> totals = new ArrayList<>();
        SupplierTotals grandTotal = new SupplierTotals(ConsolidatedReport.GRAND_TOTAL, 0, 0, 0, 0);

        for (SupplierInput input : inputs) {
            if (reports.containsKey(input.supplier())) {
                throw new IllegalArgumentException("Supplier listed twice: " + input.supplier());
            }
            log.info("Consolidation: analyzing supplier {} ({} cases)", input.supplier(), input.table().cases().size());
            LedgerReport report = orchestrator.analyze(input.table(), referenceDate, input.warehouses());
            SupplierTotals supplierTotals = totalsOf(input.supplier(), report);
            reports.put(input.supplier(), report);
            totals.add(supplierTotals);
            grandTotal = grandTotal.plus(supplierTotals, ConsolidatedReport.GRAND_TOTAL);
        }

        log.info("Consolidation complete: {} suppliers | in={} out={} stock={} delivered={}", totals.size(),
                grandTotal.warehouseInbound(), grandTotal.warehouseOutbound(),
                grandTotal.warehouseStock(), grandTotal.siteCumulative());
        return new ConsolidatedReport(referenceDate, reports, totals, grandTotal);
    }

    static SupplierTotals totalsOf(String supplier, LedgerReport report) {
        long in = 0;
        long out = 0;
        long stock = 0;
        for (WarehouseLedger ledger : report.warehouseLedgers()) {
            in += ledger.months().stream().mapToLong(WarehouseMonth::inbound).sum();
            out += ledger.months().stream().mapToLong(WarehouseMonth::outbound).sum();
            stock += ledger.closingStock();
        }
        long delivered = 0;
        for (SiteLedger ledger : report.siteLedgers()) {
            delivered += ledger.cumulativeAt(report.range().end());
        }
        return new SupplierTotals(supplier, in, out, stock, delivered);
    }
}
