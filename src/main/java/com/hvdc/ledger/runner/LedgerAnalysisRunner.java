package com.hvdc.ledger.runner;

import com.hvdc.ledger.config.LedgerSettings;
import com.hvdc.ledger.exception.LedgerConfigurationException;
import com.hvdc.ledger.model.CaseFilter;
import com.hvdc.ledger.model.CaseStatus;
import com.hvdc.ledger.model.CaseTable;
import com.hvdc.ledger.model.ConsolidatedReport;
import com.hvdc.ledger.model.LedgerReport;
import com.hvdc.ledger.model.StorageClass;
import com.hvdc.ledger.repository.CaseTableReader;
import com.hvdc.ledger.service.LedgerAnalysisOrchestrator;
import com.hvdc.ledger.service.consolidation.SupplierConsolidationService;
import com.hvdc.ledger.service.consolidation.SupplierConsolidationService.SupplierInput;
import com.hvdc.ledger.service.filter.CaseFilterService;
import com.hvdc.ledger.service.publishing.LedgerReportWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * One batch run at startup: read the workbook, analyze, write the JSON report.
 *
 * With {@code app.ledger.suppliers} set, every listed supplier's workbook is analyzed against
 * its own {@code app.ledger.supplier.<name>.warehouses} and one consolidated report is written
 * instead. Setting any {@code app.ledger.filter.*} condition also writes the matching cases.
 */
@Component
@ConditionalOnExpression("'${app.ledger.input-file:}' != '' or '${app.ledger.suppliers:}' != ''")
@Slf4j
@RequiredArgsConstructor
public class LedgerAnalysisRunner implements CommandLineRunner {

    private final CaseTableReader caseTableReader;
    private final LedgerAnalysisOrchestrator orchestrator;
    private final SupplierConsolidationService consolidationService;
    private final CaseFilterService caseFilterService;
    private final LedgerReportWriter reportWriter;
    private final LedgerSettings settings;
    private final Environment environment;

    @Override
    public void run(String... args) {
        List<String> suppliers = names("app.ledger.suppliers");
        if (!suppliers.isEmpty()) {
            runConsolidated(suppliers);
            return;
        }

        Path input = Path.of(environment.getRequiredProperty("app.ledger.input-file"));
        String sheet = environment.getProperty("app.ledger.sheet", CaseTableReader.DEFAULT_SHEET);
        Path output = Path.of(environment.getProperty("app.ledger.output-file", "outputs/ledger-report.json"));

        CaseTable table = caseTableReader.read(input, sheet);
        LedgerReport report = orchestrator.analyze(table);
        reportWriter.write(report, output);

        CaseFilter filter = filter();
        if (filter != null) {
            Path filtered = Path.of(environment.getProperty("app.ledger.filter.output-file",
                    "outputs/ledger-filtered.json"));
            reportWriter.write(caseFilterService.filter(report, filter), filtered);
        }
    }

    private void runConsolidated(List<String> suppliers) {
        String defaultSheet = environment.getProperty("app.ledger.sheet", CaseTableReader.DEFAULT_SHEET);
        List<SupplierInput> inputs = new ArrayList<>();
        for (String supplier : suppliers) {
            String prefix = "app.ledger.supplier." + supplier + ".";
            String file = environment.getProperty(prefix + "input-file");
            if (file == null || file.isBlank()) {
                throw new LedgerConfigurationException(prefix + "input-file is required for supplier " + supplier);
            }
            List<String> warehouses = names(prefix + "warehouses");
            CaseTable table = caseTableReader.read(Path.of(file.trim()),
                    environment.getProperty(prefix + "sheet", defaultSheet));
            inputs.add(new SupplierInput(supplier, table, warehouses.isEmpty() ? settings.warehouses() : warehouses));
        }

        ConsolidatedReport report = consolidationService.consolidate(inputs, settings.effectiveReferenceDate());
        reportWriter.write(report, Path.of(environment.getProperty("app.ledger.consolidated-output-file",
                "outputs/ledger-consolidated.json")));
    }

    /**
     * Filter from {@code app.ledger.filter.*}, or {@code null} when no condition is set.
     */
    CaseFilter filter() {
        CaseFilter filter = CaseFilter.builder()
                .warehouse(text("app.ledger.filter.warehouse"))
                .site(text("app.ledger.filter.site"))
                .storageClass(constant("app.ledger.filter.storage-class", StorageClass.class))
                .category(text("app.ledger.filter.category"))
                .status(constant("app.ledger.filter.status", CaseStatus.class))
                .build();
        return filter.equals(CaseFilter.all()) ? null : filter;
    }

    private List<String> names(String property) {
        String value = environment.getProperty(property, "");
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .distinct()
                .toList();
    }

    private String text(String property) {
        String value = environment.getProperty(property);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private <E extends Enum<E>> E constant(String property, Class<E> type) {
        String value = text(property);
        if (value == null) {
            return null;
        }
        try {
            return Enum.valueOf(type, value.toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new LedgerConfigurationException(property + " must be one of "
                    + Arrays.toString(type.getEnumConstants()) + ", got '" + value + "'", e);
        }
    }
}
