package com.hvdc.ledger.service.schema;

import com.hvdc.ledger.config.LedgerSettings;
import com.hvdc.ledger.exception.LedgerConfigurationException;
import com.hvdc.ledger.model.LocationClass;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps table headers to warehouse and site roles using the configured name lists.
 *
 * Names are matched against headers after trimming, ignoring case. Headers matching
 * neither list are case metadata and are left alone. The configured order is kept,
 * since it decides which of two same-day events is applied first.
 */
@Component
@Slf4j
public class SchemaClassifier {

    private final LedgerSettings settings;

    public SchemaClassifier(LedgerSettings settings) {
        this.settings = settings;
    }

    /**
     * @throws LedgerConfigurationException if the id column is absent, a role resolves no column,
     *         a name is declared as both warehouse and site, or (strict mode) any declared name is absent
     */
    public ColumnSchema classify(Collection<String> columns) {
        return classify(columns, settings.warehouses());
    }

    /**
     * Classify against a warehouse list of its own, e.g. one supplier's workbook layout.
     * Sites and every other role still come from the settings.
     */
    public ColumnSchema classify(Collection<String> columns, List<String> warehouseNames) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (String column : columns) {
            if (column != null && !column.isBlank()) {
                headers.putIfAbsent(normalize(column), column);
            }
        }

        String idColumn = headers.get(normalize(settings.idColumn()));
        if (idColumn == null) {
            throw new LedgerConfigurationException("Id column '" + settings.idColumn() + "' not found in " + columns);
        }
        checkDisjoint(warehouseNames);

        List<String> missing = new ArrayList<>();
        List<ColumnBinding> warehouses = bind(warehouseNames, LocationClass.WAREHOUSE, headers, 0, missing);
        List<ColumnBinding> sites = bind(settings.sites(), LocationClass.SITE, headers, warehouses.size(), missing);

        if (!missing.isEmpty()) {
            if (settings.strictSchema()) {
                throw new LedgerConfigurationException("Configured location columns not found: " + missing);
            }
            log.warn("Configured location columns not found, continuing without them: {}", missing);
        }
        if (warehouses.isEmpty()) {
            throw new LedgerConfigurationException("No warehouse column resolved from " + warehouseNames);
        }
        if (sites.isEmpty()) {
            throw new LedgerConfigurationException("No site column resolved from " + settings.sites());
        }

        log.info("Schema resolved: id='{}', warehouses={}, sites={}",
                idColumn, warehouses.stream().map(ColumnBinding::column).toList(),
                sites.stream().map(ColumnBinding::column).toList());
        return new ColumnSchema(idColumn, warehouses, sites, missing);
    }

    private List<ColumnBinding> bind(List<String> names, LocationClass locationClass,
                                     Map<String, String> headers, int orderOffset, List<String> missing) {
        List<ColumnBinding> bindings = new ArrayList<>();
        for (String name : names) {
            String column = headers.get(normalize(name));
            if (column == null) {
                missing.add(name);
                continue;
            }
            bindings.add(new ColumnBinding(name, column, locationClass, orderOffset + bindings.size()));
        }
        return bindings;
    }

    private void checkDisjoint(List<String> warehouseNames) {
        Set<String> warehouseKeys = new HashSet<>();
        warehouseNames.forEach(w -> warehouseKeys.add(normalize(w)));
        List<String> overlap = settings.sites().stream()
                .filter(s -> warehouseKeys.contains(normalize(s)))
                .toList();
        if (!overlap.isEmpty()) {
            throw new LedgerConfigurationException("Names declared as both warehouse and site: " + overlap);
        }
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
