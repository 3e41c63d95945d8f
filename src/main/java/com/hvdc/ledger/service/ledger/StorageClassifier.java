package com.hvdc.ledger.service.ledger;

import com.hvdc.ledger.config.LedgerSettings;
import com.hvdc.ledger.model.StorageClass;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Assigns each warehouse a storage class from the configured indoor and dangerous-cargo lists.
 * Names match after trimming, ignoring case; a warehouse on neither list is outdoor.
 */
@Component
public class StorageClassifier {

    private final Set<String> indoor;
    private final Set<String> dangerous;

    public StorageClassifier(LedgerSettings settings) {
        this.indoor = keys(settings.indoorWarehouses());
        this.dangerous = keys(settings.dangerousWarehouses());
    }

    public StorageClass classify(String warehouse) {
        if (warehouse == null) {
            return null;
        }
        String key = normalize(warehouse);
        if (dangerous.contains(key)) {
            return StorageClass.DANGEROUS;
        }
        return indoor.contains(key) ? StorageClass.INDOOR : StorageClass.OUTDOOR;
    }

    private static Set<String> keys(List<String> names) {
        return names.stream().map(StorageClassifier::normalize).collect(Collectors.toSet());
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
