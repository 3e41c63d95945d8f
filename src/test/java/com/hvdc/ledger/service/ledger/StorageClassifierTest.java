package com.hvdc.ledger.service.ledger;

import com.hvdc.ledger.TestFixtures;
import com.hvdc.ledger.config.LedgerSettings;
import com.hvdc.ledger.model.StorageClass;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for StorageClassifier.
 */
class StorageClassifierTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "DSV Indoor, INDOOR",
            "dsv al markaz, INDOOR",
            "DHL WH, INDOOR",
            "AAA Storage, DANGEROUS",
            "DSV Outdoor, OUTDOOR",
            "MOSB, OUTDOOR",
            "DSV MZP, OUTDOOR"
    })
    @DisplayName("Should classify HVDC warehouses with the default storage lists")
    void shouldClassifyDefaults(String warehouse, StorageClass expected) {
        StorageClassifier classifier = new StorageClassifier(LedgerSettings.defaults());

        assertThat(classifier.classify(warehouse)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should let the dangerous list win over the indoor list")
    void shouldPreferDangerous() {
        StorageClassifier classifier = new StorageClassifier(TestFixtures.settings());

        assertThat(classifier.classify("WH1")).isEqualTo(StorageClass.INDOOR);
        assertThat(classifier.classify("WH2")).isEqualTo(StorageClass.OUTDOOR);
        assertThat(classifier.classify(" wh3 ")).isEqualTo(StorageClass.DANGEROUS);
        assertThat(classifier.classify(null)).isNull();
    }

    @Test
    @DisplayName("Should treat every warehouse as outdoor when both lists are empty")
    void shouldDefaultToOutdoor() {
        StorageClassifier classifier = new StorageClassifier(TestFixtures.settings().toBuilder()
                .indoorWarehouses(List.of())
                .dangerousWarehouses(List.of())
                .build());

        assertThat(classifier.classify("WH1")).isEqualTo(StorageClass.OUTDOOR);
        assertThat(classifier.classify("AAA Storage")).isEqualTo(StorageClass.OUTDOOR);
    }
}
