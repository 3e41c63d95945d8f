package com.hvdc.ledger.service.cache;

import com.hvdc.ledger.config.LedgerSettings;
import com.hvdc.ledger.model.CaseRecord;
import com.hvdc.ledger.model.CaseTable;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDate;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

/**
 * SHA-256 over everything a run depends on: settings, reference date, header and every cell.
 * Two runs with the same fingerprint produce the same report.
 */
@Component
public class SnapshotFingerprinter {

    public String fingerprint(CaseTable table, LedgerSettings settings, LocalDate referenceDate) {
        MessageDigest digest = sha256();
        update(digest, settings.toString());
        update(digest, String.valueOf(referenceDate));
        update(digest, table.columns().toString());
        for (CaseRecord record : table.cases()) {
            update(digest, record.caseId());
            update(digest, Integer.toString(record.quantity()));
            update(digest, String.valueOf(record.category()));
            Map<String, Object> sorted = new TreeMap<>(record.cells());
            sorted.forEach((column, value) -> {
                update(digest, column);
                update(digest, value == null ? "" : value.getClass().getSimpleName() + ":" + value);
            });
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private static void update(MessageDigest digest, String value) {
        digest.update(value.getBytes(StandardCharsets.UTF_8));
        digest.update((byte) 0);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
