package com.hvdc.ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Warehouse ledger engine.
 *
 * Runs one analysis at startup when app.ledger.input-file is set; otherwise the
 * orchestrator is available for embedding callers.
 */
@SpringBootApplication
public class HvdcWarehouseLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(HvdcWarehouseLedgerApplication.class, args);
    }
}
