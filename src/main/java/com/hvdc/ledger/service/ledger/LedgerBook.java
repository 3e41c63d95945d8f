package com.hvdc.ledger.service.ledger;

import com.hvdc.ledger.model.SiteLedger;
import com.hvdc.ledger.model.WarehouseLedger;

import java.util.List;

/**
 * Ledgers for every bound warehouse and site over one reporting range.
 *
 * @param droppedDeltas delta units dated outside the range, not reflected in any ledger
 */
public record LedgerBook(
        List<WarehouseLedger> warehouses,
        List<SiteLedger> sites,
        long droppedDeltas
) {}
