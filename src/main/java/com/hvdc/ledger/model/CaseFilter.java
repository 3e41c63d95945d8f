package com.hvdc.ledger.model;

import lombok.Builder;

/**
 * Conditions for a filtered view of a report. Unset conditions match every case.
 *
 * @param warehouse    cases stamped at this warehouse
 * @param site         cases stamped at this site
 * @param storageClass storage class of the case's initial warehouse
 * @param category     material category, ignoring case
 */
@Builder
public record CaseFilter(
        String warehouse,
        String site,
        StorageClass storageClass,
        String category,
        CaseStatus status
) {

    public static CaseFilter all() {
        return CaseFilter.builder().build();
    }
}
