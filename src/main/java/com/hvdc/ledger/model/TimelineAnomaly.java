package com.hvdc.ledger.model;

/**
 * Audit entry for an event the transition rules could not apply cleanly.
 */
public record TimelineAnomaly(
        String caseId,
        AnomalyKind kind,
        LocationEvent event,
        String message
) {}
