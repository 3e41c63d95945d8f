package com.hvdc.ledger.config;

public enum LeadTimeMode {
    /** Latest site stamp minus earliest warehouse stamp. */
    SPAN,
    /** Delivery that closed the case minus the first applied warehouse arrival. */
    TRANSITION_CHAIN
}
