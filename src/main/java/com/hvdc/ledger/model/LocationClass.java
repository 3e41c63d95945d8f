package com.hvdc.ledger.model;

/**
 * Kind of location a date column stands for.
 */
public enum LocationClass {
    WAREHOUSE,
    SITE
}
