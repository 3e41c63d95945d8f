package com.hvdc.ledger.model;

/**
 * Storage type of a warehouse. Dangerous-cargo stores are checked before indoor ones.
 */
public enum StorageClass {
    INDOOR,
    OUTDOOR,
    DANGEROUS
}
