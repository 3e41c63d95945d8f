package com.hvdc.ledger.model;

public enum Direction {
    INBOUND,
    OUTBOUND
}
