package com.hvdc.ledger.model;

public enum AnomalyKind {
    /** Second stamp for the warehouse the case already sits in. */
    DUPLICATE_ARRIVAL,
    /** Any stamp after the case was delivered to a site. */
    POST_DELIVERY_EVENT,
    /** Two stamps on the same day, ordered by column declaration. */
    SAME_TIMESTAMP
}
