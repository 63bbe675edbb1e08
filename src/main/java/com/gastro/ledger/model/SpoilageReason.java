package com.gastro.ledger.model;

public enum SpoilageReason {
    EXPIRED,
    OVER_PREPARED,
    CONTAMINATED,
    EQUIPMENT_FAILURE,
    OTHER
}
