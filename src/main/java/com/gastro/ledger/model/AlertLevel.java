package com.gastro.ledger.model;

public enum AlertLevel {
    EXPIRED,
    CRITICAL,
    WARNING,
    NONE
}
