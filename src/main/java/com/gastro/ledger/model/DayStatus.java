package com.gastro.ledger.model;

public enum DayStatus {
    OPEN,
    CLOSED
}
