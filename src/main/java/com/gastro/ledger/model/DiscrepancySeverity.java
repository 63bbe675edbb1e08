package com.gastro.ledger.model;

public enum DiscrepancySeverity {
    OK,
    WARNING,
    CRITICAL
}
