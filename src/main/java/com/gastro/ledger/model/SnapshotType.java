package com.gastro.ledger.model;

public enum SnapshotType {
    OPEN,
    CLOSE
}
