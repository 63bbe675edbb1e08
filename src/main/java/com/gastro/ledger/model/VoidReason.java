package com.gastro.ledger.model;

public enum VoidReason {
    CUSTOMER_REFUND,
    ENTRY_ERROR,
    DUPLICATE,
    TEST_ENTRY,
    OTHER
}
