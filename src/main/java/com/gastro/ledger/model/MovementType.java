package com.gastro.ledger.model;

public enum MovementType {
    DELIVERY,
    TRANSFER,
    SPOILAGE,
    SALE
}
