package com.gastro.ledger.model;

public enum StockLocation {
    STORAGE,
    SHOP
}
