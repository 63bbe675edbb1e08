package com.gastro.ledger.dto;

import com.gastro.ledger.model.InventorySnapshot;

import java.math.BigDecimal;

public record SnapshotLine(Long ingredientId, String ingredientName, BigDecimal quantity) {

    public static SnapshotLine from(InventorySnapshot snapshot) {
        return new SnapshotLine(snapshot.getIngredient().getId(), snapshot.getIngredient().getName(),
                snapshot.getQuantity());
    }
}
