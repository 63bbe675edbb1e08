package com.gastro.ledger.dto;

import com.gastro.ledger.model.StockLocation;

import java.math.BigDecimal;
import java.util.List;

public record IngredientStockSummary(
        Long ingredientId,
        String ingredientName,
        String unitLabel,
        StockLocation location, // null when all locations are summed
        BigDecimal totalQuantity,
        int activeBatchCount,
        int expiringSoonCount,
        List<BatchStockLine> batches) {
}
