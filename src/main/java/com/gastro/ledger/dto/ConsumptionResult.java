package com.gastro.ledger.dto;

import com.gastro.ledger.model.MovementType;
import com.gastro.ledger.model.StockLocation;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of a transfer, spoilage or sale draw-down. {@code createdBatches} is
 * only filled for transfers: the lots that arrived at the destination.
 */
public record ConsumptionResult(
        Long movementId,
        MovementType movementType,
        Long ingredientId,
        String ingredientName,
        BigDecimal quantity,
        StockLocation fromLocation,
        StockLocation toLocation,
        List<ConsumedBatch> consumedBatches,
        List<BatchResponse> createdBatches) {
}
