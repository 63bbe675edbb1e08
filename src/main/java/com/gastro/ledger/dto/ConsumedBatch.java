package com.gastro.ledger.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

public record ConsumedBatch(
        Long batchId,
        String batchNumber,
        LocalDate expiryDate,
        BigDecimal quantityTaken,
        BigDecimal remainingQuantity,
        boolean retired) {
}
