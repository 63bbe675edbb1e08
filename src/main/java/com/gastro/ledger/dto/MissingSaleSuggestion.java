package com.gastro.ledger.dto;

import java.math.BigDecimal;

public record MissingSaleSuggestion(
        Long variantId,
        String productName,
        BigDecimal suggestedQty,
        BigDecimal estimatedValue,
        String reason) {
}
