package com.gastro.ledger.dto;

import com.gastro.ledger.model.RecordedSale;
import com.gastro.ledger.model.VoidReason;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record RecordedSaleResponse(
        Long id,
        Long dailyRecordId,
        Long variantId,
        String productName,
        int quantity,
        BigDecimal unitPrice,
        BigDecimal total,
        Long shiftId,
        LocalDateTime recordedAt,
        boolean voided,
        LocalDateTime voidedAt,
        VoidReason voidReason,
        String voidNotes) {

    public static RecordedSaleResponse from(RecordedSale sale) {
        return new RecordedSaleResponse(
                sale.getId(),
                sale.getDailyRecord().getId(),
                sale.getProductVariant().getId(),
                sale.getProductVariant().getDisplayName(),
                sale.getQuantity(),
                sale.getUnitPrice(),
                sale.getTotal(),
                sale.getShiftId(),
                sale.getRecordedAt(),
                sale.isVoided(),
                sale.getVoidedAt(),
                sale.getVoidReason(),
                sale.getVoidNotes());
    }
}
