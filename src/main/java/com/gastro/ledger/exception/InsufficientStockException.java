package com.gastro.ledger.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.math.BigDecimal;

@Getter
public class InsufficientStockException extends LedgerException {
    private final BigDecimal available;
    private final BigDecimal requested;

    public InsufficientStockException(String ingredientName, String location, BigDecimal available,
            BigDecimal requested) {
        super(String.format("Insufficient stock of %s at %s. Available: %s, Requested: %s",
                ingredientName, location, available.toPlainString(), requested.toPlainString()),
                HttpStatus.UNPROCESSABLE_ENTITY,
                "INSUFFICIENT_STOCK");
        this.available = available;
        this.requested = requested;
    }
}
