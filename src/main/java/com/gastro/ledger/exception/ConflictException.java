package com.gastro.ledger.exception;

import org.springframework.http.HttpStatus;

public class ConflictException extends LedgerException {
    public ConflictException(String message) {
        super(message, HttpStatus.CONFLICT, "CONFLICT");
    }
}
