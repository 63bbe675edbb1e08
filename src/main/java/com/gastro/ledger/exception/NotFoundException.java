package com.gastro.ledger.exception;

import org.springframework.http.HttpStatus;

public class NotFoundException extends LedgerException {
    public NotFoundException(String resourceName, Object id) {
        super(String.format("%s not found with id: %s", resourceName, id), HttpStatus.NOT_FOUND, "NOT_FOUND");
    }

    public NotFoundException(String message) {
        super(message, HttpStatus.NOT_FOUND, "NOT_FOUND");
    }
}
