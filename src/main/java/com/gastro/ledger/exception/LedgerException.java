package com.gastro.ledger.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base of every error the ledger reports to its callers. Unchecked so the
 * surrounding transaction rolls back before anything is committed.
 */
@Getter
public class LedgerException extends RuntimeException {
    private final HttpStatus status;
    private final String errorCode;

    public LedgerException(String message, HttpStatus status, String errorCode) {
        super(message);
        this.status = status;
        this.errorCode = errorCode;
    }
}
