package com.gastro.ledger.exception;

import org.springframework.http.HttpStatus;

/**
 * The target is in a state that does not allow the operation. Not worth
 * retrying: the caller has to pick a different operation.
 */
public class StateException extends LedgerException {
    public static final String DAY_NOT_OPEN = "DAY_NOT_OPEN";
    public static final String DAY_CLOSED = "DAY_CLOSED";
    public static final String DAY_STILL_OPEN = "DAY_STILL_OPEN";
    public static final String SALE_ALREADY_VOIDED = "SALE_ALREADY_VOIDED";
    public static final String UNIT_TYPE_LOCKED = "UNIT_TYPE_LOCKED";

    public StateException(String message, String errorCode) {
        super(message, HttpStatus.CONFLICT, errorCode);
    }
}
