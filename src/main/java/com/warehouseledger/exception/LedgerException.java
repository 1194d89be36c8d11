package com.warehouseledger.exception;

import lombok.Getter;

@Getter
public abstract class LedgerException extends RuntimeException {
    private final String errorCode;
    protected LedgerException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected LedgerException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
