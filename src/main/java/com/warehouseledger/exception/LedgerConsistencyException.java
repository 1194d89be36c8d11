package com.warehouseledger.exception;

public class LedgerConsistencyException extends LedgerException {
    public LedgerConsistencyException(String message) {
        super("LEDGER_INCONSISTENT", message);
    }
}
