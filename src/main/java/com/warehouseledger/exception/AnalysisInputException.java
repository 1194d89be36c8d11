package com.warehouseledger.exception;

public class AnalysisInputException extends LedgerException {
    public AnalysisInputException(String message) {
        super("ANALYSIS_INPUT_ERROR", message);
    }
}
