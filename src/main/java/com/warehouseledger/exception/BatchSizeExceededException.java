package com.warehouseledger.exception;

public class BatchSizeExceededException extends LedgerException {
    public BatchSizeExceededException(int size, int max) {
        super("BATCH_SIZE_EXCEEDED",
              "Run contains " + size + " cases which exceeds the maximum of " + max + ".");
    }
}
