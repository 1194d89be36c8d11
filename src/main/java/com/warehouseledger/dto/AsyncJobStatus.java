package com.warehouseledger.dto;

public enum AsyncJobStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED
}
