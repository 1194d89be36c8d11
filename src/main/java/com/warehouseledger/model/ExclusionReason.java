package com.warehouseledger.model;

public enum ExclusionReason {
    EMPTY_TIMELINE,
    MALFORMED_EVENTS
}
