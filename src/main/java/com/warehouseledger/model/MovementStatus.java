package com.warehouseledger.model;

public enum MovementStatus {
    NOT_RECEIVED,
    IN_STOCK,
    DELIVERED
}
