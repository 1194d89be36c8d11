package com.warehouseledger.model;

public enum WarehouseClass {
    INDOOR,
    OUTDOOR,
    DANGEROUS
}
