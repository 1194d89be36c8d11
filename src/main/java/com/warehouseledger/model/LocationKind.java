package com.warehouseledger.model;

public enum LocationKind {
    WAREHOUSE,
    SITE
}
