package com.warehouseledger.model;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Comparator;

public record LocationEvent(String locationId, LocationKind kind, LocalDate arrivalDate, int rank) {

    public static final Comparator<LocationEvent> CHRONOLOGICAL =
        Comparator.comparing(LocationEvent::arrivalDate).thenComparingInt(LocationEvent::rank);

    public boolean isWarehouse() {
        return kind == LocationKind.WAREHOUSE;
    }

    public boolean isSite() {
        return kind == LocationKind.SITE;
    }

    public YearMonth month() {
        return YearMonth.from(arrivalDate);
    }
}
