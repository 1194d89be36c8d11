package com.warehouseledger.exception;

import com.warehouseledger.model.LocationKind;
import lombok.Getter;

@Getter
public class UnknownLocationException extends LedgerException {

    private final String locationId;

    public UnknownLocationException(String locationId) {
        super("UNKNOWN_LOCATION", "Location '" + locationId + "' is not a configured warehouse or site.");
        this.locationId = locationId;
    }

    public UnknownLocationException(String locationId, LocationKind expected) {
        super("UNKNOWN_LOCATION",
              "Location '" + locationId + "' is not a configured " + expected.name().toLowerCase() + ".");
        this.locationId = locationId;
    }
}
