package com.warehouseledger.dto;

import com.warehouseledger.model.MovementStatus;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class CaseFilterRequest {
    String warehouse;
    String site;
    String storageType;
    String category;
    String status;
    String supplier;
    MovementStatus movementStatus;

    public boolean isEmpty() {
        return warehouse == null && site == null && storageType == null && category == null
            && status == null && supplier == null && movementStatus == null;
    }
}
