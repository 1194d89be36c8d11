package com.warehouseledger.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.warehouseledger.model.WarehouseClass;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class DeadStockRecord {
    String caseId;
    String warehouseId;
    WarehouseClass classification;
    String category;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate lastEventDate;
    long ageDays;
    Integer thresholdDays;

    public boolean isFlagged() {
        return thresholdDays != null;
    }

    public String getBucket() {
        return thresholdDays != null ? ">=" + thresholdDays + "d" : "BELOW_THRESHOLD";
    }
}
