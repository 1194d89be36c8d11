package com.warehouseledger.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class DeadStockResponse {
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant generatedAt;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate referenceDate;
    List<Integer> thresholds;
    int urgentThresholdDays;
    int inStockCases;
    int flaggedCases;
    List<DeadStockRecord> records;
    List<DeadStockRecord> urgentCases;
    List<WarehouseSummary> byWarehouse;
    List<BucketCount> byBucket;
    List<ExcludedCase> exclusions;

    @Value
    @Builder
    public static class WarehouseSummary {
        String warehouseId;
        DayStatistics age;
    }

    @Value
    @Builder
    public static class BucketCount {
        int thresholdDays;
        int caseCount;
    }
}
