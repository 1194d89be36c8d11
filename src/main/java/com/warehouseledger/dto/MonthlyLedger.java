package com.warehouseledger.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.warehouseledger.model.WarehouseClass;
import lombok.Builder;
import lombok.Value;

import java.time.YearMonth;
import java.util.List;

@Value
@Builder
public class MonthlyLedger {
    @JsonFormat(pattern = "yyyy-MM")
    YearMonth firstMonth;
    @JsonFormat(pattern = "yyyy-MM")
    YearMonth lastMonth;
    List<WarehouseRow> warehouseMonthly;
    List<ClassificationRow> classificationMonthly;
    List<SiteRow> siteMonthly;

    public static MonthlyLedger empty() {
        return MonthlyLedger.builder()
            .warehouseMonthly(List.of())
            .classificationMonthly(List.of())
            .siteMonthly(List.of())
            .build();
    }

    @Value
    @Builder
    public static class WarehouseRow {
        String warehouseId;
        WarehouseClass classification;
        @JsonFormat(pattern = "yyyy-MM")
        YearMonth month;
        int inbound;
        int outbound;
        int endingStock;
    }

    @Value
    @Builder
    public static class ClassificationRow {
        WarehouseClass classification;
        @JsonFormat(pattern = "yyyy-MM")
        YearMonth month;
        int inbound;
        int outbound;
        int endingStock;
    }

    @Value
    @Builder
    public static class SiteRow {
        String siteId;
        String siteGroup;
        @JsonFormat(pattern = "yyyy-MM")
        YearMonth month;
        int inbound;
        int cumulativeInbound;
    }
}
