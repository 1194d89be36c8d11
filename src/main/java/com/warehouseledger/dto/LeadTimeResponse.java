package com.warehouseledger.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@Value
@Builder(toBuilder = true)
public class LeadTimeResponse {
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant generatedAt;
    int thresholdDays;
    DayStatistics overall;
    List<GroupStatistics> byInitialWarehouse;
    List<GroupStatistics> byCategory;
    List<CaseLeadTime> longLeadTimeCases;
    List<ExcludedCase> exclusions;

    @Value
    @Builder
    public static class GroupStatistics {
        String group;
        DayStatistics leadTime;
    }

    @Value
    @Builder
    public static class CaseLeadTime {
        String caseId;
        String initialWarehouse;
        String finalSite;
        String category;
        @JsonFormat(pattern = "yyyy-MM-dd")
        LocalDate firstWarehouseDate;
        @JsonFormat(pattern = "yyyy-MM-dd")
        LocalDate lastSiteDate;
        long leadTimeDays;
    }
}
