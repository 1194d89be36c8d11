package com.warehouseledger.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LedgerReportResponse {
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant generatedAt;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate referenceDate;
    @JsonFormat(pattern = "yyyy-MM")
    YearMonth throughMonth;
    CaseFilterRequest filter;
    int totalCases;
    int includedCases;
    int excludedCases;
    int matchedCases;
    Summary summary;
    MonthlyLedger ledger;
    List<DeadStockRecord> deadStock;
    List<ExcludedCase> exclusions;

    @Value
    @Builder
    public static class Summary {
        List<LocationTotal> warehouseEndingStock;
        List<LocationTotal> siteCumulativeInbound;
        int flaggedDeadStock;
    }

    @Value
    @Builder
    public static class LocationTotal {
        String locationId;
        int count;
    }
}
