package com.warehouseledger.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;

@Value
@Builder
@Jacksonized
public class LedgerRunRequest {

    @NotNull(message = "cases is required")
    List<@Valid @NotNull CaseRecordRequest> cases;

    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate referenceDate;

    @Size(max = 20, message = "at most 20 dead-stock thresholds are supported")
    List<@NotNull @Min(value = 1, message = "thresholds must be >= 1 day") Integer> thresholds;

    @JsonFormat(pattern = "yyyy-MM")
    YearMonth throughMonth;

    @Valid
    CaseFilterRequest filter;
}
