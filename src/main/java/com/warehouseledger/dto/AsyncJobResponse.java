package com.warehouseledger.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AsyncJobResponse {
    UUID jobId;
    AsyncJobStatus status;
    String requestId;
    int submittedCases;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant queuedAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant startedAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant finishedAt;
    Long durationMillis;
    String errorCode;
    String errorMessage;
    LedgerReportResponse report;
}
