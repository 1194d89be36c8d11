package com.warehouseledger.controller;

import com.warehouseledger.config.RequestIdFilter;
import com.warehouseledger.dto.AsyncJobResponse;
import com.warehouseledger.dto.CaseRecordRequest;
import com.warehouseledger.dto.CaseTimelineResponse;
import com.warehouseledger.dto.DeadStockResponse;
import com.warehouseledger.dto.LeadTimeResponse;
import com.warehouseledger.dto.LedgerReportResponse;
import com.warehouseledger.dto.LedgerRunRequest;
import com.warehouseledger.dto.LocationReferenceResponse;
import com.warehouseledger.service.AsyncJobService;
import com.warehouseledger.service.InventoryLedgerService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/ledger")
@RequiredArgsConstructor
public class LedgerController {

    private final InventoryLedgerService ledgerService;
    private final AsyncJobService asyncJobService;

    @PostMapping("/report")
    public ResponseEntity<LedgerReportResponse> report(
            @Valid @RequestBody LedgerRunRequest request, HttpServletRequest httpRequest) {
        String requestId = RequestIdFilter.requestId(httpRequest);
        log.info("POST /ledger/report | cases={} | referenceDate={} | filter={} | requestId={}",
                 request.getCases().size(), request.getReferenceDate(), request.getFilter(), requestId);
        return ResponseEntity.ok(ledgerService.report(request, requestId));
    }

    @PostMapping("/report/async")
    public ResponseEntity<AsyncJobResponse> reportAsync(
            @Valid @RequestBody LedgerRunRequest request, HttpServletRequest httpRequest) {
        String requestId = RequestIdFilter.requestId(httpRequest);
        UUID jobId = asyncJobService.submit(
            requestId,
            request.getCases().size(),
            () -> ledgerService.report(request, requestId)
        );
        return ResponseEntity.accepted()
            .header("Location", "/api/v1/ledger/jobs/" + jobId)
            .body(asyncJobService.getJob(jobId));
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<AsyncJobResponse> jobStatus(@PathVariable UUID jobId) {
        return ResponseEntity.ok(asyncJobService.getJob(jobId));
    }

    @PostMapping("/timelines")
    public ResponseEntity<CaseTimelineResponse> timelines(
            @Valid @RequestBody @NotNull List<@Valid @NotNull CaseRecordRequest> cases,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        return ResponseEntity.ok(ledgerService.timelines(cases, asOf));
    }

    @PostMapping("/dead-stock")
    public ResponseEntity<DeadStockResponse> deadStock(@Valid @RequestBody LedgerRunRequest request) {
        return ResponseEntity.ok(ledgerService.deadStock(request));
    }

    @PostMapping("/lead-times")
    public ResponseEntity<LeadTimeResponse> leadTimes(
            @Valid @RequestBody LedgerRunRequest request,
            @RequestParam(defaultValue = "90") @Min(0) @Max(3650) int thresholdDays) {
        return ResponseEntity.ok(ledgerService.leadTimes(request, thresholdDays));
    }

    @GetMapping("/locations")
    public ResponseEntity<LocationReferenceResponse> locations() {
        return ResponseEntity.ok(ledgerService.locations());
    }
}
