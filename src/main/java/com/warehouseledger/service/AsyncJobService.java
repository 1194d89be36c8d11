package com.warehouseledger.service;

import com.warehouseledger.dto.AsyncJobResponse;
import com.warehouseledger.dto.AsyncJobStatus;
import com.warehouseledger.dto.LedgerReportResponse;
import com.warehouseledger.exception.JobNotFoundException;
import com.warehouseledger.exception.LedgerException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

@Slf4j
@Service
public class AsyncJobService {

    @Value("${jobs.pool-size:2}")
    private int poolSize;

    @Value("${jobs.max-retained:200}")
    private int maxRetained;

    private ExecutorService executor;
    private final Map<UUID, ReportJob> jobs = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        executor = Executors.newFixedThreadPool(Math.max(1, poolSize));
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public UUID submit(String requestId, int submittedCases, Supplier<LedgerReportResponse> report) {
        ReportJob job = new ReportJob(UUID.randomUUID(), requestId, submittedCases);
        jobs.put(job.id, job);
        evictFinished();

        executor.execute(() -> run(job, report));
        log.info("Ledger job queued | jobId={} | cases={} | requestId={}", job.id, submittedCases, requestId);
        return job.id;
    }

    public AsyncJobResponse getJob(UUID jobId) {
        ReportJob job = jobs.get(jobId);
        if (job == null) {
            throw new JobNotFoundException(jobId);
        }
        return job.snapshot();
    }

    private void run(ReportJob job, Supplier<LedgerReportResponse> report) {
        job.started();
        try {
            job.completed(report.get());
            log.info("Ledger job completed | jobId={} | durationMs={}", job.id, job.durationMillis());
        } catch (LedgerException ex) {
            log.warn("Ledger job failed | jobId={} | errorCode={} | {}", job.id, ex.getErrorCode(), ex.getMessage());
            job.failed(ex.getErrorCode(), ex.getMessage());
        } catch (RuntimeException ex) {
            log.error("Ledger job failed | jobId={}", job.id, ex);
            job.failed("INTERNAL_ERROR", ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
        }
    }

    private void evictFinished() {
        int excess = jobs.size() - maxRetained;
        if (excess <= 0) {
            return;
        }
        List<UUID> oldest = jobs.values().stream()
            .filter(ReportJob::isFinished)
            .sorted(Comparator.comparing(j -> j.queuedAt))
            .limit(excess)
            .map(j -> j.id)
            .toList();
        oldest.forEach(jobs::remove);
        log.debug("Evicted finished ledger jobs | count={}", oldest.size());
    }

    private static final class ReportJob {
        private final UUID id;
        private final String requestId;
        private final int submittedCases;
        private final Instant queuedAt = Instant.now();
        private Instant startedAt;
        private Instant finishedAt;
        private AsyncJobStatus status = AsyncJobStatus.QUEUED;
        private String errorCode;
        private String errorMessage;
        private LedgerReportResponse report;

        private ReportJob(UUID id, String requestId, int submittedCases) {
            this.id = id;
            this.requestId = requestId;
            this.submittedCases = submittedCases;
        }

        private synchronized void started() {
            startedAt = Instant.now();
            status = AsyncJobStatus.RUNNING;
        }

        private synchronized void completed(LedgerReportResponse result) {
            finishedAt = Instant.now();
            status = AsyncJobStatus.COMPLETED;
            report = result;
        }

        private synchronized void failed(String code, String message) {
            finishedAt = Instant.now();
            status = AsyncJobStatus.FAILED;
            errorCode = code;
            errorMessage = message;
        }

        private synchronized boolean isFinished() {
            return status == AsyncJobStatus.COMPLETED || status == AsyncJobStatus.FAILED;
        }

        private synchronized Long durationMillis() {
            return startedAt != null && finishedAt != null
                ? Duration.between(startedAt, finishedAt).toMillis()
                : null;
        }

        private synchronized AsyncJobResponse snapshot() {
            return AsyncJobResponse.builder()
                .jobId(id)
                .status(status)
                .requestId(requestId)
                .submittedCases(submittedCases)
                .queuedAt(queuedAt)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .durationMillis(durationMillis())
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .report(report)
                .build();
        }
    }
}
