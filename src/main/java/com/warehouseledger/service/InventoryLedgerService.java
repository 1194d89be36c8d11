package com.warehouseledger.service;

import com.warehouseledger.config.LedgerProperties;
import com.warehouseledger.dto.CaseRecordRequest;
import com.warehouseledger.dto.CaseTimelineResponse;
import com.warehouseledger.dto.DeadStockRecord;
import com.warehouseledger.dto.DeadStockResponse;
import com.warehouseledger.dto.LeadTimeResponse;
import com.warehouseledger.dto.LedgerReportResponse;
import com.warehouseledger.dto.LedgerRunRequest;
import com.warehouseledger.dto.LocationReferenceResponse;
import com.warehouseledger.dto.MonthlyLedger;
import com.warehouseledger.exception.AnalysisInputException;
import com.warehouseledger.exception.BatchSizeExceededException;
import com.warehouseledger.model.CaseTimeline;
import com.warehouseledger.model.LocationEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class InventoryLedgerService {

    private final CaseTimelineBuilder timelineBuilder;
    private final MonthlyAggregator aggregator;
    private final DeadStockDetector deadStockDetector;
    private final CaseFilter caseFilter;
    private final LeadTimeAnalyzer leadTimeAnalyzer;
    private final LocationClassifier classifier;
    private final LedgerProperties properties;
    private final Clock clock;

    public LedgerReportResponse report(LedgerRunRequest request, String requestId) {
        LocalDate referenceDate = referenceDate(request.getReferenceDate());
        List<Integer> thresholds = thresholds(request.getThresholds());
        YearMonth throughMonth = request.getThroughMonth();

        TimelineBatch batch = buildBatch(request.getCases());
        List<CaseTimeline> population = caseFilter.apply(batch.timelines(), request.getFilter(), referenceDate);

        MonthlyLedger ledger = aggregator.aggregate(population, throughMonth);
        if (properties.isVerifyConsistency()) {
            aggregator.verifyConsistency(ledger, population);
        }
        List<DeadStockRecord> deadStock = deadStockDetector.evaluate(population, referenceDate, thresholds);

        LedgerReportResponse response = LedgerReportResponse.builder()
            .generatedAt(Instant.now(clock))
            .referenceDate(referenceDate)
            .throughMonth(throughMonth)
            .filter(request.getFilter())
            .totalCases(batch.totalRecords())
            .includedCases(batch.timelines().size())
            .excludedCases(batch.exclusions().size())
            .matchedCases(population.size())
            .summary(summary(ledger, deadStock))
            .ledger(ledger)
            .deadStock(deadStock)
            .exclusions(batch.exclusions())
            .build();

        log.info("Ledger run complete | cases={} | matched={} | excluded={} | months={} | requestId={}",
                 batch.totalRecords(), population.size(), batch.exclusions().size(),
                 ledger.getFirstMonth() != null ? ledger.getFirstMonth() + ".." + ledger.getLastMonth() : "none",
                 requestId);
        return response;
    }

    public DeadStockResponse deadStock(LedgerRunRequest request) {
        LocalDate referenceDate = referenceDate(request.getReferenceDate());
        List<Integer> thresholds = thresholds(request.getThresholds());
        int urgentDays = properties.getDeadStock().getUrgentThresholdDays();

        TimelineBatch batch = buildBatch(request.getCases());
        List<CaseTimeline> population = caseFilter.apply(batch.timelines(), request.getFilter(), referenceDate);

        List<DeadStockRecord> records = deadStockDetector.evaluate(population, referenceDate, thresholds);
        List<DeadStockRecord> flagged = deadStockDetector.flagged(records);

        log.info("Dead-stock scan | referenceDate={} | inStock={} | flagged={} | thresholds={}",
                 referenceDate, records.size(), flagged.size(), thresholds);

        return DeadStockResponse.builder()
            .generatedAt(Instant.now(clock))
            .referenceDate(referenceDate)
            .thresholds(thresholds)
            .urgentThresholdDays(urgentDays)
            .inStockCases(records.size())
            .flaggedCases(flagged.size())
            .records(records)
            .urgentCases(deadStockDetector.urgent(records, urgentDays))
            .byWarehouse(deadStockDetector.summarizeByWarehouse(flagged))
            .byBucket(deadStockDetector.countByBucket(records, thresholds))
            .exclusions(batch.exclusions())
            .build();
    }

    public LeadTimeResponse leadTimes(LedgerRunRequest request, int thresholdDays) {
        if (thresholdDays < 0) {
            throw new AnalysisInputException("thresholdDays must be >= 0");
        }
        LocalDate referenceDate = referenceDate(request.getReferenceDate());
        TimelineBatch batch = buildBatch(request.getCases());
        List<CaseTimeline> population = caseFilter.apply(batch.timelines(), request.getFilter(), referenceDate);

        LeadTimeResponse response = leadTimeAnalyzer.analyze(population, thresholdDays);
        log.info("Lead-time analysis | delivered={} | long={} | threshold={}",
                 response.getOverall().getCount(), response.getLongLeadTimeCases().size(), thresholdDays);
        return response.toBuilder().exclusions(batch.exclusions()).build();
    }

    public CaseTimelineResponse timelines(List<CaseRecordRequest> cases, LocalDate asOf) {
        LocalDate effective = referenceDate(asOf);
        TimelineBatch batch = buildBatch(cases);

        List<CaseTimelineResponse.TimelineView> views = batch.timelines().stream()
            .map(t -> toView(t, effective))
            .toList();

        return CaseTimelineResponse.builder()
            .asOf(effective)
            .caseCount(views.size())
            .timelines(views)
            .exclusions(batch.exclusions())
            .build();
    }

    public LocationReferenceResponse locations() {
        List<LocationReferenceResponse.WarehouseView> warehouses = classifier.warehouseIds().stream()
            .map(id -> LocationReferenceResponse.WarehouseView.builder()
                .id(id)
                .classification(classifier.classification(id))
                .rank(classifier.rank(id))
                .build())
            .toList();
        List<LocationReferenceResponse.SiteView> sites = classifier.siteIds().stream()
            .map(id -> LocationReferenceResponse.SiteView.builder()
                .id(id)
                .group(classifier.group(id))
                .rank(classifier.rank(id))
                .build())
            .toList();
        return LocationReferenceResponse.builder().warehouses(warehouses).sites(sites).build();
    }

    private TimelineBatch buildBatch(List<CaseRecordRequest> cases) {
        if (cases == null) {
            throw new AnalysisInputException("cases is required");
        }
        if (cases.size() > properties.getMaxCasesPerRun()) {
            throw new BatchSizeExceededException(cases.size(), properties.getMaxCasesPerRun());
        }
        return timelineBuilder.buildAll(cases);
    }

    private LocalDate referenceDate(LocalDate requested) {
        return requested != null ? requested : LocalDate.now(clock);
    }

    private List<Integer> thresholds(List<Integer> requested) {
        List<Integer> source = requested != null && !requested.isEmpty()
            ? requested
            : properties.getDeadStock().getThresholds();
        return deadStockDetector.normalizeThresholds(source);
    }

    private LedgerReportResponse.Summary summary(MonthlyLedger ledger, List<DeadStockRecord> deadStock) {
        Map<String, Integer> finalStock = new LinkedHashMap<>();
        for (MonthlyLedger.WarehouseRow row : ledger.getWarehouseMonthly()) {
            finalStock.put(row.getWarehouseId(), row.getEndingStock());
        }
        Map<String, Integer> finalCumulative = new LinkedHashMap<>();
        for (MonthlyLedger.SiteRow row : ledger.getSiteMonthly()) {
            finalCumulative.put(row.getSiteId(), row.getCumulativeInbound());
        }
        return LedgerReportResponse.Summary.builder()
            .warehouseEndingStock(totals(finalStock))
            .siteCumulativeInbound(totals(finalCumulative))
            .flaggedDeadStock(deadStockDetector.flagged(deadStock).size())
            .build();
    }

    private static List<LedgerReportResponse.LocationTotal> totals(Map<String, Integer> counts) {
        List<LedgerReportResponse.LocationTotal> totals = new ArrayList<>();
        counts.forEach((location, count) -> totals.add(LedgerReportResponse.LocationTotal.builder()
            .locationId(location)
            .count(count)
            .build()));
        return totals;
    }

    private CaseTimelineResponse.TimelineView toView(CaseTimeline timeline, LocalDate asOf) {
        Optional<LocationEvent> current = timeline.currentEvent(asOf);
        return CaseTimelineResponse.TimelineView.builder()
            .caseId(timeline.getCaseId())
            .supplier(timeline.getSupplier())
            .category(timeline.getCategory())
            .storageType(timeline.getStorageType())
            .status(timeline.getStatus())
            .movementStatus(timeline.movementStatus(asOf))
            .currentLocation(current.map(LocationEvent::locationId).orElse(null))
            .currentLocationKind(current.map(LocationEvent::kind).orElse(null))
            .events(timeline.getEvents().stream()
                .map(e -> CaseTimelineResponse.EventView.builder()
                    .locationId(e.locationId())
                    .kind(e.kind())
                    .arrivalDate(e.arrivalDate())
                    .rank(e.rank())
                    .build())
                .toList())
            .build();
    }
}
