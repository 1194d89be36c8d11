package com.warehouseledger.service;

import com.warehouseledger.dto.DeadStockRecord;
import com.warehouseledger.dto.DeadStockResponse;
import com.warehouseledger.exception.AnalysisInputException;
import com.warehouseledger.model.CaseTimeline;
import com.warehouseledger.model.LocationEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
public class DeadStockDetector {

    static final Comparator<DeadStockRecord> SEVERITY =
        Comparator.comparingLong(DeadStockRecord::getAgeDays).reversed()
            .thenComparing(DeadStockRecord::getCaseId);

    private final LocationClassifier classifier;

    public List<DeadStockRecord> evaluate(List<CaseTimeline> timelines, LocalDate referenceDate,
                                          List<Integer> thresholds) {
        List<Integer> ordered = normalizeThresholds(thresholds);
        List<DeadStockRecord> records = new ArrayList<>();

        for (CaseTimeline timeline : timelines) {
            Optional<LocationEvent> current = timeline.currentEvent(referenceDate);
            if (current.isEmpty() || !current.get().isWarehouse()) {
                continue;
            }
            LocationEvent event = current.get();
            long ageDays = ChronoUnit.DAYS.between(event.arrivalDate(), referenceDate);
            records.add(DeadStockRecord.builder()
                .caseId(timeline.getCaseId())
                .warehouseId(event.locationId())
                .classification(classifier.classification(event.locationId()))
                .category(timeline.getCategory())
                .lastEventDate(event.arrivalDate())
                .ageDays(ageDays)
                .thresholdDays(highestCrossed(ageDays, ordered))
                .build());
        }

        records.sort(SEVERITY);
        return records;
    }

    public List<DeadStockRecord> flagged(List<DeadStockRecord> records) {
        return records.stream().filter(DeadStockRecord::isFlagged).toList();
    }

    public List<DeadStockRecord> urgent(List<DeadStockRecord> records, int urgentThresholdDays) {
        if (urgentThresholdDays < 1) {
            throw new AnalysisInputException("urgentThresholdDays must be >= 1");
        }
        return records.stream()
            .filter(r -> r.getAgeDays() >= urgentThresholdDays)
            .sorted(SEVERITY)
            .toList();
    }

    public List<DeadStockResponse.WarehouseSummary> summarizeByWarehouse(List<DeadStockRecord> flagged) {
        Map<String, List<Long>> ages = flagged.stream()
            .collect(Collectors.groupingBy(DeadStockRecord::getWarehouseId, LinkedHashMap::new,
                Collectors.mapping(DeadStockRecord::getAgeDays, Collectors.toList())));

        return classifier.warehouseIds().stream()
            .filter(ages::containsKey)
            .map(warehouse -> DeadStockResponse.WarehouseSummary.builder()
                .warehouseId(warehouse)
                .age(DayStatisticsCalculator.of(ages.get(warehouse)))
                .build())
            .toList();
    }

    public List<DeadStockResponse.BucketCount> countByBucket(List<DeadStockRecord> records, List<Integer> thresholds) {
        Map<Integer, Long> counts = records.stream()
            .filter(DeadStockRecord::isFlagged)
            .collect(Collectors.groupingBy(DeadStockRecord::getThresholdDays, Collectors.counting()));
        return normalizeThresholds(thresholds).stream()
            .map(t -> DeadStockResponse.BucketCount.builder()
                .thresholdDays(t)
                .caseCount(counts.getOrDefault(t, 0L).intValue())
                .build())
            .toList();
    }

    List<Integer> normalizeThresholds(List<Integer> thresholds) {
        if (thresholds == null || thresholds.isEmpty()) {
            throw new AnalysisInputException("at least one dead-stock threshold is required");
        }
        TreeSet<Integer> ordered = new TreeSet<>();
        for (Integer threshold : thresholds) {
            if (threshold == null || threshold < 1) {
                throw new AnalysisInputException("dead-stock thresholds must be >= 1 day, got " + threshold);
            }
            ordered.add(threshold);
        }
        return List.copyOf(ordered);
    }

    private static Integer highestCrossed(long ageDays, List<Integer> ascending) {
        Integer crossed = null;
        for (Integer threshold : ascending) {
            // inclusive: exactly 180 days old falls in the 180-day bucket
            if (ageDays >= threshold) {
                crossed = threshold;
            }
        }
        return crossed;
    }
}
