package com.warehouseledger.service;

import com.warehouseledger.dto.LeadTimeResponse;
import com.warehouseledger.model.CaseTimeline;
import com.warehouseledger.model.LocationEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
public class LeadTimeAnalyzer {

    static final String UNCATEGORIZED = "UNCATEGORIZED";

    private final LocationClassifier classifier;
    private final Clock clock;

    public LeadTimeResponse analyze(List<CaseTimeline> timelines, int thresholdDays) {
        List<LeadTimeResponse.CaseLeadTime> leadTimes = timelines.stream()
            .map(this::leadTime)
            .flatMap(Optional::stream)
            .toList();

        List<LeadTimeResponse.CaseLeadTime> longCases = leadTimes.stream()
            .filter(c -> c.getLeadTimeDays() >= thresholdDays)
            .sorted(Comparator.comparingLong(LeadTimeResponse.CaseLeadTime::getLeadTimeDays).reversed()
                .thenComparing(LeadTimeResponse.CaseLeadTime::getCaseId))
            .toList();

        List<LeadTimeResponse.GroupStatistics> byWarehouse = group(leadTimes, LeadTimeResponse.CaseLeadTime::getInitialWarehouse)
            .entrySet().stream()
            .sorted(Comparator.comparingInt(e -> classifier.rank(e.getKey())))
            .map(e -> statistics(e.getKey(), e.getValue()))
            .toList();

        List<LeadTimeResponse.GroupStatistics> byCategory = group(leadTimes,
                c -> c.getCategory() != null && !c.getCategory().isBlank() ? c.getCategory() : UNCATEGORIZED)
            .entrySet().stream()
            .map(e -> statistics(e.getKey(), e.getValue()))
            .toList();

        return LeadTimeResponse.builder()
            .generatedAt(Instant.now(clock))
            .thresholdDays(thresholdDays)
            .overall(DayStatisticsCalculator.of(leadTimes.stream().map(LeadTimeResponse.CaseLeadTime::getLeadTimeDays).toList()))
            .byInitialWarehouse(byWarehouse)
            .byCategory(byCategory)
            .longLeadTimeCases(longCases)
            .build();
    }

    Optional<LeadTimeResponse.CaseLeadTime> leadTime(CaseTimeline timeline) {
        Optional<LocationEvent> firstWarehouse = timeline.firstWarehouseEvent();
        Optional<LocationEvent> lastSite = timeline.lastSiteEvent();
        if (firstWarehouse.isEmpty() || lastSite.isEmpty()) {
            return Optional.empty();
        }
        LocationEvent from = firstWarehouse.get();
        LocationEvent to = lastSite.get();
        if (LocationEvent.CHRONOLOGICAL.compare(to, from) < 0) {
            return Optional.empty();
        }
        return Optional.of(LeadTimeResponse.CaseLeadTime.builder()
            .caseId(timeline.getCaseId())
            .initialWarehouse(from.locationId())
            .finalSite(to.locationId())
            .category(timeline.getCategory())
            .firstWarehouseDate(from.arrivalDate())
            .lastSiteDate(to.arrivalDate())
            .leadTimeDays(ChronoUnit.DAYS.between(from.arrivalDate(), to.arrivalDate()))
            .build());
    }

    private static Map<String, List<Long>> group(List<LeadTimeResponse.CaseLeadTime> leadTimes,
                                                 Function<LeadTimeResponse.CaseLeadTime, String> key) {
        return leadTimes.stream().collect(Collectors.groupingBy(key, TreeMap::new,
            Collectors.mapping(LeadTimeResponse.CaseLeadTime::getLeadTimeDays, Collectors.toList())));
    }

    private static LeadTimeResponse.GroupStatistics statistics(String group, List<Long> days) {
        return LeadTimeResponse.GroupStatistics.builder()
            .group(group)
            .leadTime(DayStatisticsCalculator.of(days))
            .build();
    }
}
