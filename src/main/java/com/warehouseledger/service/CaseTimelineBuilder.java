package com.warehouseledger.service;

import com.warehouseledger.dto.CaseRecordRequest;
import com.warehouseledger.dto.ExcludedCase;
import com.warehouseledger.exception.MalformedEventException;
import com.warehouseledger.model.CaseTimeline;
import com.warehouseledger.model.ExclusionReason;
import com.warehouseledger.model.LocationEvent;
import com.warehouseledger.model.LocationKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Component
@RequiredArgsConstructor
public class CaseTimelineBuilder {

    static final String UNKNOWN_STORAGE_TYPE = "UNKNOWN";

    private final LocationClassifier classifier;

    public CaseTimeline build(CaseRecordRequest record) {
        String caseId = record.getCaseId();
        if (caseId == null || caseId.isBlank()) {
            throw new MalformedEventException(String.valueOf(caseId), "case id is missing");
        }

        List<LocationEvent> events = new ArrayList<>();
        Set<String> seenLocations = new HashSet<>();
        for (CaseRecordRequest.LocationArrival arrival : record.getArrivals()) {
            String locationId = arrival.getLocationId();
            if (locationId == null || locationId.isBlank()) {
                throw new MalformedEventException(caseId, "arrival without a location id");
            }
            LocationKind kind = classifier.kindOf(locationId);
            if (!seenLocations.add(locationId)) {
                throw new MalformedEventException(caseId, "location '" + locationId + "' appears more than once");
            }
            if (arrival.getArrivalDate() == null) {
                continue;
            }
            events.add(new LocationEvent(locationId, kind, arrival.getArrivalDate(), classifier.rank(locationId)));
        }
        events.sort(LocationEvent.CHRONOLOGICAL);

        return CaseTimeline.builder()
            .caseId(caseId)
            .supplier(record.getSupplier())
            .category(record.getCategory())
            .storageType(resolveStorageType(record.getStorageType(), events))
            .status(record.getStatus())
            .events(events)
            .build();
    }

    public TimelineBatch buildAll(List<CaseRecordRequest> records) {
        List<CaseTimeline> timelines = new ArrayList<>();
        List<ExcludedCase> exclusions = new ArrayList<>();
        Map<String, Long> occurrences = records.stream()
            .map(CaseRecordRequest::getCaseId)
            .filter(Objects::nonNull)
            .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));

        for (CaseRecordRequest record : records) {
            try {
                CaseTimeline timeline = build(record);
                long copies = occurrences.getOrDefault(timeline.getCaseId(), 1L);
                if (copies > 1) {
                    throw new MalformedEventException(timeline.getCaseId(),
                        "case id appears " + copies + " times in the run");
                }
                if (timeline.isEmpty()) {
                    log.warn("Case excluded | caseId={} | reason={}", timeline.getCaseId(), ExclusionReason.EMPTY_TIMELINE);
                    exclusions.add(ExcludedCase.builder()
                        .caseId(timeline.getCaseId())
                        .reason(ExclusionReason.EMPTY_TIMELINE)
                        .message("Case has no arrival dates")
                        .build());
                    continue;
                }
                timelines.add(timeline);
            } catch (MalformedEventException ex) {
                log.warn("Case excluded | caseId={} | reason={} | {}",
                         ex.getCaseId(), ExclusionReason.MALFORMED_EVENTS, ex.getMessage());
                exclusions.add(ExcludedCase.builder()
                    .caseId(ex.getCaseId())
                    .reason(ExclusionReason.MALFORMED_EVENTS)
                    .message(ex.getMessage())
                    .build());
            }
        }

        log.info("Timelines built | accepted={} | excluded={}", timelines.size(), exclusions.size());
        return new TimelineBatch(timelines, exclusions);
    }

    private String resolveStorageType(String declared, List<LocationEvent> events) {
        if (declared != null && !declared.isBlank()) {
            return declared;
        }
        return events.stream()
            .filter(LocationEvent::isWarehouse)
            .findFirst()
            .map(e -> classifier.classification(e.locationId()).name())
            .orElse(UNKNOWN_STORAGE_TYPE);
    }
}
