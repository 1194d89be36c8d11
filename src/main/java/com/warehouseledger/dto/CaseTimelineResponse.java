package com.warehouseledger.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.warehouseledger.model.LocationKind;
import com.warehouseledger.model.MovementStatus;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class CaseTimelineResponse {
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate asOf;
    int caseCount;
    List<TimelineView> timelines;
    List<ExcludedCase> exclusions;

    @Value
    @Builder
    public static class TimelineView {
        String caseId;
        String supplier;
        String category;
        String storageType;
        String status;
        MovementStatus movementStatus;
        String currentLocation;
        LocationKind currentLocationKind;
        List<EventView> events;
    }

    @Value
    @Builder
    public static class EventView {
        String locationId;
        LocationKind kind;
        @JsonFormat(pattern = "yyyy-MM-dd")
        LocalDate arrivalDate;
        int rank;
    }
}
