package com.warehouseledger.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Getter
@ToString
@EqualsAndHashCode
public class CaseTimeline {

    private final String caseId;
    private final String supplier;
    private final String category;
    private final String storageType;
    private final String status;
    private final List<LocationEvent> events;

    @Builder
    private CaseTimeline(String caseId, String supplier, String category, String storageType,
                         String status, List<LocationEvent> events) {
        this.caseId = caseId;
        this.supplier = supplier;
        this.category = category;
        this.storageType = storageType;
        this.status = status;
        this.events = events != null
            ? events.stream().sorted(LocationEvent.CHRONOLOGICAL).toList()
            : List.of();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    public Optional<LocationEvent> lastEvent() {
        return events.isEmpty() ? Optional.empty() : Optional.of(events.get(events.size() - 1));
    }

    public Optional<LocationEvent> currentEvent(LocalDate asOf) {
        LocationEvent current = null;
        for (LocationEvent event : events) {
            if (event.arrivalDate().isAfter(asOf)) {
                break;
            }
            current = event;
        }
        return Optional.ofNullable(current);
    }

    public Optional<String> currentLocation(LocalDate asOf) {
        return currentEvent(asOf).map(LocationEvent::locationId);
    }

    public MovementStatus movementStatus(LocalDate asOf) {
        return currentEvent(asOf)
            .map(e -> e.isWarehouse() ? MovementStatus.IN_STOCK : MovementStatus.DELIVERED)
            .orElse(MovementStatus.NOT_RECEIVED);
    }

    public boolean visited(String locationId) {
        return events.stream().anyMatch(e -> e.locationId().equals(locationId));
    }

    public Optional<LocationEvent> firstWarehouseEvent() {
        return events.stream().filter(LocationEvent::isWarehouse).findFirst();
    }

    public Optional<LocationEvent> lastSiteEvent() {
        LocationEvent last = null;
        for (LocationEvent event : events) {
            if (event.isSite()) {
                last = event;
            }
        }
        return Optional.ofNullable(last);
    }
}
