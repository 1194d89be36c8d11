package com.warehouseledger.service;

import com.warehouseledger.dto.CaseFilterRequest;
import com.warehouseledger.exception.UnknownLocationException;
import com.warehouseledger.model.CaseTimeline;
import com.warehouseledger.model.LocationKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.function.Predicate;

@Slf4j
@Component
@RequiredArgsConstructor
public class CaseFilter {

    private final LocationClassifier classifier;

    public List<CaseTimeline> apply(List<CaseTimeline> timelines, CaseFilterRequest filter, LocalDate asOf) {
        if (filter == null || filter.isEmpty()) {
            return timelines;
        }
        List<CaseTimeline> matched = timelines.stream().filter(predicate(filter, asOf)).toList();
        log.info("Filter applied | filter={} | matched={} | of={}", filter, matched.size(), timelines.size());
        return matched;
    }

    public Predicate<CaseTimeline> predicate(CaseFilterRequest filter, LocalDate asOf) {
        Predicate<CaseTimeline> predicate = t -> true;
        if (filter == null) {
            return predicate;
        }
        if (filter.getWarehouse() != null) {
            String warehouse = filter.getWarehouse();
            if (!classifier.isWarehouse(warehouse)) {
                throw new UnknownLocationException(warehouse, LocationKind.WAREHOUSE);
            }
            predicate = predicate.and(t -> t.visited(warehouse));
        }
        if (filter.getSite() != null) {
            String site = filter.getSite();
            if (!classifier.isSite(site)) {
                throw new UnknownLocationException(site, LocationKind.SITE);
            }
            predicate = predicate.and(t -> t.visited(site));
        }
        if (filter.getStorageType() != null) {
            predicate = predicate.and(t -> filter.getStorageType().equalsIgnoreCase(t.getStorageType()));
        }
        if (filter.getCategory() != null) {
            predicate = predicate.and(t -> filter.getCategory().equalsIgnoreCase(t.getCategory()));
        }
        if (filter.getStatus() != null) {
            predicate = predicate.and(t -> filter.getStatus().equalsIgnoreCase(t.getStatus()));
        }
        if (filter.getSupplier() != null) {
            predicate = predicate.and(t -> filter.getSupplier().equalsIgnoreCase(t.getSupplier()));
        }
        if (filter.getMovementStatus() != null) {
            predicate = predicate.and(t -> t.movementStatus(asOf) == filter.getMovementStatus());
        }
        return predicate;
    }
}
