package com.warehouseledger.service;

import com.warehouseledger.config.LedgerProperties;
import com.warehouseledger.exception.UnknownLocationException;
import com.warehouseledger.model.LocationKind;
import com.warehouseledger.model.WarehouseClass;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class LocationClassifier {

    private final Map<String, WarehouseClass> warehouses = new LinkedHashMap<>();
    private final Map<String, String> siteGroups = new LinkedHashMap<>();
    private final Map<String, Integer> ranks = new HashMap<>();

    public LocationClassifier(LedgerProperties properties) {
        int rank = 0;
        for (LedgerProperties.WarehouseDefinition warehouse : properties.getWarehouses()) {
            register(warehouse.getId(), rank++);
            warehouses.put(warehouse.getId(), warehouse.getClassification());
        }
        for (LedgerProperties.SiteDefinition site : properties.getSites()) {
            register(site.getId(), rank++);
            String group = site.getGroup() != null && !site.getGroup().isBlank() ? site.getGroup() : site.getId();
            siteGroups.put(site.getId(), group);
        }
        log.info("Location reference loaded | warehouses={} | sites={}", warehouses.keySet(), siteGroups.keySet());
    }

    private void register(String locationId, int rank) {
        if (ranks.putIfAbsent(locationId, rank) != null) {
            throw new IllegalStateException("Location '" + locationId + "' is declared more than once");
        }
    }

    public WarehouseClass classification(String warehouseId) {
        WarehouseClass classification = warehouses.get(warehouseId);
        if (classification == null) {
            throw new UnknownLocationException(warehouseId, LocationKind.WAREHOUSE);
        }
        return classification;
    }

    public String group(String siteId) {
        String group = siteGroups.get(siteId);
        if (group == null) {
            throw new UnknownLocationException(siteId, LocationKind.SITE);
        }
        return group;
    }

    public LocationKind kindOf(String locationId) {
        if (warehouses.containsKey(locationId)) {
            return LocationKind.WAREHOUSE;
        }
        if (siteGroups.containsKey(locationId)) {
            return LocationKind.SITE;
        }
        throw new UnknownLocationException(locationId);
    }

    public int rank(String locationId) {
        Integer rank = ranks.get(locationId);
        if (rank == null) {
            throw new UnknownLocationException(locationId);
        }
        return rank;
    }

    public boolean isWarehouse(String locationId) {
        return warehouses.containsKey(locationId);
    }

    public boolean isSite(String locationId) {
        return siteGroups.containsKey(locationId);
    }

    public List<String> warehouseIds() {
        return List.copyOf(warehouses.keySet());
    }

    public List<String> siteIds() {
        return List.copyOf(siteGroups.keySet());
    }

    public Map<String, WarehouseClass> warehouseClassifications() {
        return Collections.unmodifiableMap(warehouses);
    }

    public Map<String, String> siteGroups() {
        return Collections.unmodifiableMap(siteGroups);
    }
}
