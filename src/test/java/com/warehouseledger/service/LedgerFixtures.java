package com.warehouseledger.service;

import com.warehouseledger.config.LedgerProperties;
import com.warehouseledger.dto.CaseRecordRequest;
import com.warehouseledger.model.WarehouseClass;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

final class LedgerFixtures {

    static final String WH_A = "WarehouseA";
    static final String WH_B = "WarehouseB";
    static final String WH_C = "WarehouseC";
    static final String SITE_DAS = "SiteDAS";
    static final String SITE_MIR = "SiteMIR";

    private LedgerFixtures() {
    }

    static LedgerProperties properties() {
        LedgerProperties properties = new LedgerProperties();
        properties.setWarehouses(new ArrayList<>(List.of(
            new LedgerProperties.WarehouseDefinition(WH_A, WarehouseClass.INDOOR),
            new LedgerProperties.WarehouseDefinition(WH_B, WarehouseClass.OUTDOOR),
            new LedgerProperties.WarehouseDefinition(WH_C, WarehouseClass.DANGEROUS))));
        properties.setSites(new ArrayList<>(List.of(
            new LedgerProperties.SiteDefinition(SITE_DAS, "OFFSHORE"),
            new LedgerProperties.SiteDefinition(SITE_MIR, "ONSHORE"))));
        return properties;
    }

    static LocationClassifier classifier() {
        return new LocationClassifier(properties());
    }

    static CaseRecordRequest.LocationArrival at(String locationId, String isoDate) {
        return CaseRecordRequest.LocationArrival.of(locationId, isoDate != null ? LocalDate.parse(isoDate) : null);
    }

    static CaseRecordRequest record(String caseId, CaseRecordRequest.LocationArrival... arrivals) {
        return CaseRecordRequest.builder()
            .caseId(caseId)
            .supplier("HITACHI")
            .category("Electrical")
            .storageType("Indoor")
            .status("Open")
            .arrivals(List.of(arrivals))
            .build();
    }
}
