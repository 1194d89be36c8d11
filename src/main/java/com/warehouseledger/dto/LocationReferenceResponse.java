package com.warehouseledger.dto;

import com.warehouseledger.model.WarehouseClass;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class LocationReferenceResponse {
    List<WarehouseView> warehouses;
    List<SiteView> sites;

    @Value
    @Builder
    public static class WarehouseView {
        String id;
        WarehouseClass classification;
        int rank;
    }

    @Value
    @Builder
    public static class SiteView {
        String id;
        String group;
        int rank;
    }
}
