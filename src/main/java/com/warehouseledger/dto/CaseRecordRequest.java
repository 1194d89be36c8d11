package com.warehouseledger.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.List;

@Value
@Builder
@Jacksonized
public class CaseRecordRequest {

    String caseId;

    String supplier;

    String category;

    String storageType;

    String status;

    @Singular
    List<@Valid @NotNull LocationArrival> arrivals;

    @Value
    @Builder
    @Jacksonized
    public static class LocationArrival {
        String locationId;
        @JsonFormat(pattern = "yyyy-MM-dd")
        LocalDate arrivalDate;

        public static LocationArrival of(String locationId, LocalDate arrivalDate) {
            return LocationArrival.builder().locationId(locationId).arrivalDate(arrivalDate).build();
        }
    }
}
