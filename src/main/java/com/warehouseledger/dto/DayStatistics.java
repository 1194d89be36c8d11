package com.warehouseledger.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DayStatistics {
    int count;
    Double meanDays;
    Double medianDays;
    Long minDays;
    Long maxDays;
}
