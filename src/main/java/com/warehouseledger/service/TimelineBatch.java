package com.warehouseledger.service;

import com.warehouseledger.dto.ExcludedCase;
import com.warehouseledger.model.CaseTimeline;

import java.util.List;

public record TimelineBatch(List<CaseTimeline> timelines, List<ExcludedCase> exclusions) {

    public TimelineBatch {
        timelines = List.copyOf(timelines);
        exclusions = List.copyOf(exclusions);
    }

    public int totalRecords() {
        return timelines.size() + exclusions.size();
    }
}
