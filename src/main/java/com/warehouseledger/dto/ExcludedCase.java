package com.warehouseledger.dto;

import com.warehouseledger.model.ExclusionReason;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ExcludedCase {
    String caseId;
    ExclusionReason reason;
    String message;
}
