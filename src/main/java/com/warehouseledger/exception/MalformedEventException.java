package com.warehouseledger.exception;

import lombok.Getter;

@Getter
public class MalformedEventException extends LedgerException {

    private final String caseId;

    public MalformedEventException(String caseId, String message) {
        super("MALFORMED_EVENT", "Case [" + caseId + "]: " + message);
        this.caseId = caseId;
    }
}
