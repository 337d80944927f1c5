package com.example.Microgrid_Dispatch.dto;

import com.example.Microgrid_Dispatch.model.DispatchResult;

import java.util.Collections;
import java.util.List;

/**
 * Data Transfer Object for an optimisation response
 *
 * On success {@code result} holds the schedule; on failure {@code errorCode}
 * and {@code details} (violations or suspected causes) explain why.
 */
public class DispatchResponse {

    public String status;
    public String errorCode;
    public String message;
    public DispatchResult result;
    public List<String> details;

    public long timestamp;

    public DispatchResponse() {}

    public DispatchResponse(DispatchResult result) {
        this.status = result.isProvenOptimal() ? "OPTIMAL" : "FEASIBLE";
        this.result = result;
        this.details = result.getWarnings();
        this.timestamp = System.currentTimeMillis();
    }

    public DispatchResponse(String status, String errorCode, String message, List<String> details) {
        this.status = status;
        this.errorCode = errorCode;
        this.message = message;
        this.details = details == null ? Collections.emptyList() : details;
        this.timestamp = System.currentTimeMillis();
    }
}
