package com.example.Microgrid_Dispatch.dto;

import com.example.Microgrid_Dispatch.model.DispatchResult;
import com.example.Microgrid_Dispatch.model.SweepOutcome;

import java.util.Collections;
import java.util.List;

/**
 * Data Transfer Object for sweep results, one point per battery capacity
 */
public class SweepResponse {

    public String status;
    public String errorCode;
    public String message;
    public List<String> details;

    public List<SweepPoint> points;
    public int succeeded;
    public int failed;

    public long timestamp;

    public SweepResponse() {}

    public SweepResponse(List<SweepPoint> points) {
        this.status = "COMPLETED";
        this.points = points;
        this.succeeded = (int) points.stream().filter(point -> point.errorCode == null).count();
        this.failed = points.size() - succeeded;
        this.timestamp = System.currentTimeMillis();
    }

    public SweepResponse(String status, String errorCode, String message, List<String> details) {
        this.status = status;
        this.errorCode = errorCode;
        this.message = message;
        this.details = details;
        this.points = Collections.emptyList();
        this.timestamp = System.currentTimeMillis();
    }

    public static class SweepPoint {
        public String label;
        public double batteryCapacityKWh;
        public String status;
        public String errorCode;
        public String message;
        public double totalCost;
        public double baselineCost;
        public double savings;
        public int dieselRunHours;
        public double totalCurtailedKWh;

        public SweepPoint() {}

        public SweepPoint(SweepOutcome outcome) {
            this.label = outcome.getLabel();
            this.batteryCapacityKWh = outcome.getJob().getConfig().getBatteryCapacityKWh();
            if (outcome.isSuccess()) {
                DispatchResult result = outcome.getResult();
                this.status = result.getStatus().name();
                this.totalCost = result.getSummary().totalCost;
                this.baselineCost = result.getSummary().baselineCost;
                this.savings = result.getSummary().savings;
                this.dieselRunHours = result.getSummary().dieselRunHours;
                this.totalCurtailedKWh = result.getSummary().totalCurtailedKWh;
            } else {
                this.status = "FAILED";
                this.errorCode = outcome.getErrorCode();
                this.message = outcome.getErrorMessage();
            }
        }
    }
}
