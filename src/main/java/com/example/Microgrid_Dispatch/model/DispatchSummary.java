package com.example.Microgrid_Dispatch.model;

/**
 * Aggregate economics and energy totals of a solved horizon.
 */
public class DispatchSummary {

    // Costs
    public double totalFuelCost;
    public double totalCarbonCost;
    public double totalNoLoadCost;
    public double totalCurtailmentPenalty;
    public double totalCost;

    // Energy (kWh)
    public double totalLoadKWh;
    public double totalDieselKWh;
    public double totalSolarUsedKWh;
    public double totalCurtailedKWh;
    public double totalChargeKWh;
    public double totalDischargeKWh;

    public int dieselRunHours;
    public double terminalSocKWh;

    // Capacity factors (0..1)
    public double dieselCapacityFactor;
    public double batteryCapacityFactor;
    public double solarCapacityFactor;

    // Diesel-only reference
    public double baselineCost;
    public double savings;

    public DispatchSummary() {}

    public double getSavingsFraction() {
        return baselineCost > 0 ? savings / baselineCost : 0.0;
    }

    @Override
    public String toString() {
        return String.format("DispatchSummary{cost=%.2f (fuel=%.2f, carbon=%.2f, noLoad=%.2f, curtail=%.2f), "
                        + "diesel=%.1fkWh/%dh, solar=%.1fkWh, curtailed=%.1fkWh, terminalSoc=%.1fkWh, baseline=%.2f}",
                totalCost, totalFuelCost, totalCarbonCost, totalNoLoadCost, totalCurtailmentPenalty,
                totalDieselKWh, dieselRunHours, totalSolarUsedKWh, totalCurtailedKWh, terminalSocKWh, baselineCost);
    }
}
