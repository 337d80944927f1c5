package com.example.Microgrid_Dispatch.dto;

import com.example.Microgrid_Dispatch.model.AssetConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Data Transfer Object for a single dispatch optimisation
 *
 * Solar is given either as absolute kW ({@code solarAvailable}) or as a
 * per-unit profile ({@code solarPerUnit}) scaled by {@code solarCapacityKW}.
 * Asset fields left out take the configured defaults.
 */
public class DispatchRequest {

    @NotNull
    @Size(min = 1)
    public double[] load;

    public double[] solarAvailable;

    public double[] solarPerUnit;

    public Double solarCapacityKW;

    @Valid
    public AssetParameters assets;

    public DispatchRequest() {}

    public DispatchRequest(double[] load, double[] solarAvailable) {
        this.load = load;
        this.solarAvailable = solarAvailable;
    }

    /**
     * Optional asset overrides; a null field keeps the default value
     */
    public static class AssetParameters {

        public Double dieselCapacityKW;
        public Double dieselMinLoadFraction;
        public Double fuelCostPerKWh;
        public Double carbonTaxPerKWh;
        public Double dieselNoLoadCostPerHour;

        public Double batteryCapacityKWh;
        public Double batteryMaxChargeKW;
        public Double batteryMaxDischargeKW;
        public Double batteryRoundTripEfficiency;
        public Double batteryInitialSoCKWh;

        public Double curtailmentPenaltyPerKWh;

        public AssetParameters() {}

        public AssetConfig applyTo(AssetConfig defaults) {
            AssetConfig.Builder builder = defaults.toBuilder();
            if (dieselCapacityKW != null) builder.dieselCapacityKW(dieselCapacityKW);
            if (dieselMinLoadFraction != null) builder.dieselMinLoadFraction(dieselMinLoadFraction);
            if (fuelCostPerKWh != null) builder.fuelCostPerKWh(fuelCostPerKWh);
            if (carbonTaxPerKWh != null) builder.carbonTaxPerKWh(carbonTaxPerKWh);
            if (dieselNoLoadCostPerHour != null) builder.dieselNoLoadCostPerHour(dieselNoLoadCostPerHour);
            if (batteryCapacityKWh != null) builder.batteryCapacityKWh(batteryCapacityKWh);
            if (batteryMaxChargeKW != null) builder.batteryMaxChargeKW(batteryMaxChargeKW);
            if (batteryMaxDischargeKW != null) builder.batteryMaxDischargeKW(batteryMaxDischargeKW);
            if (batteryRoundTripEfficiency != null) builder.batteryRoundTripEfficiency(batteryRoundTripEfficiency);
            if (batteryInitialSoCKWh != null) builder.batteryInitialSoCKWh(batteryInitialSoCKWh);
            if (curtailmentPenaltyPerKWh != null) builder.curtailmentPenaltyPerKWh(curtailmentPenaltyPerKWh);
            return builder.build();
        }
    }
}
