package com.example.Microgrid_Dispatch.model;

/**
 * Asset parameters for one optimisation run.
 *
 * Immutable: every run owns its own instance, so concurrent sweeps over
 * different sizes never see each other's values. Use {@link #toBuilder()} to
 * derive a variant. Range checks live in {@code InputValidator}.
 */
public class AssetConfig {

    // Diesel generator
    private final double dieselCapacityKW;
    private final double dieselMinLoadFraction; // of capacity, in [0, 1)
    private final double fuelCostPerKWh;
    private final double carbonTaxPerKWh;
    private final double dieselNoLoadCostPerHour; // fuel curve intercept, per running hour

    // Battery energy storage
    private final double batteryCapacityKWh;
    private final double batteryMaxChargeKW;
    private final double batteryMaxDischargeKW;
    private final double batteryRoundTripEfficiency;
    private final double batteryInitialSoCKWh;

    // Solar
    private final double curtailmentPenaltyPerKWh;

    private AssetConfig(Builder builder) {
        this.dieselCapacityKW = builder.dieselCapacityKW;
        this.dieselMinLoadFraction = builder.dieselMinLoadFraction;
        this.fuelCostPerKWh = builder.fuelCostPerKWh;
        this.carbonTaxPerKWh = builder.carbonTaxPerKWh;
        this.dieselNoLoadCostPerHour = builder.dieselNoLoadCostPerHour;
        this.batteryCapacityKWh = builder.batteryCapacityKWh;
        this.batteryMaxChargeKW = builder.batteryMaxChargeKW;
        this.batteryMaxDischargeKW = builder.batteryMaxDischargeKW;
        this.batteryRoundTripEfficiency = builder.batteryRoundTripEfficiency;
        this.batteryInitialSoCKWh = builder.batteryInitialSoCKWh;
        this.curtailmentPenaltyPerKWh = builder.curtailmentPenaltyPerKWh;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .dieselCapacityKW(dieselCapacityKW)
                .dieselMinLoadFraction(dieselMinLoadFraction)
                .fuelCostPerKWh(fuelCostPerKWh)
                .carbonTaxPerKWh(carbonTaxPerKWh)
                .dieselNoLoadCostPerHour(dieselNoLoadCostPerHour)
                .batteryCapacityKWh(batteryCapacityKWh)
                .batteryMaxChargeKW(batteryMaxChargeKW)
                .batteryMaxDischargeKW(batteryMaxDischargeKW)
                .batteryRoundTripEfficiency(batteryRoundTripEfficiency)
                .batteryInitialSoCKWh(batteryInitialSoCKWh)
                .curtailmentPenaltyPerKWh(curtailmentPenaltyPerKWh);
    }

    public double getDieselCapacityKW() { return dieselCapacityKW; }
    public double getDieselMinLoadFraction() { return dieselMinLoadFraction; }
    public double getFuelCostPerKWh() { return fuelCostPerKWh; }
    public double getCarbonTaxPerKWh() { return carbonTaxPerKWh; }
    public double getDieselNoLoadCostPerHour() { return dieselNoLoadCostPerHour; }
    public double getBatteryCapacityKWh() { return batteryCapacityKWh; }
    public double getBatteryMaxChargeKW() { return batteryMaxChargeKW; }
    public double getBatteryMaxDischargeKW() { return batteryMaxDischargeKW; }
    public double getBatteryRoundTripEfficiency() { return batteryRoundTripEfficiency; }
    public double getBatteryInitialSoCKWh() { return batteryInitialSoCKWh; }
    public double getCurtailmentPenaltyPerKWh() { return curtailmentPenaltyPerKWh; }

    /** Minimum stable output while the generator is on, in kW. */
    public double getDieselMinStableKW() {
        return dieselMinLoadFraction * dieselCapacityKW;
    }

    /** Marginal cost of one kWh of diesel output (fuel plus carbon). */
    public double getDieselMarginalCostPerKWh() {
        return fuelCostPerKWh + carbonTaxPerKWh;
    }

    public boolean hasBattery() {
        return batteryCapacityKWh > 0 && (batteryMaxChargeKW > 0 || batteryMaxDischargeKW > 0);
    }

    @Override
    public String toString() {
        return String.format("AssetConfig{diesel=%.1fkW (min %.0f%%), fuel=%.4f/kWh, carbon=%.4f/kWh, noLoad=%.2f/h, "
                        + "battery=%.1fkWh (+%.1f/-%.1fkW, eta=%.3f, soc0=%.1fkWh), curtailment=%.4f/kWh}",
                dieselCapacityKW, dieselMinLoadFraction * 100.0, fuelCostPerKWh, carbonTaxPerKWh,
                dieselNoLoadCostPerHour, batteryCapacityKWh, batteryMaxChargeKW, batteryMaxDischargeKW,
                batteryRoundTripEfficiency, batteryInitialSoCKWh, curtailmentPenaltyPerKWh);
    }

    public static class Builder {

        private double dieselCapacityKW;
        private double dieselMinLoadFraction;
        private double fuelCostPerKWh;
        private double carbonTaxPerKWh;
        private double dieselNoLoadCostPerHour;
        private double batteryCapacityKWh;
        private double batteryMaxChargeKW;
        private double batteryMaxDischargeKW;
        private double batteryRoundTripEfficiency = 1.0;
        private double batteryInitialSoCKWh;
        private double curtailmentPenaltyPerKWh;

        public Builder dieselCapacityKW(double value) { this.dieselCapacityKW = value; return this; }
        public Builder dieselMinLoadFraction(double value) { this.dieselMinLoadFraction = value; return this; }
        public Builder fuelCostPerKWh(double value) { this.fuelCostPerKWh = value; return this; }
        public Builder carbonTaxPerKWh(double value) { this.carbonTaxPerKWh = value; return this; }
        public Builder dieselNoLoadCostPerHour(double value) { this.dieselNoLoadCostPerHour = value; return this; }
        public Builder batteryCapacityKWh(double value) { this.batteryCapacityKWh = value; return this; }
        public Builder batteryMaxChargeKW(double value) { this.batteryMaxChargeKW = value; return this; }
        public Builder batteryMaxDischargeKW(double value) { this.batteryMaxDischargeKW = value; return this; }
        public Builder batteryRoundTripEfficiency(double value) { this.batteryRoundTripEfficiency = value; return this; }
        public Builder batteryInitialSoCKWh(double value) { this.batteryInitialSoCKWh = value; return this; }
        public Builder curtailmentPenaltyPerKWh(double value) { this.curtailmentPenaltyPerKWh = value; return this; }

        /** Same charge and discharge rating. */
        public Builder batteryPowerKW(double value) {
            this.batteryMaxChargeKW = value;
            this.batteryMaxDischargeKW = value;
            return this;
        }

        /** Derives the three diesel cost rates from the fuel curve. */
        public Builder fuelEconomics(FuelEconomics economics) {
            this.fuelCostPerKWh = economics.getFuelCostPerKWh();
            this.carbonTaxPerKWh = economics.getCarbonTaxPerKWh();
            this.dieselNoLoadCostPerHour = economics.getNoLoadCostPerHour();
            return this;
        }

        public AssetConfig build() {
            return new AssetConfig(this);
        }
    }
}
