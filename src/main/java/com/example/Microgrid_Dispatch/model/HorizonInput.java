package com.example.Microgrid_Dispatch.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Hourly input series for one optimisation run.
 *
 * Holds the load demand and the available (not yet dispatched) solar
 * generation for hours 0..H-1. Arrays are copied on the way in and on the way
 * out, so an instance can be shared between threads. Length consistency is
 * checked by {@code InputValidator}, not here, so that a malformed horizon
 * reaches the caller as a configuration error.
 */
public class HorizonInput {

    private final double[] load; // kW
    private final double[] solarAvailable; // kW
    private final double solarCapacityKW; // kW - nameplate, used for capacity factor

    public HorizonInput(double[] load, double[] solarAvailable, double solarCapacityKW) {
        this.load = Objects.requireNonNull(load, "Load series cannot be null").clone();
        this.solarAvailable = Objects.requireNonNull(solarAvailable, "Solar series cannot be null").clone();
        this.solarCapacityKW = solarCapacityKW;
    }

    /**
     * Absolute kW series; the solar nameplate defaults to the peak available value.
     */
    public static HorizonInput of(double[] load, double[] solarAvailable) {
        double peak = solarAvailable == null ? 0.0 : Arrays.stream(solarAvailable).max().orElse(0.0);
        return new HorizonInput(load, solarAvailable, Math.max(0.0, peak));
    }

    /**
     * Per-unit solar profile (0..1) scaled by the array's nameplate capacity.
     */
    public static HorizonInput fromPerUnitSolar(double[] load, double[] solarPerUnit, double solarCapacityKW) {
        Objects.requireNonNull(solarPerUnit, "Solar profile cannot be null");
        double[] solar = new double[solarPerUnit.length];
        for (int h = 0; h < solarPerUnit.length; h++) {
            solar[h] = solarPerUnit[h] * solarCapacityKW;
        }
        return new HorizonInput(load, solar, solarCapacityKW);
    }

    public int getHours() {
        return load.length;
    }

    public double getLoad(int hour) {
        return load[hour];
    }

    public double getSolarAvailable(int hour) {
        return solarAvailable[hour];
    }

    public double[] getLoad() {
        return load.clone();
    }

    public double[] getSolarAvailable() {
        return solarAvailable.clone();
    }

    public double getSolarCapacityKW() {
        return solarCapacityKW;
    }

    public double getTotalLoad() {
        return Arrays.stream(load).sum();
    }

    public double getTotalSolarAvailable() {
        return Arrays.stream(solarAvailable).sum();
    }

    @Override
    public String toString() {
        return String.format("HorizonInput{hours=%d, load=%.1fkWh, solar=%.1fkWh, solarCapacity=%.1fkW}",
                getHours(), getTotalLoad(), getTotalSolarAvailable(), solarCapacityKW);
    }
}
