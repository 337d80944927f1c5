package com.example.Microgrid_Dispatch.input;

import java.time.LocalDateTime;

/**
 * One row of an hourly load and weather series.
 */
public class HourlyRecord {

    private final LocalDateTime timestamp;
    private final double loadKW;
    private final double solarPerUnit; // 0..1 of nameplate
    private final Double temperatureC; // optional

    public HourlyRecord(LocalDateTime timestamp, double loadKW, double solarPerUnit, Double temperatureC) {
        this.timestamp = timestamp;
        this.loadKW = loadKW;
        this.solarPerUnit = solarPerUnit;
        this.temperatureC = temperatureC;
    }

    public LocalDateTime getTimestamp() { return timestamp; }
    public double getLoadKW() { return loadKW; }
    public double getSolarPerUnit() { return solarPerUnit; }
    public Double getTemperatureC() { return temperatureC; }

    @Override
    public String toString() {
        return String.format("HourlyRecord{%s, load=%.1fkW, solar=%.3fpu}", timestamp, loadKW, solarPerUnit);
    }
}
