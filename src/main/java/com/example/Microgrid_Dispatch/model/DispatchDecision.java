package com.example.Microgrid_Dispatch.model;

/**
 * Solved dispatch for a single hour. Never mutated after extraction.
 */
public class DispatchDecision {

    private final int hour;
    private final double load; // kW
    private final double solarAvailable; // kW
    private final double dieselOutput; // kW
    private final boolean dieselOn;
    private final double batteryCharge; // kW
    private final double batteryDischarge; // kW
    private final double solarUsed; // kW
    private final double soc; // kWh at the end of the hour

    public DispatchDecision(int hour, double load, double solarAvailable, double dieselOutput, boolean dieselOn,
                            double batteryCharge, double batteryDischarge, double solarUsed, double soc) {
        this.hour = hour;
        this.load = load;
        this.solarAvailable = solarAvailable;
        this.dieselOutput = dieselOutput;
        this.dieselOn = dieselOn;
        this.batteryCharge = batteryCharge;
        this.batteryDischarge = batteryDischarge;
        this.solarUsed = solarUsed;
        this.soc = soc;
    }

    public int getHour() { return hour; }
    public double getLoad() { return load; }
    public double getSolarAvailable() { return solarAvailable; }
    public double getDieselOutput() { return dieselOutput; }
    public boolean isDieselOn() { return dieselOn; }
    public double getBatteryCharge() { return batteryCharge; }
    public double getBatteryDischarge() { return batteryDischarge; }
    public double getSolarUsed() { return solarUsed; }
    public double getSoc() { return soc; }

    public double getCurtailed() {
        return Math.max(0.0, solarAvailable - solarUsed);
    }

    /** Positive = discharging to the bus, negative = charging from it. */
    public double getNetBatteryPower() {
        return batteryDischarge - batteryCharge;
    }

    /** Supply minus demand on the bus; zero in a consistent solution. */
    public double getBalanceResidual() {
        return dieselOutput + batteryDischarge + solarUsed - load - batteryCharge;
    }

    @Override
    public String toString() {
        return String.format("Hour{%d: load=%.2f, diesel=%.2f(%s), charge=%.2f, discharge=%.2f, solar=%.2f/%.2f, soc=%.2f}",
                hour, load, dieselOutput, dieselOn ? "on" : "off", batteryCharge, batteryDischarge,
                solarUsed, solarAvailable, soc);
    }
}
