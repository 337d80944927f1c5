package com.example.Microgrid_Dispatch.model;

/**
 * How round-trip battery losses are distributed over the charge and discharge legs.
 */
public enum EfficiencySplit {

    /** sqrt(eta) on each leg. */
    SYMMETRIC_SQRT,

    /** Whole loss on charge; discharge is lossless. */
    CHARGE_LEG,

    /** Whole loss on discharge; charge is lossless. */
    DISCHARGE_LEG;

    public double chargeEfficiency(double roundTrip) {
        switch (this) {
            case SYMMETRIC_SQRT:
                return Math.sqrt(roundTrip);
            case CHARGE_LEG:
                return roundTrip;
            default:
                return 1.0;
        }
    }

    public double dischargeEfficiency(double roundTrip) {
        switch (this) {
            case SYMMETRIC_SQRT:
                return Math.sqrt(roundTrip);
            case DISCHARGE_LEG:
                return roundTrip;
            default:
                return 1.0;
        }
    }
}
