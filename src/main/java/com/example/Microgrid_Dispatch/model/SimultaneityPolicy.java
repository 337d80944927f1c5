package com.example.Microgrid_Dispatch.model;

/**
 * Whether the battery is explicitly prevented from charging and discharging in the same hour.
 */
public enum SimultaneityPolicy {

    /** Per-hour charge-mode binary gating both power limits. */
    BINARY_INDICATOR,

    /**
     * No constraint; relies on the efficiency loss making simultaneous flows
     * dominated. Does not hold when a curtailment penalty makes dumping
     * surplus solar through battery losses profitable.
     */
    COST_DOMINANCE
}
