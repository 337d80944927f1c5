package com.example.Microgrid_Dispatch.model;

import java.util.Objects;

/**
 * Modelling conventions applied by the model builder.
 */
public class FormulationOptions {

    private final EfficiencySplit efficiencySplit;
    private final SimultaneityPolicy simultaneityPolicy;

    public FormulationOptions(EfficiencySplit efficiencySplit, SimultaneityPolicy simultaneityPolicy) {
        this.efficiencySplit = Objects.requireNonNull(efficiencySplit, "Efficiency split cannot be null");
        this.simultaneityPolicy = Objects.requireNonNull(simultaneityPolicy, "Simultaneity policy cannot be null");
    }

    public static FormulationOptions defaults() {
        return new FormulationOptions(EfficiencySplit.SYMMETRIC_SQRT, SimultaneityPolicy.BINARY_INDICATOR);
    }

    public EfficiencySplit getEfficiencySplit() {
        return efficiencySplit;
    }

    public SimultaneityPolicy getSimultaneityPolicy() {
        return simultaneityPolicy;
    }

    @Override
    public String toString() {
        return String.format("FormulationOptions{split=%s, simultaneity=%s}", efficiencySplit, simultaneityPolicy);
    }
}
