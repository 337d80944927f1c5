package com.example.Microgrid_Dispatch.model;

import java.util.Objects;

/**
 * One independent optimisation run within a sweep.
 */
public class SweepJob {

    private final String label;
    private final HorizonInput horizon;
    private final AssetConfig config;

    public SweepJob(String label, HorizonInput horizon, AssetConfig config) {
        this.label = Objects.requireNonNull(label, "Label cannot be null");
        this.horizon = horizon;
        this.config = config;
    }

    public String getLabel() { return label; }
    public HorizonInput getHorizon() { return horizon; }
    public AssetConfig getConfig() { return config; }

    @Override
    public String toString() {
        return String.format("SweepJob{label='%s', %s}", label, horizon);
    }
}
