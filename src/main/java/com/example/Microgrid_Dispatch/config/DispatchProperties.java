package com.example.Microgrid_Dispatch.config;

import com.example.Microgrid_Dispatch.model.EfficiencySplit;
import com.example.Microgrid_Dispatch.model.SimultaneityPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Engine tunables bound from {@code dispatch.*} properties.
 */
@ConfigurationProperties(prefix = "dispatch")
public class DispatchProperties {

    private final Solver solver = new Solver();
    private final Formulation formulation = new Formulation();
    private final Validation validation = new Validation();
    private final Sweep sweep = new Sweep();

    /** Solar nameplate applied to per-unit solar profiles when a request gives none. */
    private double defaultSolarCapacityKw = 400.0;

    public Solver getSolver() { return solver; }
    public Formulation getFormulation() { return formulation; }
    public Validation getValidation() { return validation; }
    public Sweep getSweep() { return sweep; }
    public double getDefaultSolarCapacityKw() { return defaultSolarCapacityKw; }
    public void setDefaultSolarCapacityKw(double defaultSolarCapacityKw) { this.defaultSolarCapacityKw = defaultSolarCapacityKw; }

    public static class Solver {

        /** OR-Tools backend id, e.g. SCIP or CBC. */
        private String backend = "SCIP";

        /** Relative MIP gap at which a solve stops as optimal. */
        private double relativeGap = 1e-4;

        /** Wall-clock limit per solve; the best incumbent is returned when hit. */
        private Duration timeLimit = Duration.ofSeconds(30);

        /** Multiplier applied to the time limit for the single retry after a solver error. */
        private double retryTimeLimitFactor = 2.0;

        /** Upper bound on solves running at the same time across all runs. */
        private int maxConcurrentSolves = 2;

        public String getBackend() { return backend; }
        public void setBackend(String backend) { this.backend = backend; }
        public double getRelativeGap() { return relativeGap; }
        public void setRelativeGap(double relativeGap) { this.relativeGap = relativeGap; }
        public Duration getTimeLimit() { return timeLimit; }
        public void setTimeLimit(Duration timeLimit) { this.timeLimit = timeLimit; }
        public double getRetryTimeLimitFactor() { return retryTimeLimitFactor; }
        public void setRetryTimeLimitFactor(double retryTimeLimitFactor) { this.retryTimeLimitFactor = retryTimeLimitFactor; }
        public int getMaxConcurrentSolves() { return maxConcurrentSolves; }
        public void setMaxConcurrentSolves(int maxConcurrentSolves) { this.maxConcurrentSolves = maxConcurrentSolves; }
    }

    public static class Formulation {

        private EfficiencySplit efficiencySplit = EfficiencySplit.SYMMETRIC_SQRT;
        private SimultaneityPolicy simultaneityPolicy = SimultaneityPolicy.BINARY_INDICATOR;

        public EfficiencySplit getEfficiencySplit() { return efficiencySplit; }
        public void setEfficiencySplit(EfficiencySplit efficiencySplit) { this.efficiencySplit = efficiencySplit; }
        public SimultaneityPolicy getSimultaneityPolicy() { return simultaneityPolicy; }
        public void setSimultaneityPolicy(SimultaneityPolicy simultaneityPolicy) { this.simultaneityPolicy = simultaneityPolicy; }
    }

    public static class Validation {

        /** Relative tolerance of the post-solve balance and bound checks. */
        private double tolerance = 1e-6;

        public double getTolerance() { return tolerance; }
        public void setTolerance(double tolerance) { this.tolerance = tolerance; }
    }

    public static class Sweep {

        /** Worker threads running independent optimisation jobs. */
        private int workerThreads = 4;

        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
    }
}
