package com.example.Microgrid_Dispatch.model;

import com.example.Microgrid_Dispatch.solver.SolveStatus;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of one successful optimisation run: the hourly schedule plus its summary.
 *
 * Only OPTIMAL and FEASIBLE runs produce a result; every other status is
 * raised as an exception by {@code DispatchOptimizer}. A FEASIBLE result is
 * usable but not proven optimal, and carries a warning saying so.
 */
public class DispatchResult {

    private final SolveStatus status;
    private final double objectiveValue;
    private final double bestBound;
    private final long solveTimeMillis;
    private final List<DispatchDecision> decisions;
    private final DispatchSummary summary;
    private final List<String> warnings;

    public DispatchResult(SolveStatus status, double objectiveValue, double bestBound, long solveTimeMillis,
                          List<DispatchDecision> decisions, DispatchSummary summary, List<String> warnings) {
        this.status = status;
        this.objectiveValue = objectiveValue;
        this.bestBound = bestBound;
        this.solveTimeMillis = solveTimeMillis;
        this.decisions = List.copyOf(decisions);
        this.summary = summary;
        this.warnings = warnings == null ? Collections.emptyList() : List.copyOf(warnings);
    }

    public SolveStatus getStatus() { return status; }
    public double getObjectiveValue() { return objectiveValue; }
    public double getBestBound() { return bestBound; }
    public long getSolveTimeMillis() { return solveTimeMillis; }
    public List<DispatchDecision> getDecisions() { return decisions; }
    public DispatchSummary getSummary() { return summary; }
    public List<String> getWarnings() { return warnings; }

    public boolean isProvenOptimal() {
        return status == SolveStatus.OPTIMAL;
    }

    /** Relative distance between incumbent and bound; 0 when proven optimal. */
    public double getRelativeGap() {
        if (isProvenOptimal()) return 0.0;
        double denominator = Math.max(1e-9, Math.abs(objectiveValue));
        return Math.abs(objectiveValue - bestBound) / denominator;
    }

    public int getHours() {
        return decisions.size();
    }

    public DispatchDecision getDecision(int hour) {
        return decisions.get(hour);
    }

    @Override
    public String toString() {
        return String.format("DispatchResult{status=%s, objective=%.4f, hours=%d, solveTime=%dms, warnings=%d}",
                status, objectiveValue, decisions.size(), solveTimeMillis, warnings.size());
    }
}
