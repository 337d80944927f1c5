package com.example.Microgrid_Dispatch.solver;

/**
 * Raw result of a MILP solve. Values are present only when the status has a solution.
 */
public class SolverOutcome {

    private final SolveStatus status;
    private final double[] values;
    private final double objectiveValue;
    private final double bestBound;
    private final long wallTimeMillis;
    private final String message;

    public SolverOutcome(SolveStatus status, double[] values, double objectiveValue, double bestBound,
                         long wallTimeMillis, String message) {
        this.status = status;
        this.values = values == null ? null : values.clone();
        this.objectiveValue = objectiveValue;
        this.bestBound = bestBound;
        this.wallTimeMillis = wallTimeMillis;
        this.message = message;
    }

    public static SolverOutcome solved(SolveStatus status, double[] values, double objectiveValue,
                                       double bestBound, long wallTimeMillis) {
        return new SolverOutcome(status, values, objectiveValue, bestBound, wallTimeMillis, null);
    }

    public static SolverOutcome failed(SolveStatus status, long wallTimeMillis, String message) {
        return new SolverOutcome(status, null, Double.NaN, Double.NaN, wallTimeMillis, message);
    }

    public SolveStatus getStatus() { return status; }
    public double getObjectiveValue() { return objectiveValue; }
    public double getBestBound() { return bestBound; }
    public long getWallTimeMillis() { return wallTimeMillis; }
    public String getMessage() { return message; }

    public double[] getValues() {
        return values == null ? null : values.clone();
    }

    public double getValue(int variable) {
        if (values == null) {
            throw new IllegalStateException("No assignment available for status " + status);
        }
        return values[variable];
    }

    public boolean hasSolution() {
        return status.hasSolution() && values != null;
    }

    @Override
    public String toString() {
        return String.format("SolverOutcome{status=%s, objective=%s, bound=%s, time=%dms%s}",
                status, objectiveValue, bestBound, wallTimeMillis, message == null ? "" : ", message='" + message + "'");
    }
}
