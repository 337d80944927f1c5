package com.example.Microgrid_Dispatch.solver;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-solve limits: relative optimality gap and wall-clock time limit.
 */
public class SolverOptions {

    private final double relativeGap;
    private final Duration timeLimit;

    public SolverOptions(double relativeGap, Duration timeLimit) {
        if (relativeGap < 0) {
            throw new IllegalArgumentException("Relative gap must be non-negative: " + relativeGap);
        }
        this.relativeGap = relativeGap;
        this.timeLimit = Objects.requireNonNull(timeLimit, "Time limit cannot be null");
    }

    public double getRelativeGap() {
        return relativeGap;
    }

    public Duration getTimeLimit() {
        return timeLimit;
    }

    /** Same gap, time limit multiplied by {@code factor}. */
    public SolverOptions withRelaxedTimeLimit(double factor) {
        long millis = Math.max(1L, Math.round(timeLimit.toMillis() * factor));
        return new SolverOptions(relativeGap, Duration.ofMillis(millis));
    }

    @Override
    public String toString() {
        return String.format("SolverOptions{gap=%s, timeLimit=%dms}", relativeGap, timeLimit.toMillis());
    }
}
