package com.example.Microgrid_Dispatch.solver;

/**
 * Normalised termination status of a MILP solve.
 */
public enum SolveStatus {
    OPTIMAL,
    FEASIBLE, // time limit reached with an incumbent, gap not closed
    INFEASIBLE,
    UNBOUNDED,
    ERROR;

    public boolean hasSolution() {
        return this == OPTIMAL || this == FEASIBLE;
    }
}
