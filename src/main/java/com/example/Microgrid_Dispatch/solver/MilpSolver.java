package com.example.Microgrid_Dispatch.solver;

/**
 * Black-box MILP solver contract.
 *
 * Implementations must be safe to call from several threads at once, each
 * call working on its own native model, and must report failures through
 * {@link SolveStatus#ERROR} rather than by throwing.
 */
public interface MilpSolver {

    SolverOutcome solve(LinearModel model, SolverOptions options);

    /** Human readable backend name, e.g. "SCIP". */
    String getBackendName();
}
