package com.example.Microgrid_Dispatch.exception;

import com.example.Microgrid_Dispatch.solver.SolveStatus;

/**
 * The solver returned no usable answer: an unbounded model (a modelling
 * defect) or an error that persisted through the retry.
 */
public class SolverFailureException extends DispatchException {

    private final SolveStatus status;

    public SolverFailureException(SolveStatus status, String message) {
        super(message);
        this.status = status;
    }

    public SolveStatus getStatus() {
        return status;
    }

    @Override
    public String getErrorCode() {
        return status == SolveStatus.UNBOUNDED ? "UNBOUNDED_MODEL" : "SOLVER_ERROR";
    }
}
