package com.example.Microgrid_Dispatch.exception;

import java.util.List;

/**
 * The solver proved that no dispatch satisfies the constraints.
 *
 * Carries the suspected causes derived from the inputs (hour and constraint
 * class) so the caller can decide which input to change. Never relaxed.
 */
public class InfeasibleModelException extends DispatchException {

    private final List<String> suspectedCauses;

    public InfeasibleModelException(String message, List<String> suspectedCauses) {
        super(suspectedCauses.isEmpty() ? message : message + ": " + String.join("; ", suspectedCauses));
        this.suspectedCauses = List.copyOf(suspectedCauses);
    }

    public List<String> getSuspectedCauses() {
        return suspectedCauses;
    }

    @Override
    public String getErrorCode() {
        return "INFEASIBLE";
    }
}
