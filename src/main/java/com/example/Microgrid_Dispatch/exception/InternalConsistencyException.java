package com.example.Microgrid_Dispatch.exception;

import java.util.List;

/**
 * A solved assignment failed post-solve validation. Always a defect in the
 * model or the solver integration, never a usable result.
 */
public class InternalConsistencyException extends DispatchException {

    private final List<String> violations;

    public InternalConsistencyException(List<String> violations) {
        super("Solved dispatch failed consistency checks: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }

    @Override
    public String getErrorCode() {
        return "INTERNAL_CONSISTENCY_ERROR";
    }
}
