package com.example.Microgrid_Dispatch.exception;

import java.util.List;

/**
 * Invalid or inconsistent asset configuration or horizon input.
 * Raised before any model is built; the solver is never called.
 */
public class DispatchConfigurationException extends DispatchException {

    private final List<String> violations;

    public DispatchConfigurationException(List<String> violations) {
        super("Invalid dispatch configuration: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }

    @Override
    public String getErrorCode() {
        return "CONFIGURATION_ERROR";
    }
}
