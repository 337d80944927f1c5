package com.example.Microgrid_Dispatch.exception;

/**
 * Base class of every failure an optimisation run can end with.
 */
public abstract class DispatchException extends RuntimeException {

    protected DispatchException(String message) {
        super(message);
    }

    protected DispatchException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Stable code reported to API callers. */
    public abstract String getErrorCode();
}
