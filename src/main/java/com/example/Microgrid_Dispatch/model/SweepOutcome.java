package com.example.Microgrid_Dispatch.model;

/**
 * Result of one sweep job: either a dispatch result or the error that ended the run.
 */
public class SweepOutcome {

    private final SweepJob job;
    private final DispatchResult result;
    private final String errorCode;
    private final String errorMessage;

    private SweepOutcome(SweepJob job, DispatchResult result, String errorCode, String errorMessage) {
        this.job = job;
        this.result = result;
        this.errorCode = errorCode;
        this.errorMessage = errorMessage;
    }

    public static SweepOutcome success(SweepJob job, DispatchResult result) {
        return new SweepOutcome(job, result, null, null);
    }

    public static SweepOutcome failure(SweepJob job, String errorCode, String errorMessage) {
        return new SweepOutcome(job, null, errorCode, errorMessage);
    }

    public SweepJob getJob() { return job; }
    public String getLabel() { return job.getLabel(); }
    public DispatchResult getResult() { return result; }
    public String getErrorCode() { return errorCode; }
    public String getErrorMessage() { return errorMessage; }

    public boolean isSuccess() {
        return result != null;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? String.format("SweepOutcome{label='%s', %s}", getLabel(), result)
                : String.format("SweepOutcome{label='%s', error=%s: %s}", getLabel(), errorCode, errorMessage);
    }
}
