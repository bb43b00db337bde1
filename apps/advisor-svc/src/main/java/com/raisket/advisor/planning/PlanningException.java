package com.raisket.advisor.planning;

/**
 * Base type for failures that end a single planning request. None of them leave state behind.
 */
public abstract class PlanningException extends RuntimeException {

    private final PlanningErrorCode code;

    protected PlanningException(PlanningErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected PlanningException(PlanningErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public PlanningErrorCode code() {
        return code;
    }
}
