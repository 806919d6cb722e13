package com.e2eq.insights.exceptions;

import com.e2eq.insights.rest.models.ResponseStatus;

/**
 * Base of the failures that the question router turns into a response. Each subtype maps to
 * one {@link ResponseStatus} and tells the caller what to do next.
 */
public abstract class InsightsException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String nextStep;

    protected InsightsException(String message, String nextStep) {
        super(message);
        this.nextStep = nextStep;
    }

    protected InsightsException(String message, String nextStep, Throwable cause) {
        super(message, cause);
        this.nextStep = nextStep;
    }

    public abstract ResponseStatus getStatus();

    public String getNextStep() {
        return nextStep;
    }
}
