package com.e2eq.insights.exceptions;

import com.e2eq.insights.rest.models.ResponseStatus;

public class QueryValidationException extends InsightsException {
    private static final long serialVersionUID = 1L;

    public QueryValidationException(String message) {
        super(message, "Rephrase the question as a read-only request for data and try again.");
    }

    public QueryValidationException(String message, String nextStep) {
        super(message, nextStep);
    }

    @Override
    public ResponseStatus getStatus() {
        return ResponseStatus.VALIDATION_ERROR;
    }
}
