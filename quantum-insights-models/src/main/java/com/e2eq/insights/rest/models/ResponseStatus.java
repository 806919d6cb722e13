package com.e2eq.insights.rest.models;

import com.fasterxml.jackson.annotation.JsonValue;
import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Outcome of one insights request. Every non-success status carries a message and a next step.
 */
@RegisterForReflection
public enum ResponseStatus {

    SUCCESS("success", 200),
    AUTHENTICATION_ERROR("authentication_error", 401),
    AUTHORIZATION_ERROR("authorization_error", 403),
    VALIDATION_ERROR("validation_error", 422),
    UPSTREAM_ERROR("upstream_error", 502),
    QUOTA_EXCEEDED("quota_exceeded", 429);

    private final String code;
    private final int httpStatus;

    ResponseStatus(String code, int httpStatus) {
        this.code = code;
        this.httpStatus = httpStatus;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public boolean isError() {
        return this != SUCCESS;
    }
}
