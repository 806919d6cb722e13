package com.e2eq.insights.exceptions;

import com.e2eq.insights.rest.models.ResponseStatus;

/**
 * Failure of an external collaborator (text generation, analytical engine, metadata catalog).
 * Client errors (4xx) are never retryable; server errors and timeouts are.
 * Messages carry the service name and status only, never configuration or credentials.
 */
public class UpstreamException extends InsightsException {
    private static final long serialVersionUID = 1L;

    public static final int TIMEOUT = -1;
    public static final int NOT_CONFIGURED = -2;

    private final String service;
    private final int statusCode;
    private final boolean retryable;

    public UpstreamException(String service, int statusCode, boolean retryable, String message, Throwable cause) {
        super(message, retryable
            ? "The service is temporarily unavailable. Please try again in a few moments."
            : "The request could not be completed by the " + service + " service. Try rephrasing the question.", cause);
        this.service = service;
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public static UpstreamException clientError(String service, int statusCode) {
        return new UpstreamException(service, statusCode, false,
            String.format("The %s service rejected the request (status %d).", service, statusCode), null);
    }

    public static UpstreamException serverError(String service, int statusCode) {
        return new UpstreamException(service, statusCode, true,
            String.format("The %s service failed (status %d).", service, statusCode), null);
    }

    public static UpstreamException timeout(String service, Throwable cause) {
        return new UpstreamException(service, TIMEOUT, true,
            String.format("The %s service did not respond in time.", service), cause);
    }

    public static UpstreamException notConfigured(String service) {
        return new UpstreamException(service, NOT_CONFIGURED, false,
            String.format("The %s service is not configured.", service), null);
    }

    public String getService() {
        return service;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    @Override
    public ResponseStatus getStatus() {
        return ResponseStatus.UPSTREAM_ERROR;
    }
}
