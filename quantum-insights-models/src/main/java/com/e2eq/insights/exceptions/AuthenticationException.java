package com.e2eq.insights.exceptions;

import com.e2eq.insights.rest.models.ResponseStatus;

public class AuthenticationException extends InsightsException {
    private static final long serialVersionUID = 1L;

    public enum Reason {
        MISSING("Authentication token is missing"),
        MALFORMED("Invalid token"),
        EXPIRED("Token has expired"),
        SIGNATURE_MISMATCH("Invalid token"),
        MISSING_SUBJECT("Token missing user ID"),
        CONTEXT_EXPIRED("Access context has expired");

        private final String defaultMessage;

        Reason(String defaultMessage) {
            this.defaultMessage = defaultMessage;
        }

        public String getDefaultMessage() {
            return defaultMessage;
        }
    }

    private static final String NEXT_STEP = "Sign in again to obtain a fresh access token, then retry the request.";

    private final Reason reason;

    public AuthenticationException(Reason reason) {
        this(reason, reason.getDefaultMessage(), null);
    }

    public AuthenticationException(Reason reason, String message, Throwable cause) {
        super(message, NEXT_STEP, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    @Override
    public ResponseStatus getStatus() {
        return ResponseStatus.AUTHENTICATION_ERROR;
    }
}
