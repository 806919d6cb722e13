package com.e2eq.insights.rest.exceptions;

import com.e2eq.insights.rest.models.ResponseStatus;
import com.e2eq.insights.rest.models.RestError;
import com.e2eq.insights.util.ExceptionLoggingUtils;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

@Provider
public class IllegalArgumentExceptionMapper implements ExceptionMapper<IllegalArgumentException> {

    @Override
    public Response toResponse(IllegalArgumentException exception) {
        ExceptionLoggingUtils.logDebug(exception, "Invalid request");

        RestError error = RestError.builder()
            .status(ResponseStatus.VALIDATION_ERROR.getHttpStatus())
            .reasonCode(ResponseStatus.VALIDATION_ERROR.getCode())
            .statusMessage("The request is invalid.")
            .reasonMessage(exception.getMessage())
            .nextStep("Check the request parameters and try again.")
            .build();

        return Response.status(error.getStatus()).entity(error).build();
    }
}
