package com.e2eq.insights.rest.exceptions;

import com.e2eq.insights.exceptions.InsightsException;
import com.e2eq.insights.rest.models.RestError;
import com.e2eq.insights.util.ExceptionLoggingUtils;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

/**
 * Maps {@link InsightsException} raised by the non-routed endpoints to the HTTP status of its
 * response status, with the same code and next step the router would return.
 */
@Provider
public class InsightsExceptionMapper implements ExceptionMapper<InsightsException> {

    @Override
    public Response toResponse(InsightsException exception) {
        ExceptionLoggingUtils.logDebug(exception, "Request failed with %s", exception.getStatus().getCode());

        RestError error = RestError.of(exception.getStatus(), exception.getMessage(), exception.getNextStep());

        return Response.status(error.getStatus()).entity(error).build();
    }
}
