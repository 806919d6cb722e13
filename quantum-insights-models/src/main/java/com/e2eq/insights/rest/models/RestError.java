package com.e2eq.insights.rest.models;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * Error body for failures raised outside the routed question flow. The reason code is the
 * {@link ResponseStatus} code, so clients handle both paths alike.
 */
@Data
@EqualsAndHashCode
@SuperBuilder
@NoArgsConstructor
@RegisterForReflection
public class RestError {
   protected int status;
   protected String reasonCode;
   protected String statusMessage;
   protected String reasonMessage;
   protected String nextStep;

   public static RestError of(ResponseStatus responseStatus, String message, String nextStep) {
      return RestError.builder()
         .status(responseStatus.getHttpStatus())
         .reasonCode(responseStatus.getCode())
         .statusMessage(message)
         .reasonMessage(message)
         .nextStep(nextStep)
         .build();
   }
}
