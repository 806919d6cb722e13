package com.e2eq.insights.rest.models;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@RegisterForReflection
public class AskRequest {

    private String question;

    /** Optional; groups turns so recent history is passed to SQL generation. */
    private String sessionId;
}
