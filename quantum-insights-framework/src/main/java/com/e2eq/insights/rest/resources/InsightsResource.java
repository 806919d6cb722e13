package com.e2eq.insights.rest.resources;

import com.e2eq.insights.cache.CacheGateway;
import com.e2eq.insights.cache.CacheStats;
import com.e2eq.insights.model.security.AccessContext;
import com.e2eq.insights.quota.QuotaCheck;
import com.e2eq.insights.quota.QuotaGuard;
import com.e2eq.insights.rest.models.AskRequest;
import com.e2eq.insights.rest.models.InsightResponse;
import com.e2eq.insights.rest.models.QuotaStatus;
import com.e2eq.insights.router.QueryRouter;
import com.e2eq.insights.security.AccessContextFactory;
import com.e2eq.insights.security.AccessEnforcer;
import com.e2eq.insights.security.Permissions;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.security.SecurityRequirement;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST surface under /api/v1/insights. Every endpoint authenticates from the bearer token itself;
 * {@code ask} always answers with the response contract, the other endpoints rely on the
 * exception mappers.
 */
@Path("/api/v1/insights")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class InsightsResource {

    @Inject
    QueryRouter queryRouter;

    @Inject
    AccessContextFactory accessContextFactory;

    @Inject
    AccessEnforcer accessEnforcer;

    @Inject
    QuotaGuard quotaGuard;

    @Inject
    CacheGateway cacheGateway;

    @POST
    @Path("ask")
    @Operation(summary = "Answer a natural-language question about the caller's data")
    @SecurityRequirement(name = "bearerAuth")
    public Response ask(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization, AskRequest request) {
        InsightResponse response = queryRouter.ask(authorization, request);
        return Response.status(response.getStatus().getHttpStatus()).entity(response).build();
    }

    @GET
    @Path("quota")
    @Operation(summary = "Current token consumption of the caller per period")
    @SecurityRequirement(name = "bearerAuth")
    public List<QuotaStatus> quota(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
        AccessContext context = accessContextFactory.fromAuthorization(authorization);
        return quotaGuard.usage(context.getUserId()).stream()
            .map(QuotaCheck::toStatus)
            .collect(Collectors.toList());
    }

    @GET
    @Path("cache/stats")
    @Operation(summary = "Statistics of the caller's own cache entries")
    @SecurityRequirement(name = "bearerAuth")
    public CacheStats cacheStats(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
        AccessContext context = accessContextFactory.fromAuthorization(authorization);
        return cacheGateway.stats(context.getUserId());
    }

    @DELETE
    @Path("cache")
    @Operation(summary = "Remove the caller's own cache entries")
    @SecurityRequirement(name = "bearerAuth")
    public Map<String, Long> clearCache(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
        AccessContext context = accessContextFactory.fromAuthorization(authorization);
        return Map.of("removed", cacheGateway.clear(context.getUserId()));
    }

    @DELETE
    @Path("cache/tables/{dataset}/{table}")
    @Operation(summary = "Invalidate every cached entry computed from a table")
    @SecurityRequirement(name = "bearerAuth")
    public Map<String, Long> invalidateTable(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                                             @PathParam("dataset") String dataset,
                                             @PathParam("table") String table) {
        AccessContext context = accessContextFactory.fromAuthorization(authorization);
        accessEnforcer.requirePermission(context, Permissions.CACHE_ADMIN);
        return Map.of("removed", cacheGateway.invalidateTable(dataset, table));
    }
}
