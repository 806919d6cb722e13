package com.e2eq.insights.router;

import com.e2eq.insights.api.engine.AnalyticalEngineClient;
import com.e2eq.insights.api.engine.MetadataCatalog;
import com.e2eq.insights.api.llm.PriorTurn;
import com.e2eq.insights.api.llm.ResultNarrative;
import com.e2eq.insights.api.llm.SqlCandidate;
import com.e2eq.insights.api.llm.SqlGenerationRequest;
import com.e2eq.insights.api.llm.SummaryRequest;
import com.e2eq.insights.api.llm.TextGenerationClient;
import com.e2eq.insights.cache.CacheGateway;
import com.e2eq.insights.exceptions.AuthenticationException;
import com.e2eq.insights.exceptions.AuthorizationException;
import com.e2eq.insights.exceptions.InsightsException;
import com.e2eq.insights.exceptions.QuotaExceededException;
import com.e2eq.insights.model.analytics.DatasetDescriptor;
import com.e2eq.insights.model.analytics.QueryResult;
import com.e2eq.insights.model.analytics.TableDescriptor;
import com.e2eq.insights.model.persistent.CacheKind;
import com.e2eq.insights.model.persistent.ConversationTurn;
import com.e2eq.insights.model.persistent.store.ConversationStore;
import com.e2eq.insights.model.security.AccessContext;
import com.e2eq.insights.model.security.TableReference;
import com.e2eq.insights.quota.QuotaGuard;
import com.e2eq.insights.quota.TokenEstimator;
import com.e2eq.insights.rest.models.AskRequest;
import com.e2eq.insights.rest.models.InsightResponse;
import com.e2eq.insights.rest.models.QuotaStatus;
import com.e2eq.insights.rest.models.ResponseStatus;
import com.e2eq.insights.security.AccessContextFactory;
import com.e2eq.insights.security.AccessEnforcer;
import com.e2eq.insights.security.Permissions;
import com.e2eq.insights.sql.ReferenceExtractor;
import com.e2eq.insights.sql.SyntaxGuard;
import com.e2eq.insights.util.ExceptionLoggingUtils;
import com.e2eq.insights.util.IdentifierUtils;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Answers one natural-language question for an authenticated caller.
 * <p>
 * Metadata questions are answered from the catalog, filtered by the caller's access context.
 * Data questions require {@link Permissions#QUERY_EXECUTE}, pass the quota check, have SQL generated,
 * syntax-checked and access-checked, and only then reach the analytical engine. Every outcome is
 * mapped to an {@link InsightResponse}; nothing is thrown to the caller. Each turn that got past
 * authentication is persisted with the furthest state reached.
 */
@ApplicationScoped
public class QueryRouter {

    static final String UNEXPECTED_MESSAGE = "The question could not be answered because of an internal error.";
    static final String UNEXPECTED_NEXT_STEP = "Try again later. If the problem persists, contact support.";
    static final String NOT_EVALUATED = "NOT_EVALUATED";

    @Inject
    AccessContextFactory accessContextFactory;

    @Inject
    AccessEnforcer accessEnforcer;

    @Inject
    QuestionSanitizer questionSanitizer;

    @Inject
    QuestionClassifier questionClassifier;

    @Inject
    SchemaHintBuilder schemaHintBuilder;

    @Inject
    MetadataCatalog metadataCatalog;

    @Inject
    TextGenerationClient textGenerationClient;

    @Inject
    SyntaxGuard syntaxGuard;

    @Inject
    ReferenceExtractor referenceExtractor;

    @Inject
    AnalyticalEngineClient analyticalEngineClient;

    @Inject
    CacheGateway cacheGateway;

    @Inject
    QuotaGuard quotaGuard;

    @Inject
    TokenEstimator tokenEstimator;

    @Inject
    ResultSummaryFormatter resultSummaryFormatter;

    @Inject
    ConversationStore conversationStore;

    @Inject
    RetryPolicy retryPolicy;

    @Inject
    Clock clock;

    @ConfigProperty(name = "quantum.insights.cache.enabled", defaultValue = "true")
    boolean cacheEnabled = true;

    @ConfigProperty(name = "quantum.insights.cache.query-ttl", defaultValue = "PT24H")
    Duration queryTtl = Duration.ofHours(24);

    @ConfigProperty(name = "quantum.insights.cache.response-ttl", defaultValue = "PT1H")
    Duration responseTtl = Duration.ofHours(1);

    @ConfigProperty(name = "quantum.insights.engine.max-bytes-billed", defaultValue = "314572800")
    long maxBytesBilled = 314_572_800L;

    @ConfigProperty(name = "quantum.insights.router.history-turns", defaultValue = "5")
    int historyTurns = 5;

    @ConfigProperty(name = "quantum.insights.sql.default-project")
    Optional<String> defaultProject = Optional.empty();

    public InsightResponse ask(String authorization, AskRequest request) {
        RouteRun run = new RouteRun(clock.millis(), request == null ? null : request.getSessionId());
        RouteTrace trace = new RouteTrace();
        try {
            run.context = accessContextFactory.fromAuthorization(authorization);
            run.question = questionSanitizer.sanitize(request == null ? null : request.getQuestion());
            QuestionKind kind = questionClassifier.classify(run.question);
            trace.advance(RouterState.CLASSIFIED);

            InsightResponse response = kind == QuestionKind.METADATA
                ? answerMetadata(run, trace)
                : answerData(run, trace);

            trace.advance(RouterState.PERSISTED);
            persist(run, trace, ResponseStatus.SUCCESS, response.getMessage(), response);
            trace.advance(RouterState.TERMINAL_SUCCESS);
            return response;
        } catch (InsightsException e) {
            QuotaStatus quota = null;
            if (e instanceof QuotaExceededException) {
                QuotaExceededException q = (QuotaExceededException) e;
                quota = new QuotaStatus(q.getPeriod().getLabel(), q.getLimit(), q.getConsumed(), q.getRemaining(),
                    q.getResetsAt());
            }
            if (e instanceof AuthenticationException) {
                Log.infof("Rejected request: %s", e.getMessage());
            }
            return failed(run, trace, e.getStatus(), e.getMessage(), e.getNextStep(), quota);
        } catch (RuntimeException e) {
            ExceptionLoggingUtils.logError(e, "Unexpected failure answering question for user %s", run.userId());
            return failed(run, trace, ResponseStatus.UPSTREAM_ERROR, UNEXPECTED_MESSAGE, UNEXPECTED_NEXT_STEP, null);
        }
    }

    private InsightResponse answerMetadata(RouteRun run, RouteTrace trace) {
        AccessContext context = run.context;
        List<DatasetDescriptor> visible = visibleDatasets(context);
        Optional<String> named = questionClassifier.targetDataset(run.question);
        Optional<String> target = named.isPresent() ? named : questionClassifier.mentionedName(run.question);
        Optional<DatasetDescriptor> dataset = target.flatMap(name -> visible.stream()
            .filter(d -> IdentifierUtils.sameIdentifier(d.getDatasetId(), name))
            .findFirst());
        Optional<TableDescriptor> table = target.flatMap(name -> visible.stream()
            .flatMap(d -> d.getTables().stream())
            .filter(t -> IdentifierUtils.sameIdentifier(t.getTableId(), name))
            .findFirst());
        Object metadata;
        String message;
        if (dataset.isPresent()) {
            metadata = dataset.get();
            message = String.format("Dataset %s has %d tables you can query.",
                dataset.get().getDatasetId(), dataset.get().getTables().size());
        } else if (table.isPresent()) {
            metadata = table.get();
            message = String.format("Table %s has %d columns.", table.get().getTableId(), table.get().getColumns().size());
        } else if (named.isPresent()) {
            run.permissionDecision = "DENY_RESOURCE";
            Log.infof("Denied user %s: metadata request for an unauthorized or unknown dataset", context.getUserId());
            throw AuthorizationException.resourceDenied(context.authorizedResources());
        } else {
            // no name, or a loose mention that matches nothing the caller can see
            metadata = visible;
            message = String.format("You have access to %d datasets.", visible.size());
        }
        run.permissionDecision = "ALLOW";
        trace.advance(RouterState.METADATA_HANDLED);
        return InsightResponse.builder()
            .status(ResponseStatus.SUCCESS)
            .message(message)
            .questionType(QuestionKind.METADATA.name())
            .metadata(metadata)
            .tokensUsed(0L)
            .build();
    }

    /**
     * Catalog entries re-filtered against the context; tables the caller cannot read are dropped.
     */
    private List<DatasetDescriptor> visibleDatasets(AccessContext context) {
        List<DatasetDescriptor> visible = new ArrayList<>();
        for (DatasetDescriptor dataset : metadataCatalog.listDatasets(context)) {
            if (!context.canAccessDataset(dataset.getDatasetId())) {
                continue;
            }
            List<TableDescriptor> tables = dataset.getTables().stream()
                .filter(t -> context.canAccessTable(dataset.getDatasetId(), t.getTableId()))
                .collect(Collectors.toList());
            visible.add(new DatasetDescriptor(dataset.getDatasetId(), dataset.getDescription(), tables));
        }
        return visible;
    }

    private InsightResponse answerData(RouteRun run, RouteTrace trace) {
        AccessContext context = run.context;
        checkAccess(run, List.of());

        String responseKey = cacheGateway.keyFor(CacheKind.RESPONSE, run.question);
        Optional<InsightResponse> cachedResponse = readCache(context, responseKey, InsightResponse.class);
        if (cachedResponse.isPresent() && StringUtils.isNotBlank(cachedResponse.get().getSql())) {
            return replayCachedResponse(run, trace, cachedResponse.get());
        }

        quotaGuard.enforce(context.getUserId(), tokenEstimator.estimate(run.question));

        SqlGenerationRequest generationRequest = SqlGenerationRequest.builder()
            .question(run.question)
            .userId(context.getUserId())
            .authorizedResources(context.authorizedResources())
            .schemaHints(schemaHintBuilder.hintsFor(context, run.question))
            .history(history(context.getUserId(), run.sessionId))
            .defaultProject(defaultProject.orElse(null))
            .build();
        SqlCandidate candidate = retryPolicy.execute("SQL generation",
            () -> textGenerationClient.generateSql(generationRequest));
        run.sql = candidate.getSql();
        run.tokensUsed += candidate.getTokensUsed() > 0
            ? candidate.getTokensUsed()
            : tokenEstimator.estimate(run.question, candidate.getSql());
        trace.advance(RouterState.SQL_GENERATED);

        String sql = syntaxGuard.check(candidate.getSql());
        run.sql = sql;
        trace.advance(RouterState.SYNTAX_CHECKED);

        List<TableReference> references = referenceExtractor.extract(sql);
        checkAccess(run, references);
        trace.advance(RouterState.ACCESS_CHECKED);

        List<String> tables = references.stream()
            .filter(TableReference::hasDataset)
            .map(TableReference::datasetQualifiedName)
            .collect(Collectors.toList());
        String resultKey = cacheGateway.keyFor(CacheKind.QUERY_RESULT, sql);
        Optional<QueryResult> cachedResult = readCache(context, resultKey, QueryResult.class);
        QueryResult result;
        if (cachedResult.isPresent()) {
            result = cachedResult.get();
            result.setCacheHit(true);
        } else {
            result = retryPolicy.execute("Query execution", () -> analyticalEngineClient.execute(sql, maxBytesBilled));
            writeCache(context, resultKey, CacheKind.QUERY_RESULT, result, queryTtl, tables);
        }
        trace.advance(RouterState.EXECUTED);

        String summary;
        List<String> charts;
        if (result.isEmpty()) {
            summary = resultSummaryFormatter.summarize(result);
            charts = List.of();
        } else {
            ResultNarrative narrative = narrate(run, sql, result);
            summary = narrative != null && StringUtils.isNotBlank(narrative.getSummary())
                ? narrative.getSummary()
                : resultSummaryFormatter.summarize(result);
            charts = narrative != null && !narrative.getChartSuggestions().isEmpty()
                ? narrative.getChartSuggestions()
                : resultSummaryFormatter.fallbackCharts(result);
        }
        trace.advance(RouterState.SUMMARIZED);

        InsightResponse response = InsightResponse.builder()
            .status(ResponseStatus.SUCCESS)
            .message(summary)
            .questionType(QuestionKind.DATA.name())
            .sql(sql)
            .columns(result.getColumns())
            .rows(result.getRows())
            .rowCount(Math.max(result.getTotalRows(), result.getRows().size()))
            .summary(summary)
            .chartSuggestions(charts)
            .cached(result.isCacheHit())
            .tokensUsed(run.tokensUsed)
            .build();
        writeCache(context, responseKey, CacheKind.RESPONSE, response, responseTtl, tables);
        return response;
    }

    /**
     * A cached answer is served only after its SQL passes the same checks against the current
     * context, so revoked access takes effect immediately.
     */
    private InsightResponse replayCachedResponse(RouteRun run, RouteTrace trace, InsightResponse cached) {
        run.sql = cached.getSql();
        trace.advance(RouterState.SQL_GENERATED);
        String sql = syntaxGuard.check(cached.getSql());
        trace.advance(RouterState.SYNTAX_CHECKED);
        checkAccess(run, referenceExtractor.extract(sql));
        trace.advance(RouterState.ACCESS_CHECKED);
        trace.advance(RouterState.EXECUTED);
        trace.advance(RouterState.SUMMARIZED);
        run.cached = true;
        cached.setCached(true);
        cached.setTokensUsed(0L);
        Log.debugf("Served cached response for user %s", run.userId());
        return cached;
    }

    private ResultNarrative narrate(RouteRun run, String sql, QueryResult result) {
        try {
            ResultNarrative narrative = retryPolicy.execute("Result summary", () -> textGenerationClient.summarize(
                SummaryRequest.builder().question(run.question).sql(sql).result(result).build()));
            if (narrative != null) {
                run.tokensUsed += narrative.getTokensUsed();
            }
            return narrative;
        } catch (RuntimeException e) {
            ExceptionLoggingUtils.logWarn(e, "Summary generation failed for user %s; using local summary", run.userId());
            return null;
        }
    }

    private void checkAccess(RouteRun run, List<TableReference> references) {
        try {
            accessEnforcer.enforce(run.context, Permissions.QUERY_EXECUTE, references);
            run.permissionDecision = "ALLOW";
        } catch (AuthenticationException e) {
            run.permissionDecision = "DENY_EXPIRED";
            throw e;
        } catch (AuthorizationException e) {
            run.permissionDecision = e.getRequiredPermission() != null ? "DENY_PERMISSION" : "DENY_RESOURCE";
            throw e;
        }
    }

    private List<PriorTurn> history(String userId, String sessionId) {
        if (StringUtils.isBlank(sessionId) || historyTurns <= 0) {
            return List.of();
        }
        try {
            return conversationStore.findRecent(userId, sessionId, historyTurns).stream()
                .map(turn -> new PriorTurn(turn.getQuestion(), turn.getGeneratedSql()))
                .collect(Collectors.toList());
        } catch (RuntimeException e) {
            ExceptionLoggingUtils.logWarn(e, "Could not load conversation history for user %s", userId);
            return List.of();
        }
    }

    private <T> Optional<T> readCache(AccessContext context, String key, Class<T> type) {
        if (!cacheEnabled) {
            return Optional.empty();
        }
        try {
            return cacheGateway.read(context.getUserId(), key, type);
        } catch (RuntimeException e) {
            ExceptionLoggingUtils.logWarn(e, "Cache read failed for user %s", context.getUserId());
            return Optional.empty();
        }
    }

    private void writeCache(AccessContext context, String key, CacheKind kind, Object payload, Duration ttl,
                            List<String> tables) {
        if (!cacheEnabled) {
            return;
        }
        try {
            cacheGateway.write(context.getUserId(), key, kind, payload, ttl, tables);
        } catch (RuntimeException e) {
            ExceptionLoggingUtils.logWarn(e, "Cache write failed for user %s", context.getUserId());
        }
    }

    private InsightResponse failed(RouteRun run, RouteTrace trace, ResponseStatus status, String message,
                                   String nextStep, QuotaStatus quota) {
        trace.fail();
        persist(run, trace, status, message, null);
        trace.advance(RouterState.TERMINAL_ERROR);
        return InsightResponse.builder()
            .status(status)
            .message(message)
            .nextStep(nextStep)
            .quota(quota)
            .tokensUsed(run.tokensUsed)
            .build();
    }

    /**
     * Records consumed tokens and appends the turn. Requests without an identity are not persisted.
     * Failures are logged; they never change the response.
     */
    private void persist(RouteRun run, RouteTrace trace, ResponseStatus outcome, String message,
                         InsightResponse response) {
        if (run.context == null) {
            return;
        }
        quotaGuard.record(run.context.getUserId(), run.tokensUsed);

        ConversationTurn turn = new ConversationTurn();
        turn.setUserId(run.context.getUserId());
        turn.setSessionId(run.sessionId);
        turn.setQuestion(run.question);
        turn.setGeneratedSql(run.sql);
        turn.setOutcome(outcome);
        turn.setMessage(message);
        turn.setPermissionDecision(run.permissionDecision);
        turn.setFurthestState(trace.getFurthest().name());
        turn.setTokensUsed(run.tokensUsed);
        turn.setCached(run.cached);
        turn.setCreatedAt(clock.instant());
        turn.setDurationMs(clock.millis() - run.startedAt);
        if (response != null) {
            turn.setSummary(response.getSummary());
            turn.setRowCount(response.getRowCount());
        }
        try {
            conversationStore.save(turn);
        } catch (RuntimeException e) {
            ExceptionLoggingUtils.logError(e, "Failed to persist conversation turn for user %s", run.context.getUserId());
        }
    }

    /**
     * Mutable state of one request while it moves through the pipeline.
     */
    private static final class RouteRun {
        private final long startedAt;
        private final String sessionId;
        private AccessContext context;
        private String question;
        private String sql;
        private String permissionDecision = NOT_EVALUATED;
        private long tokensUsed;
        private boolean cached;

        RouteRun(long startedAt, String sessionId) {
            this.startedAt = startedAt;
            this.sessionId = StringUtils.trimToNull(sessionId);
        }

        String userId() {
            return context == null ? null : context.getUserId();
        }
    }
}
