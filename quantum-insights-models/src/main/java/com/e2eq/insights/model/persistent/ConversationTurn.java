package com.e2eq.insights.model.persistent;

import com.e2eq.insights.rest.models.ResponseStatus;
import dev.morphia.annotations.Entity;
import dev.morphia.annotations.Id;
import dev.morphia.annotations.Indexed;
import io.quarkus.runtime.annotations.RegisterForReflection;
import org.bson.types.ObjectId;

import java.time.Instant;

/**
 * One question and its outcome. Appended for every routed request that got past authentication,
 * including failures, with the furthest pipeline state reached.
 */
@RegisterForReflection
@Entity(value = "insightConversationTurns", useDiscriminator = false)
public class ConversationTurn {

    @Id
    private ObjectId id;

    @Indexed
    private String userId;

    /** Client supplied session; groups turns for history context. */
    @Indexed
    private String sessionId;

    private String question;

    private String generatedSql;

    private ResponseStatus outcome;

    private String message;

    /** ALLOW, DENY_* or NOT_EVALUATED. */
    private String permissionDecision;

    /** Last router state reached before the outcome was decided. */
    private String furthestState;

    private String summary;

    private Long rowCount;

    private long tokensUsed;

    private boolean cached;

    private long durationMs;

    private Instant createdAt;

    public ObjectId getId() {
        return id;
    }

    public void setId(ObjectId id) {
        this.id = id;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    public String getQuestion() {
        return question;
    }

    public void setQuestion(String question) {
        this.question = question;
    }

    public String getGeneratedSql() {
        return generatedSql;
    }

    public void setGeneratedSql(String generatedSql) {
        this.generatedSql = generatedSql;
    }

    public ResponseStatus getOutcome() {
        return outcome;
    }

    public void setOutcome(ResponseStatus outcome) {
        this.outcome = outcome;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getPermissionDecision() {
        return permissionDecision;
    }

    public void setPermissionDecision(String permissionDecision) {
        this.permissionDecision = permissionDecision;
    }

    public String getFurthestState() {
        return furthestState;
    }

    public void setFurthestState(String furthestState) {
        this.furthestState = furthestState;
    }

    public String getSummary() {
        return summary;
    }

    public void setSummary(String summary) {
        this.summary = summary;
    }

    public Long getRowCount() {
        return rowCount;
    }

    public void setRowCount(Long rowCount) {
        this.rowCount = rowCount;
    }

    public long getTokensUsed() {
        return tokensUsed;
    }

    public void setTokensUsed(long tokensUsed) {
        this.tokensUsed = tokensUsed;
    }

    public boolean isCached() {
        return cached;
    }

    public void setCached(boolean cached) {
        this.cached = cached;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public void setDurationMs(long durationMs) {
        this.durationMs = durationMs;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
