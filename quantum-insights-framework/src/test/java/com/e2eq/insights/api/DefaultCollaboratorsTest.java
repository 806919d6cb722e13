package com.e2eq.insights.api;

import com.e2eq.insights.api.engine.EmptyMetadataCatalog;
import com.e2eq.insights.api.engine.UnconfiguredAnalyticalEngine;
import com.e2eq.insights.api.llm.SqlGenerationRequest;
import com.e2eq.insights.api.llm.StubTextGenerationClient;
import com.e2eq.insights.exceptions.QueryValidationException;
import com.e2eq.insights.exceptions.UpstreamException;
import com.e2eq.insights.sql.SyntaxGuard;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Default collaborator beans")
class DefaultCollaboratorsTest {

    @Test
    @DisplayName("unconfigured text generation is a non-retryable upstream error")
    void stubTextGeneration() {
        UpstreamException e = assertThrows(UpstreamException.class,
            () -> new StubTextGenerationClient().generateSql(SqlGenerationRequest.builder().question("q").build()));

        assertFalse(e.isRetryable());
        assertEquals(UpstreamException.NOT_CONFIGURED, e.getStatusCode());
        assertEquals("text-generation", e.getService());
    }

    @Test
    @DisplayName("unconfigured engine still rejects mutating statements first")
    void unconfiguredEngine() {
        UnconfiguredAnalyticalEngine engine = new UnconfiguredAnalyticalEngine(new SyntaxGuard());

        assertThrows(QueryValidationException.class, () -> engine.execute("DROP TABLE sales.orders", 1_000L));
        UpstreamException e = assertThrows(UpstreamException.class,
            () -> engine.execute("SELECT 1 FROM sales.orders", 1_000L));
        assertEquals("analytical-engine", e.getService());
    }

    @Test
    @DisplayName("empty catalog lists nothing")
    void emptyCatalog() {
        assertTrue(new EmptyMetadataCatalog().listDatasets(null).isEmpty());
    }
}
