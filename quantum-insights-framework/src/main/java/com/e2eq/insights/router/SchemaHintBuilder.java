package com.e2eq.insights.router;

import com.e2eq.insights.api.engine.MetadataCatalog;
import com.e2eq.insights.model.analytics.DatasetDescriptor;
import com.e2eq.insights.model.analytics.TableDescriptor;
import com.e2eq.insights.model.security.AccessContext;
import com.e2eq.insights.util.ExceptionLoggingUtils;
import com.e2eq.insights.util.IdentifierUtils;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Describes the caller's tables for SQL generation, tables named in the question first.
 * Best effort: a catalog failure yields no hints.
 */
@ApplicationScoped
public class SchemaHintBuilder {

    @Inject
    MetadataCatalog metadataCatalog;

    @ConfigProperty(name = "quantum.insights.router.schema-hint-limit", defaultValue = "10")
    int limit = 10;

    public List<String> hintsFor(AccessContext context, String question) {
        List<DatasetDescriptor> datasets;
        try {
            datasets = metadataCatalog.listDatasets(context);
        } catch (RuntimeException e) {
            ExceptionLoggingUtils.logWarn(e, "Schema lookup failed for user %s; generating without hints",
                context.getUserId());
            return List.of();
        }
        Set<String> words = keywords(question);
        List<ScoredTable> candidates = new ArrayList<>();
        for (DatasetDescriptor dataset : datasets) {
            for (TableDescriptor table : dataset.getTables()) {
                if (!context.canAccessTable(dataset.getDatasetId(), table.getTableId())) {
                    continue;
                }
                candidates.add(new ScoredTable(dataset.getDatasetId(), table, score(words, table)));
            }
        }
        candidates.sort(Comparator.comparingInt((ScoredTable t) -> t.score).reversed());
        List<String> hints = new ArrayList<>();
        for (ScoredTable candidate : candidates) {
            if (hints.size() >= limit) {
                break;
            }
            hints.add(candidate.describe());
        }
        return hints;
    }

    /**
     * Lower-cased words of the question, plus their singular forms.
     */
    static Set<String> keywords(String question) {
        Set<String> words = new HashSet<>();
        if (question == null) {
            return words;
        }
        for (String word : question.toLowerCase(Locale.ROOT).split("[^a-z0-9_]+")) {
            if (word.length() < 3) {
                continue;
            }
            words.add(word);
            if (word.endsWith("s")) {
                words.add(word.substring(0, word.length() - 1));
            }
        }
        return words;
    }

    private static int score(Set<String> words, TableDescriptor table) {
        int score = 0;
        String tableId = IdentifierUtils.normalize(table.getTableId());
        if (tableId == null) {
            return 0;
        }
        for (String part : tableId.split("_")) {
            if (words.contains(part)) {
                score += 2;
            }
        }
        if (words.contains(tableId)) {
            score += 3;
        }
        for (String column : table.getColumns()) {
            if (column != null && words.contains(column.toLowerCase(Locale.ROOT))) {
                score++;
            }
        }
        return score;
    }

    private static final class ScoredTable {
        private final String datasetId;
        private final TableDescriptor table;
        private final int score;

        ScoredTable(String datasetId, TableDescriptor table, int score) {
            this.datasetId = datasetId;
            this.table = table;
            this.score = score;
        }

        String describe() {
            StringBuilder sb = new StringBuilder(datasetId).append('.').append(table.getTableId());
            if (!table.getColumns().isEmpty()) {
                sb.append(" (").append(String.join(", ", table.getColumns())).append(')');
            }
            if (table.getDescription() != null) {
                sb.append(": ").append(table.getDescription());
            }
            return sb.toString();
        }
    }
}
