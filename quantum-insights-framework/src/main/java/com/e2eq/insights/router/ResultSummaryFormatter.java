package com.e2eq.insights.router;

import com.e2eq.insights.model.analytics.QueryResult;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Deterministic summaries used for empty results and whenever the generated summary is unavailable.
 */
@ApplicationScoped
public class ResultSummaryFormatter {

    static final String EMPTY_RESULT = "The query succeeded and returned 0 rows. No data matches the question's criteria, or the tables are empty.";

    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}([T ].*)?$");

    public String summarize(QueryResult result) {
        if (result == null || result.isEmpty()) {
            return EMPTY_RESULT;
        }
        long rows = Math.max(result.getTotalRows(), result.getRows().size());
        return rows == 1
            ? "The query returned 1 row. Review the data below for details."
            : "The query returned " + rows + " rows. Review the data below for details.";
    }

    /**
     * Chart suggestions from the column types of the first row: always a table, then a line chart
     * for time and numeric columns, a bar chart for category and numeric columns, or a single metric.
     */
    public List<String> fallbackCharts(QueryResult result) {
        List<String> suggestions = new ArrayList<>();
        if (result == null || result.isEmpty()) {
            return suggestions;
        }
        suggestions.add("table: Data Table");
        Map<String, Object> first = result.getRows().isEmpty() ? Map.of() : result.getRows().get(0);
        List<String> numeric = new ArrayList<>();
        List<String> categorical = new ArrayList<>();
        List<String> temporal = new ArrayList<>();
        for (String column : result.getColumns()) {
            Object value = first.get(column);
            if (value instanceof Number) {
                numeric.add(column);
            } else if (value instanceof TemporalAccessor || value instanceof Date
                || (value instanceof String && ISO_DATE.matcher((String) value).matches())) {
                temporal.add(column);
            } else if (value instanceof String) {
                categorical.add(column);
            }
        }
        if (!temporal.isEmpty() && !numeric.isEmpty()) {
            suggestions.add("line: " + numeric.get(0) + " over time (" + temporal.get(0) + ")");
        } else if (!categorical.isEmpty() && !numeric.isEmpty()) {
            suggestions.add("bar: " + numeric.get(0) + " by " + categorical.get(0));
        } else if (!numeric.isEmpty()) {
            suggestions.add("metric: " + numeric.get(0));
        }
        return suggestions;
    }
}
