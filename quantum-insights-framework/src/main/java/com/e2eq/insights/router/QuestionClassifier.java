package com.e2eq.insights.router;

import com.e2eq.insights.util.IdentifierUtils;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Routes questions by curated phrase sets. A question that matches a metadata phrase and no data
 * indicator is METADATA; everything else, including ambiguous questions, is DATA.
 */
@ApplicationScoped
public class QuestionClassifier {

    private static final List<String> METADATA_PHRASES = List.of(
        "what datasets", "which datasets", "list datasets", "show datasets", "available datasets",
        "what tables", "which tables", "list tables", "list all tables", "show tables", "show me the tables",
        "tables are in", "tables in dataset", "tables do i have", "datasets do i have",
        "what columns", "which columns", "list columns", "show columns", "describe table", "schema of",
        "what data do i have access to", "what can i query");

    private static final List<String> DATA_INDICATORS = List.of(
        "how many", "count of", "number of", "total", "sum of", "average", "avg", "top ", "trend", "compare",
        "per ", "by month", "by day", "by week", "by year", "last month", "last week", "growth",
        "maximum", "minimum", "highest", "lowest");

    private static final Pattern NAME_AFTER_DATASET = Pattern.compile(
        "\\bdataset\\s+[`\"']?([A-Za-z_][\\w-]*)", Pattern.CASE_INSENSITIVE);

    private static final Pattern NAME_BEFORE_DATASET = Pattern.compile(
        "\\b([A-Za-z_][\\w-]*)[`\"']?\\s+dataset\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern NAME_AFTER_PREPOSITION = Pattern.compile(
        "\\b(?:in|from|of)\\s+(?:the\\s+)?[`\"']?([A-Za-z_][\\w-]*)", Pattern.CASE_INSENSITIVE);

    public QuestionKind classify(String question) {
        String normalized = normalize(question);
        if (normalized.isEmpty()) {
            return QuestionKind.DATA;
        }
        boolean metadata = METADATA_PHRASES.stream().anyMatch(normalized::contains);
        if (!metadata) {
            return QuestionKind.DATA;
        }
        boolean data = DATA_INDICATORS.stream().anyMatch(normalized::contains);
        return data ? QuestionKind.DATA : QuestionKind.METADATA;
    }

    /**
     * Dataset named explicitly by a metadata question, e.g. {@code sales} in
     * "what tables are in the sales dataset".
     */
    public Optional<String> targetDataset(String question) {
        return firstName(question, NAME_AFTER_DATASET, NAME_BEFORE_DATASET);
    }

    /**
     * Word following in/from/of, e.g. {@code marketing} in "show tables in marketing". Only a hint:
     * it may name a dataset, a table or nothing at all ("from the warehouse").
     */
    public Optional<String> mentionedName(String question) {
        return firstName(question, NAME_AFTER_PREPOSITION);
    }

    private static Optional<String> firstName(String question, Pattern... patterns) {
        if (StringUtils.isBlank(question)) {
            return Optional.empty();
        }
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(question);
            while (matcher.find()) {
                String candidate = matcher.group(1);
                if (!isFiller(candidate)) {
                    return Optional.ofNullable(IdentifierUtils.normalize(candidate));
                }
            }
        }
        return Optional.empty();
    }

    static String normalize(String question) {
        return question == null ? "" : StringUtils.normalizeSpace(question).toLowerCase(Locale.ROOT);
    }

    private static boolean isFiller(String word) {
        switch (word.toLowerCase(Locale.ROOT)) {
            case "the":
            case "a":
            case "my":
            case "each":
            case "every":
            case "this":
            case "that":
            case "which":
            case "what":
            case "all":
            case "any":
            case "in":
            case "of":
            case "from":
            case "for":
            case "dataset":
            case "datasets":
            case "table":
            case "tables":
            case "column":
            case "columns":
                return true;
            default:
                return false;
        }
    }
}
