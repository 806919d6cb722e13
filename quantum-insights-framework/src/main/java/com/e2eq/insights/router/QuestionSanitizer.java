package com.e2eq.insights.router;

import com.e2eq.insights.exceptions.QueryValidationException;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Cleans a question before it is used for classification, caching or generation.
 */
@ApplicationScoped
public class QuestionSanitizer {

    static final int MAX_LENGTH = 2000;

    private static final Pattern CONTROL = Pattern.compile("[\\p{Cntrl}&&[^\\t\\n\\r]]");

    private static final List<Pattern> INJECTION = List.of(
        Pattern.compile("ignore\\s+(all\\s+)?previous\\s+instructions", Pattern.CASE_INSENSITIVE),
        Pattern.compile("disregard\\s+.*?\\s+above", Pattern.CASE_INSENSITIVE),
        Pattern.compile("you\\s+are\\s+now\\s+an?\\b", Pattern.CASE_INSENSITIVE),
        Pattern.compile("system\\s*:", Pattern.CASE_INSENSITIVE),
        Pattern.compile("<\\s*/?\\s*system\\s*>", Pattern.CASE_INSENSITIVE));

    /**
     * @throws QueryValidationException when nothing is left of the question
     */
    public String sanitize(String question) {
        if (question == null) {
            throw emptyQuestion();
        }
        String cleaned = CONTROL.matcher(question).replaceAll("");
        for (Pattern pattern : INJECTION) {
            String stripped = pattern.matcher(cleaned).replaceAll(" ");
            if (!stripped.equals(cleaned)) {
                Log.debugf("Removed prompt-injection phrase matching %s", pattern.pattern());
                cleaned = stripped;
            }
        }
        cleaned = StringUtils.normalizeSpace(cleaned);
        if (cleaned.length() > MAX_LENGTH) {
            cleaned = cleaned.substring(0, MAX_LENGTH).strip();
        }
        if (cleaned.isEmpty()) {
            throw emptyQuestion();
        }
        return cleaned;
    }

    private static QueryValidationException emptyQuestion() {
        return new QueryValidationException("The question is empty.", "Ask a question about your data.");
    }
}
