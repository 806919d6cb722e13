package com.e2eq.insights.sql;

import com.e2eq.insights.exceptions.QueryValidationException;
import com.e2eq.insights.sql.SqlLexer.Token;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Accepts only a single read-only statement. Markdown fences and trailing semicolons left by the
 * generator are removed first; keywords inside string literals and comments are not inspected.
 */
@ApplicationScoped
public class SyntaxGuard {

    static final String NEXT_STEP = "Rephrase the question as a request to read data.";

    private static final Set<String> MUTATING = Set.of(
        "INSERT", "UPDATE", "DELETE", "CREATE", "DROP", "ALTER", "TRUNCATE", "MERGE", "GRANT", "REVOKE",
        "CALL", "EXECUTE");

    private static final Pattern FENCE = Pattern.compile("^```[a-zA-Z]*\\s*|\\s*```$");

    /**
     * @return the cleaned statement, ready for reference extraction and execution
     * @throws QueryValidationException when the statement is empty, not a query or contains several statements
     */
    public String check(String sql) {
        String cleaned = clean(sql);
        if (cleaned.isEmpty()) {
            throw new QueryValidationException("The generated query is empty.", NEXT_STEP);
        }
        List<Token> tokens = SqlLexer.tokenize(cleaned);
        if (tokens.isEmpty()) {
            throw new QueryValidationException("The generated query contains only comments.", NEXT_STEP);
        }
        Token first = firstWord(tokens);
        if (first == null || !(first.isWord("SELECT") || first.isWord("WITH"))) {
            throw new QueryValidationException("Only read-only SELECT queries are allowed.", NEXT_STEP);
        }
        for (Token token : tokens) {
            if (token.isSymbol(';')) {
                throw new QueryValidationException("Multiple statements are not allowed.", NEXT_STEP);
            }
            if (token.type == SqlLexer.Type.WORD && MUTATING.contains(token.text.toUpperCase(Locale.ROOT))) {
                throw new QueryValidationException("Only read-only SELECT queries are allowed.", NEXT_STEP);
            }
        }
        return cleaned;
    }

    static String clean(String sql) {
        if (sql == null) {
            return "";
        }
        String cleaned = FENCE.matcher(sql.strip()).replaceAll("").strip();
        while (cleaned.endsWith(";")) {
            cleaned = StringUtils.removeEnd(cleaned, ";").strip();
        }
        return cleaned;
    }

    private static Token firstWord(List<Token> tokens) {
        for (Token token : tokens) {
            if (token.isSymbol('(')) {
                continue;
            }
            return token.type == SqlLexer.Type.WORD ? token : null;
        }
        return null;
    }
}
