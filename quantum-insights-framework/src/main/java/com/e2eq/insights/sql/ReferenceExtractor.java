package com.e2eq.insights.sql;

import com.e2eq.insights.model.security.TableReference;
import com.e2eq.insights.sql.SqlLexer.Token;
import com.e2eq.insights.util.IdentifierUtils;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Finds the tables a SQL statement reads by scanning its FROM and JOIN clauses.
 * <p>
 * This is a lexical scan, not a parser. It follows comma and join lists (parenthesized joins
 * included), descends into subqueries, join conditions and table-function arguments, and ignores names declared as CTEs. It does not resolve
 * aliases beyond CTE names and cannot see table names built dynamically. References come back in
 * order of first appearance, without duplicates.
 */
@ApplicationScoped
public class ReferenceExtractor {

    private static final Set<String> NOT_AN_ALIAS = new HashSet<>(Arrays.asList(
        "FROM", "JOIN", "INNER", "LEFT", "RIGHT", "FULL", "OUTER", "CROSS", "NATURAL", "ON", "USING",
        "WHERE", "GROUP", "ORDER", "HAVING", "LIMIT", "OFFSET", "UNION", "EXCEPT", "INTERSECT", "WINDOW",
        "QUALIFY", "SELECT", "WITH", "AS", "FOR", "TABLESAMPLE", "PIVOT", "UNPIVOT", "LATERAL", "FETCH",
        "INTO", "SET", "VALUES", "AND", "OR", "NOT", "WHEN", "THEN", "ELSE", "END", "CASE", "IN", "IS", "BY"));

    /** Keywords that end a FROM clause. */
    private static final Set<String> CLAUSE_AFTER_FROM = Set.of(
        "WHERE", "GROUP", "ORDER", "HAVING", "LIMIT", "OFFSET", "QUALIFY", "WINDOW", "UNION", "EXCEPT",
        "INTERSECT", "FETCH");

    /** Functions whose arguments use FROM without naming a table. */
    private static final Set<String> FROM_IN_ARGUMENTS = Set.of("EXTRACT", "TRIM", "SUBSTRING", "SUBSTR", "OVERLAY");

    @ConfigProperty(name = "quantum.insights.sql.default-project")
    Optional<String> defaultProject = Optional.empty();

    @ConfigProperty(name = "quantum.insights.sql.default-dataset")
    Optional<String> defaultDataset = Optional.empty();

    @ConfigProperty(name = "quantum.insights.sql.unqualified-tables", defaultValue = "REJECT")
    UnqualifiedTablePolicy unqualifiedTablePolicy = UnqualifiedTablePolicy.REJECT;

    public List<TableReference> extract(String sql) {
        if (sql == null || sql.isBlank()) {
            return List.of();
        }
        List<Token> tokens = SqlLexer.tokenize(sql);
        Set<String> cteNames = collectCteNames(tokens);
        Set<TableReference> references = new LinkedHashSet<>();
        scan(tokens, 0, tokens.size(), references, cteNames);
        return new ArrayList<>(references);
    }

    private void scan(List<Token> tokens, int from, int to, Set<TableReference> out, Set<String> cteNames) {
        Deque<String> parenOwners = new ArrayDeque<>();
        int i = from;
        while (i < to) {
            Token t = tokens.get(i);
            if (t.isSymbol('(')) {
                Token previous = i > from ? tokens.get(i - 1) : null;
                parenOwners.push(previous != null && previous.type == SqlLexer.Type.WORD
                    ? previous.text.toUpperCase(Locale.ROOT) : "");
                i++;
            } else if (t.isSymbol(')')) {
                if (!parenOwners.isEmpty()) {
                    parenOwners.pop();
                }
                i++;
            } else if (t.isWord("FROM") && !isArgumentFrom(tokens, from, i, parenOwners)) {
                i = readTableList(tokens, i + 1, to, out, cteNames);
            } else if (t.isWord("JOIN")) {
                i = readTableList(tokens, i + 1, to, out, cteNames);
            } else {
                i++;
            }
        }
    }

    private static boolean isArgumentFrom(List<Token> tokens, int from, int index, Deque<String> parenOwners) {
        if (!parenOwners.isEmpty() && FROM_IN_ARGUMENTS.contains(parenOwners.peek())) {
            return true;
        }
        // a IS DISTINCT FROM b
        return index > from && tokens.get(index - 1).isWord("DISTINCT");
    }

    /**
     * Reads a FROM clause: table items separated by commas or joins, each optionally followed by a
     * join condition or other item suffix. Returns the index of the token that ends the clause.
     */
    private int readTableList(List<Token> tokens, int start, int to, Set<TableReference> out,
                              Set<String> cteNames) {
        int i = start;
        while (i < to) {
            i = readTableItem(tokens, i, to, out, cteNames);
            // ON/USING conditions and other suffixes may hold subqueries
            int tailEnd = endOfItemTail(tokens, i, to);
            if (tailEnd > i) {
                scan(tokens, i, tailEnd, out, cteNames);
            }
            i = tailEnd;
            if (i >= to) {
                return i;
            }
            if (tokens.get(i).isSymbol(',')) {
                i++;
            } else if (isJoinStart(tokens, i, to)) {
                while (i < to && !tokens.get(i).isWord("JOIN")) {
                    i++;
                }
                i = Math.min(i + 1, to);
            } else {
                return i;
            }
        }
        return i;
    }

    /**
     * Reads one table item with its alias and returns the index after it. A token that cannot
     * start an item is left in place.
     */
    private int readTableItem(List<Token> tokens, int start, int to, Set<TableReference> out,
                              Set<String> cteNames) {
        int i = start;
        while (i < to && (tokens.get(i).isWord("LATERAL") || tokens.get(i).isWord("ONLY"))) {
            i++;
        }
        if (i >= to) {
            return i;
        }
        Token t = tokens.get(i);
        if (t.isSymbol('(')) {
            int close = matchingParen(tokens, i, to);
            if (i + 1 < close && (tokens.get(i + 1).isWord("SELECT") || tokens.get(i + 1).isWord("WITH"))) {
                scan(tokens, i + 1, close, out, cteNames);
            } else {
                // parenthesized join: (a JOIN b ON ...)
                int rest = readTableList(tokens, i + 1, close, out, cteNames);
                if (rest < close) {
                    scan(tokens, rest, close, out, cteNames);
                }
            }
            i = close + 1;
        } else if (isNameToken(t)) {
            List<String> parts = new ArrayList<>();
            i = readName(tokens, i, to, parts);
            if (i < to && tokens.get(i).isSymbol('(')) {
                // table function such as UNNEST(...): only its arguments can reference tables
                int close = matchingParen(tokens, i, to);
                scan(tokens, i + 1, close, out, cteNames);
                i = close + 1;
            } else {
                addReference(parts, out, cteNames);
            }
        } else {
            return i;
        }
        return skipAlias(tokens, i, to);
    }

    /**
     * Index of the first top-level token after a table item that starts the next item, a new
     * clause, or closes the enclosing parenthesis.
     */
    private static int endOfItemTail(List<Token> tokens, int start, int to) {
        int depth = 0;
        for (int i = start; i < to; i++) {
            Token t = tokens.get(i);
            if (t.isSymbol('(')) {
                depth++;
            } else if (t.isSymbol(')')) {
                if (depth == 0) {
                    return i;
                }
                depth--;
            } else if (depth == 0 && (t.isSymbol(',') || t.isSymbol(';') || isJoinStart(tokens, i, to)
                || (t.type == SqlLexer.Type.WORD && CLAUSE_AFTER_FROM.contains(t.text.toUpperCase(Locale.ROOT))))) {
                return i;
            }
        }
        return to;
    }

    private static boolean isJoinStart(List<Token> tokens, int i, int to) {
        Token t = tokens.get(i);
        if (t.isWord("JOIN") || t.isWord("INNER") || t.isWord("CROSS") || t.isWord("NATURAL") || t.isWord("FULL")) {
            return true;
        }
        // LEFT(...) and RIGHT(...) are string functions
        return (t.isWord("LEFT") || t.isWord("RIGHT")) && !(i + 1 < to && tokens.get(i + 1).isSymbol('('));
    }

    private static boolean isNameToken(Token t) {
        return t.type == SqlLexer.Type.QUOTED
            || (t.type == SqlLexer.Type.WORD && !NOT_AN_ALIAS.contains(t.text.toUpperCase(Locale.ROOT)));
    }

    /**
     * Reads a dotted name into {@code parts}. Quoted segments may themselves contain dots.
     * Unquoted segments glue adjacent {@code -} and {@code *} so that {@code my-project} and
     * wildcard tables such as {@code events_*} stay whole.
     */
    private static int readName(List<Token> tokens, int start, int to, List<String> parts) {
        int i = start;
        while (true) {
            Token t = tokens.get(i);
            StringBuilder segment = new StringBuilder(t.text);
            Token last = t;
            i++;
            if (t.type != SqlLexer.Type.QUOTED) {
                while (i < to) {
                    Token next = tokens.get(i);
                    if ((next.isSymbol('-') || next.isSymbol('*')) && next.touches(last)) {
                        segment.append(next.text);
                        last = next;
                        i++;
                    } else if ((next.type == SqlLexer.Type.WORD || next.type == SqlLexer.Type.NUMBER)
                        && next.touches(last) && (last.isSymbol('-'))) {
                        segment.append(next.text);
                        last = next;
                        i++;
                    } else {
                        break;
                    }
                }
            }
            for (String piece : segment.toString().split("\\.")) {
                if (!piece.isBlank()) {
                    parts.add(piece);
                }
            }
            if (i + 1 < to && tokens.get(i).isSymbol('.')
                && (tokens.get(i + 1).isIdentifier() || tokens.get(i + 1).type == SqlLexer.Type.NUMBER)) {
                i++;
                continue;
            }
            return i;
        }
    }

    private static int skipAlias(List<Token> tokens, int i, int to) {
        if (i < to && tokens.get(i).isWord("AS")) {
            i++;
            if (i < to && tokens.get(i).isIdentifier()) {
                i++;
            }
            return i;
        }
        if (i < to && isNameToken(tokens.get(i))) {
            i++;
        }
        return i;
    }

    private static int matchingParen(List<Token> tokens, int open, int to) {
        int depth = 0;
        for (int i = open; i < to; i++) {
            Token t = tokens.get(i);
            if (t.isSymbol('(')) {
                depth++;
            } else if (t.isSymbol(')')) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return to;
    }

    /**
     * Names declared in {@code WITH name [(cols)] AS (...)} lists.
     */
    private static Set<String> collectCteNames(List<Token> tokens) {
        Set<String> names = new HashSet<>();
        int n = tokens.size();
        for (int i = 0; i < n; i++) {
            if (!tokens.get(i).isWord("WITH")) {
                continue;
            }
            int j = i + 1;
            if (j < n && tokens.get(j).isWord("RECURSIVE")) {
                j++;
            }
            while (j < n && tokens.get(j).isIdentifier()) {
                String name = IdentifierUtils.normalize(tokens.get(j).text);
                j++;
                if (j < n && tokens.get(j).isSymbol('(')) {
                    j = matchingParen(tokens, j, n) + 1;
                }
                if (j < n && tokens.get(j).isWord("AS")) {
                    j++;
                }
                if (j < n && tokens.get(j).isSymbol('(')) {
                    if (name != null) {
                        names.add(name);
                    }
                    j = matchingParen(tokens, j, n) + 1;
                } else {
                    break;
                }
                if (j < n && tokens.get(j).isSymbol(',')) {
                    j++;
                } else {
                    break;
                }
            }
        }
        return names;
    }

    private void addReference(List<String> parts, Set<TableReference> out, Set<String> cteNames) {
        if (parts.isEmpty()) {
            return;
        }
        int size = parts.size();
        String table = parts.get(size - 1);
        if (size == 1) {
            if (cteNames.contains(IdentifierUtils.normalize(table))) {
                return;
            }
            if (unqualifiedTablePolicy == UnqualifiedTablePolicy.DEFAULT_DATASET && defaultDataset.isPresent()) {
                out.add(TableReference.of(defaultProject.orElse(null), defaultDataset.get(), table));
            } else {
                out.add(TableReference.of(null, null, table));
            }
        } else if (size == 2) {
            out.add(TableReference.of(defaultProject.orElse(null), parts.get(0), table));
        } else if (size == 3) {
            out.add(TableReference.of(parts.get(0), parts.get(1), table));
        } else {
            out.add(TableReference.of(parts.get(0), String.join(".", parts.subList(1, size - 1)), table));
        }
    }
}
