package com.e2eq.insights.sql;

import java.util.ArrayList;
import java.util.List;

/**
 * Minimal SQL tokenizer. Drops whitespace and comments ({@code --}, {@code #}, block comments),
 * keeps string literals as single tokens so their contents are never read as SQL, and returns
 * quoted identifiers (backticks, double quotes, square brackets) without their quotes.
 */
final class SqlLexer {

    enum Type { WORD, QUOTED, STRING, NUMBER, SYMBOL }

    static final class Token {
        final Type type;
        final String text;
        final int start;
        final int end;

        Token(Type type, String text, int start, int end) {
            this.type = type;
            this.text = text;
            this.start = start;
            this.end = end;
        }

        boolean isWord(String keyword) {
            return type == Type.WORD && text.equalsIgnoreCase(keyword);
        }

        boolean isSymbol(char c) {
            return type == Type.SYMBOL && text.length() == 1 && text.charAt(0) == c;
        }

        boolean isIdentifier() {
            return type == Type.WORD || type == Type.QUOTED;
        }

        /** True when the token starts exactly where {@code previous} ends. */
        boolean touches(Token previous) {
            return previous.end == start;
        }

        @Override
        public String toString() {
            return type + "(" + text + ")";
        }
    }

    private SqlLexer() {
    }

    static List<Token> tokenize(String sql) {
        List<Token> tokens = new ArrayList<>();
        if (sql == null) {
            return tokens;
        }
        int n = sql.length();
        int i = 0;
        while (i < n) {
            char c = sql.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '-' && i + 1 < n && sql.charAt(i + 1) == '-' || c == '#') {
                i = endOfLine(sql, i);
            } else if (c == '/' && i + 1 < n && sql.charAt(i + 1) == '*') {
                int close = sql.indexOf("*/", i + 2);
                i = close < 0 ? n : close + 2;
            } else if (c == '\'') {
                int end = closeQuote(sql, i, '\'');
                tokens.add(new Token(Type.STRING, sql.substring(i + 1, Math.max(i + 1, end - 1)), i, end));
                i = end;
            } else if (c == '`' || c == '"') {
                int end = closeQuote(sql, i, c);
                tokens.add(new Token(Type.QUOTED, sql.substring(i + 1, Math.max(i + 1, end - 1)), i, end));
                i = end;
            } else if (c == '[' && isBracketIdentifier(sql, i)) {
                int close = sql.indexOf(']', i + 1);
                tokens.add(new Token(Type.QUOTED, sql.substring(i + 1, close), i, close + 1));
                i = close + 1;
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < n && (Character.isLetterOrDigit(sql.charAt(i)) || sql.charAt(i) == '_' || sql.charAt(i) == '$')) {
                    i++;
                }
                tokens.add(new Token(Type.WORD, sql.substring(start, i), start, i));
            } else if (Character.isDigit(c)) {
                int start = i;
                while (i < n && (Character.isLetterOrDigit(sql.charAt(i)) || sql.charAt(i) == '_')) {
                    i++;
                }
                tokens.add(new Token(Type.NUMBER, sql.substring(start, i), start, i));
            } else {
                tokens.add(new Token(Type.SYMBOL, String.valueOf(c), i, i + 1));
                i++;
            }
        }
        return tokens;
    }

    /**
     * Line comments end at either {@code \n} or {@code \r}.
     */
    private static int endOfLine(String sql, int from) {
        int n = sql.length();
        for (int i = from; i < n; i++) {
            char c = sql.charAt(i);
            if (c == '\n' || c == '\r') {
                return i + 1;
            }
        }
        return n;
    }

    /**
     * Index just past the closing quote. A doubled quote or a backslash escapes the quote character.
     * An unterminated literal runs to the end of the text.
     */
    private static int closeQuote(String sql, int open, char quote) {
        int n = sql.length();
        int i = open + 1;
        while (i < n) {
            char c = sql.charAt(i);
            if (c == '\\' && quote != '`') {
                i += 2;
            } else if (c == quote) {
                if (i + 1 < n && sql.charAt(i + 1) == quote) {
                    i += 2;
                } else {
                    return i + 1;
                }
            } else {
                i++;
            }
        }
        return n;
    }

    /** {@code [name]} is an identifier; {@code [1, 2]} or {@code arr[OFFSET(0)]} are not. */
    private static boolean isBracketIdentifier(String sql, int open) {
        int close = sql.indexOf(']', open + 1);
        if (close <= open + 1) {
            return false;
        }
        for (int i = open + 1; i < close; i++) {
            char c = sql.charAt(i);
            if (!(Character.isLetterOrDigit(c) || c == '_' || c == ' ' || c == '-' || c == '.')) {
                return false;
            }
        }
        return Character.isLetter(sql.charAt(open + 1)) || sql.charAt(open + 1) == '_';
    }
}
