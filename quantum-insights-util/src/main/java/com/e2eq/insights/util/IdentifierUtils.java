package com.e2eq.insights.util;

import org.apache.commons.lang3.StringUtils;

import java.util.Locale;

/**
 * Normalization for dataset and table identifiers. Identifiers coming from grants, tokens and
 * generated SQL are compared case-insensitively, with surrounding whitespace and quoting removed.
 */
public final class IdentifierUtils {

    public static final String WILDCARD = "*";

    private IdentifierUtils() {
    }

    /**
     * Strips whitespace and one layer of identifier quoting (backticks, double quotes or square
     * brackets), then lower-cases. Returns null for a null or blank input.
     */
    public static String normalize(String identifier) {
        if (StringUtils.isBlank(identifier)) {
            return null;
        }
        String value = stripQuotes(identifier.strip()).strip();
        if (value.isEmpty()) {
            return null;
        }
        return value.toLowerCase(Locale.ROOT);
    }

    public static String stripQuotes(String value) {
        if (value == null || value.length() < 2) {
            return value;
        }
        char first = value.charAt(0);
        char last = value.charAt(value.length() - 1);
        if ((first == '`' && last == '`') || (first == '"' && last == '"') || (first == '[' && last == ']')) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    public static boolean isWildcard(String identifier) {
        return WILDCARD.equals(normalize(identifier));
    }

    /**
     * True when both identifiers normalize to the same value. Two nulls are not considered equal.
     */
    public static boolean sameIdentifier(String a, String b) {
        String na = normalize(a);
        return na != null && na.equals(normalize(b));
    }
}
