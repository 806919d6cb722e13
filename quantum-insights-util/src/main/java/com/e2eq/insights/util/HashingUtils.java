package com.e2eq.insights.util;

import com.google.common.base.Joiner;
import com.google.common.collect.Lists;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

public final class HashingUtils {

    private static final Joiner KEY_JOINER = Joiner.on('\u001f').useForNull("");

    private HashingUtils() {
    }

    public static String sha256Hex(String value) {
        return Hashing.sha256().hashString(value == null ? "" : value, StandardCharsets.UTF_8).toString();
    }

    /**
     * Hashes the parts joined by a unit separator so that ("ab", "c") and ("a", "bc") differ.
     */
    public static String sha256Hex(String first, String... rest) {
        return sha256Hex(KEY_JOINER.join(Lists.asList(first, rest)));
    }
}
