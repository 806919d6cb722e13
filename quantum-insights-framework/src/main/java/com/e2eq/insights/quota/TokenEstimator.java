package com.e2eq.insights.quota;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Rough token count for admission checks: one token per four characters, rounded up.
 */
@ApplicationScoped
public class TokenEstimator {

    static final int CHARS_PER_TOKEN = 4;

    public long estimate(String text) {
        if (text == null || text.isEmpty()) {
            return 0L;
        }
        return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }

    public long estimate(String... texts) {
        long total = 0L;
        for (String text : texts) {
            total += estimate(text);
        }
        return total;
    }
}
