package com.e2eq.insights.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HashingUtilsTest {

    @Test
    void sha256Hex_knownValue() {
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855", HashingUtils.sha256Hex(""));
        assertEquals(64, HashingUtils.sha256Hex("select 1").length());
    }

    @Test
    void sha256Hex_partsAreSeparated() {
        assertNotEquals(HashingUtils.sha256Hex("ab", "c"), HashingUtils.sha256Hex("a", "bc"));
        assertEquals(HashingUtils.sha256Hex("a", "b", "c"), HashingUtils.sha256Hex("a", "b", "c"));
    }
}
