package com.sanctionsentinel.core.util;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HashingUtilsTest {
    @Test
    void sha256IsDeterministicAndHexEncoded() {
        String hash = HashingUtils.sha256("hello");

        assertEquals("2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824", hash);
        assertEquals(64, hash.length());
        assertTrue(hash.matches("[0-9a-f]{64}"));
    }

    @Test
    void byteAndStringVariantsAgree() {
        assertEquals(HashingUtils.sha256("sdn"), HashingUtils.sha256("sdn".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void sha256ProducesDifferentHashesForDifferentInputs() {
        assertNotEquals(HashingUtils.sha256("alpha"), HashingUtils.sha256("beta"));
    }
}
