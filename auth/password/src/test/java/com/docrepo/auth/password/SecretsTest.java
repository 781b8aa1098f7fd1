package com.docrepo.auth.password;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SecretsTest {

    @Test
    void randomHex_shouldReturn32LowercaseHexCharacters() {
        String secret = Secrets.randomHex();

        assertEquals(32, secret.length());
        assertTrue(secret.matches("[0-9a-f]{32}"));
    }

    @Test
    void randomHex_shouldNotRepeat() {
        assertNotEquals(Secrets.randomHex(), Secrets.randomHex());
    }
}
