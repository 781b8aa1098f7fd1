package com.docrepo.auth.password;

import com.docrepo.core.Hasher;
import com.docrepo.core.config.AuthSettings;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HashersTest {

    private static AuthSettings scheme(String name) {
        return AuthSettings.builder().secretKey("unused").hashScheme(name).build();
    }

    @Test
    void bcrypt_shouldVerifyThePlainTextOnly() {
        Hasher hasher = new BCryptHasher(4);

        String hash = hasher.hash("correct horse");

        assertNotEquals("correct horse", hash);
        assertTrue(hasher.verify(hash, "correct horse"));
        assertFalse(hasher.verify(hash, "battery staple"));
    }

    @Test
    void bcrypt_shouldSaltEveryHash() {
        Hasher hasher = new BCryptHasher(4);

        assertNotEquals(hasher.hash("same"), hasher.hash("same"));
    }

    @Test
    void pbkdf2_shouldVerifyThePlainTextOnly() {
        Hasher hasher = new Pbkdf2Hasher();

        String hash = hasher.hash("correct horse");

        assertTrue(hasher.verify(hash, "correct horse"));
        assertFalse(hasher.verify(hash, "battery staple"));
    }

    @Test
    void forScheme_shouldPickTheConfiguredHasher() {
        assertInstanceOf(BCryptHasher.class, Hashers.forScheme(scheme("bcrypt")));
        assertInstanceOf(Pbkdf2Hasher.class, Hashers.forScheme(scheme("pbkdf2_sha256")));
        assertInstanceOf(Pbkdf2Hasher.class, Hashers.forScheme(scheme("PBKDF2")));
        assertThrows(IllegalArgumentException.class, () -> Hashers.forScheme(scheme("md5")));
    }

    @Test
    void verify_shouldReturnFalseForAMalformedHash() {
        assertFalse(new BCryptHasher(4).verify("not-a-bcrypt-hash", "anything"));
    }
}
