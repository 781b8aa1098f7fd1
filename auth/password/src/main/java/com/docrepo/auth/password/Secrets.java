package com.docrepo.auth.password;

import org.springframework.security.crypto.codec.Hex;
import org.springframework.security.crypto.keygen.BytesKeyGenerator;
import org.springframework.security.crypto.keygen.KeyGenerators;

/**
 * Random values for one-time codes, reset tokens and the like.
 */
public final class Secrets {
    private static final BytesKeyGenerator GENERATOR = KeyGenerators.secureRandom(16);

    private Secrets() {
    }

    /**
     * 32 lowercase hex characters from a secure random source.
     */
    public static String randomHex() {
        return new String(Hex.encode(GENERATOR.generateKey()));
    }
}
