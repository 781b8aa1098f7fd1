package com.docrepo.auth.password;

import com.docrepo.core.Hasher;
import org.springframework.security.crypto.password.Pbkdf2PasswordEncoder;

/**
 * PBKDF2 with HMAC-SHA256, salted per hash.
 */
public class Pbkdf2Hasher implements Hasher {
    private final Pbkdf2PasswordEncoder encoder = Pbkdf2PasswordEncoder.defaultsForSpringSecurity_v5_8();

    @Override
    public String hash(String value) {
        return encoder.encode(value);
    }

    @Override
    public boolean verify(String hash, String plain) {
        return encoder.matches(plain, hash);
    }
}
