package com.docrepo.auth.password;

import com.docrepo.core.Hasher;
import com.docrepo.core.config.AuthSettings;

import java.util.Locale;

public final class Hashers {

    private Hashers() {
    }

    /**
     * Hasher for {@link AuthSettings#hashScheme()}: {@code bcrypt} or {@code pbkdf2_sha256}.
     */
    public static Hasher forScheme(AuthSettings settings) {
        String scheme = settings.hashScheme().toLowerCase(Locale.ROOT);
        switch (scheme) {
            case "bcrypt":
                return new BCryptHasher();
            case "pbkdf2_sha256":
            case "pbkdf2":
                return new Pbkdf2Hasher();
            default:
                throw new IllegalArgumentException("Unsupported hash scheme " + settings.hashScheme());
        }
    }
}
