package com.docrepo.auth.password;

import com.docrepo.core.Hasher;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

public class BCryptHasher implements Hasher {
    public static final int DEFAULT_STRENGTH = 10;

    private final BCryptPasswordEncoder encoder;

    public BCryptHasher() {
        this(DEFAULT_STRENGTH);
    }

    /**
     * @param strength log2 of the number of rounds, 4 to 31
     */
    public BCryptHasher(int strength) {
        this.encoder = new BCryptPasswordEncoder(strength);
    }

    @Override
    public String hash(String value) {
        return encoder.encode(value);
    }

    @Override
    public boolean verify(String hash, String plain) {
        return encoder.matches(plain, hash);
    }
}
