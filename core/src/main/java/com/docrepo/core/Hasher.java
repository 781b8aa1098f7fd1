package com.docrepo.core;

public interface Hasher {
    String hash(String value);

    boolean verify(String hash, String plain);
}
