package com.docrepo.core;

import java.util.Map;

/**
 * Issues and verifies signed access tokens carrying a claim set.
 */
public interface TokenIssuer {

    /**
     * Signs {@code claims} with an expiry set from the configured window.
     */
    String issue(Map<String, Object> claims);

    /**
     * @throws com.docrepo.core.errors.InvalidTokenException on any decode,
     *         signature or expiry failure
     */
    Map<String, Object> verify(String token);
}
