package com.docrepo.core.errors;

/**
 * Raised when a bearer token cannot be decoded or verified, or has expired.
 */
public class InvalidTokenException extends DocrepoException {

    public InvalidTokenException(String message) {
        super(ErrorKind.INVALID_TOKEN, message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(ErrorKind.INVALID_TOKEN, message, cause);
    }
}
