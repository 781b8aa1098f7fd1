package com.docrepo.core.errors;

/**
 * Raised when the caller identity could not be established.
 */
public class UnauthorizedException extends DocrepoException {

    public UnauthorizedException(String message) {
        super(ErrorKind.UNAUTHORIZED, message);
    }

    public UnauthorizedException(String message, Throwable cause) {
        super(ErrorKind.UNAUTHORIZED, message, cause);
    }
}
