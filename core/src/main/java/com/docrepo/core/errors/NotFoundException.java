package com.docrepo.core.errors;

/**
 * Raised when the requested identity or filter match does not exist.
 */
public class NotFoundException extends DocrepoException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(ErrorKind.NOT_FOUND, message, cause);
    }
}
