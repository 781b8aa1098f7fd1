package com.docrepo.core.errors;

/**
 * Caller input violates a domain invariant: a duplicate unique value, a
 * malformed nested value or an out-of-range page request.
 */
public class BadRequestException extends DocrepoException {

    public BadRequestException(String message) {
        super(ErrorKind.BAD_REQUEST, message);
    }

    public BadRequestException(String message, Throwable cause) {
        super(ErrorKind.BAD_REQUEST, message, cause);
    }
}
