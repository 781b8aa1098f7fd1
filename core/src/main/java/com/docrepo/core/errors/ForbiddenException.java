package com.docrepo.core.errors;

/**
 * Caller lacks permission for the action.
 */
public class ForbiddenException extends DocrepoException {

    public ForbiddenException(String message) {
        super(ErrorKind.FORBIDDEN, message);
    }

    public ForbiddenException(String message, Throwable cause) {
        super(ErrorKind.FORBIDDEN, message, cause);
    }
}
