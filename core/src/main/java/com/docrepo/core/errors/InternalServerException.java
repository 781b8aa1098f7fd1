package com.docrepo.core.errors;

public class InternalServerException extends DocrepoException {

    public InternalServerException(String message) {
        super(ErrorKind.INTERNAL_SERVER_ERROR, message);
    }

    public InternalServerException(String message, Throwable cause) {
        super(ErrorKind.INTERNAL_SERVER_ERROR, message, cause);
    }
}
