package com.docrepo.core.errors;

/**
 * Root of the error taxonomy. Every failure carries a stable {@link ErrorKind}
 * and a human-readable message.
 */
public class DocrepoException extends RuntimeException {
    private final ErrorKind kind;

    public DocrepoException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public DocrepoException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public int status() {
        return kind.status();
    }
}
