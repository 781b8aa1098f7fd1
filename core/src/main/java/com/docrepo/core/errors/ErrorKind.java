package com.docrepo.core.errors;

/**
 * Failure kinds and the HTTP status a calling layer should answer with.
 */
public enum ErrorKind {
    NOT_FOUND(404),
    BAD_REQUEST(400),
    INTERNAL_SERVER_ERROR(500),
    FORBIDDEN(403),
    UNAUTHORIZED(401),
    // a token that failed decoding, signature or expiry checks; answered with 403
    INVALID_TOKEN(403);

    private final int status;

    ErrorKind(int status) {
        this.status = status;
    }

    public int status() {
        return status;
    }

    /**
     * Kind of any throwable: members of the taxonomy report their own kind,
     * everything else (driver and serialization failures included) is an
     * internal server error.
     */
    public static ErrorKind of(Throwable error) {
        if (error instanceof DocrepoException) {
            return ((DocrepoException) error).kind();
        }
        return INTERNAL_SERVER_ERROR;
    }

    public static int statusOf(Throwable error) {
        return of(error).status();
    }
}
