package com.docrepo.core.errors;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;

/**
 * JSON error envelope for an HTTP layer sitting on top of the services.
 */
public record ErrorBody(Status status, String message, Object details, double timestamp) {

    public enum Status {
        SUCCESS("success"),
        FAILED("failed");

        private final String value;

        Status(String value) {
            this.value = value;
        }

        @JsonValue
        public String value() {
            return value;
        }
    }

    public static ErrorBody failed(String message, Object details) {
        return new ErrorBody(Status.FAILED, message, details, epochSeconds(Instant.now()));
    }

    /**
     * Body for a failure; the details name the error kind.
     */
    public static ErrorBody of(Throwable error) {
        ErrorKind kind = ErrorKind.of(error);
        String message = kind == ErrorKind.INTERNAL_SERVER_ERROR && !(error instanceof DocrepoException)
                ? "Internal server error"
                : error.getMessage();
        return failed(message, kind.name());
    }

    private static double epochSeconds(Instant instant) {
        return instant.getEpochSecond() + instant.getNano() / 1_000_000_000d;
    }
}
