package com.docrepo.core.errors;

/**
 * A write was acknowledged but the record could not be read back. The write may
 * or may not be visible; look the record up by {@link #id()} before retrying.
 */
public class UnconfirmedWriteException extends InternalServerException {
    private final transient Object id;

    public UnconfirmedWriteException(Object id) {
        super("Record " + id + " was written but could not be read back");
        this.id = id;
    }

    public Object id() {
        return id;
    }
}
