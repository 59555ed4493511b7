package com.di.streamshift.exception;

/** A logical or physical column type has no counterpart on the other side. */
public class SchemaMappingException extends StreamShiftException {

    public SchemaMappingException(String message) {
        super(message);
    }

    public SchemaMappingException(String message, Throwable cause) {
        super(message, cause);
    }
}
