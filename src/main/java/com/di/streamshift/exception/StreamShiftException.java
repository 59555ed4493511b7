package com.di.streamshift.exception;

/**
 * Base type for every failure raised by the transfer core.
 */
public class StreamShiftException extends RuntimeException {

    public StreamShiftException(String message) {
        super(message);
    }

    public StreamShiftException(String message, Throwable cause) {
        super(message, cause);
    }
}
