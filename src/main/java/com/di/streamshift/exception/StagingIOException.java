package com.di.streamshift.exception;

/**
 * Object-store read or write failure. On the write path this is raised before any
 * warehouse statement has run.
 */
public class StagingIOException extends StreamShiftException {

    public StagingIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
