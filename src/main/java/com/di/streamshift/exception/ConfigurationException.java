package com.di.streamshift.exception;

/**
 * Bad or missing parameters, ambiguous column names or an unsupported staging scheme.
 * Always raised before any I/O; never retried. The message names the offending key,
 * column or scheme.
 */
public class ConfigurationException extends StreamShiftException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
