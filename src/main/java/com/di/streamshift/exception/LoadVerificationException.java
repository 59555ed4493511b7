package com.di.streamshift.exception;

import com.di.streamshift.jdbc.LoadError;
import lombok.Getter;

import java.util.List;

/**
 * The warehouse's load-error log holds rows for this load, even though the COPY
 * statement itself returned normally.
 */
@Getter
public class LoadVerificationException extends StreamShiftException {

    private final List<LoadError> loadErrors;

    public LoadVerificationException(String message, List<LoadError> loadErrors) {
        super(message);
        this.loadErrors = List.copyOf(loadErrors);
    }
}
