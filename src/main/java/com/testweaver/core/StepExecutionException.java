package com.testweaver.core;

import com.testweaver.model.ErrorKind;

/**
 * Base class of every fault that fails a step. Carries the {@link ErrorKind}
 * recorded in the step's result.
 */
public class StepExecutionException extends RuntimeException {

    private final ErrorKind errorKind;

    public StepExecutionException(ErrorKind errorKind, String message) {
        super(message);
        this.errorKind = errorKind;
    }

    public StepExecutionException(ErrorKind errorKind, String message, Throwable cause) {
        super(message, cause);
        this.errorKind = errorKind;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }
}
