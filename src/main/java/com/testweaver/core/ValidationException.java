package com.testweaver.core;

import com.testweaver.model.ErrorKind;

/**
 * A verify, assert or automation assertion did not hold.
 */
public class ValidationException extends StepExecutionException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION_ERROR, message);
    }
}
