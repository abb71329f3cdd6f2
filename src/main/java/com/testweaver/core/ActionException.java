package com.testweaver.core;

import com.testweaver.model.ErrorKind;

/**
 * The element was resolved but could not be acted upon (hidden, disabled), or the
 * browser action itself failed.
 */
public class ActionException extends StepExecutionException {

    public ActionException(String message) {
        super(ErrorKind.ACTION_ERROR, message);
    }

    public ActionException(String message, Throwable cause) {
        super(ErrorKind.ACTION_ERROR, message, cause);
    }
}
