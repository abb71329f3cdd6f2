package com.testweaver.core;

import com.testweaver.model.ErrorKind;

/**
 * The scenario's start page could not be loaded. Raised before any step runs.
 */
public class NavigationException extends StepExecutionException {

    public NavigationException(String message) {
        super(ErrorKind.NAVIGATION_ERROR, message);
    }

    public NavigationException(String message, Throwable cause) {
        super(ErrorKind.NAVIGATION_ERROR, message, cause);
    }
}
