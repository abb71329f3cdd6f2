package com.testweaver.parser;

/**
 * A scenario file could not be read or has the wrong shape.
 */
public class ScenarioLoadException extends RuntimeException {

    public ScenarioLoadException(String message) {
        super(message);
    }

    public ScenarioLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
