package com.testweaver.driver;

/**
 * A genuine browser fault: lost session, crashed browser, failed interaction.
 * Never used for "element not here", which is an empty probe result.
 */
public class DriverException extends RuntimeException {

    public DriverException(String message) {
        super(message);
    }

    public DriverException(String message, Throwable cause) {
        super(message, cause);
    }
}
