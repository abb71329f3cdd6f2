package com.testweaver.model;

/**
 * Classifies why a step or a scenario failed.
 */
public enum ErrorKind {
    /** Every resolution tier was exhausted inside the timeout budget. */
    ELEMENT_NOT_FOUND,
    /** The element was found but could not be acted upon, or the driver action failed. */
    ACTION_ERROR,
    /** A visibility, text or automation assertion did not hold. */
    VALIDATION_ERROR,
    /** The initial page never loaded. No step was attempted. */
    NAVIGATION_ERROR,
    /** The run was cancelled between two steps. */
    CANCELLED
}
