package com.testweaver.model;

/**
 * The closed set of step actions a scenario can contain.
 *
 * Every kind must have exactly one handler in
 * {@link com.testweaver.executor.StepHandlerRegistry}; the registry refuses to start otherwise.
 */
public enum ActionKind {
    CLICK,
    TYPE,
    SELECT,
    VERIFY,
    WAIT,
    SCROLL,
    HOVER,
    ASSERT
}
