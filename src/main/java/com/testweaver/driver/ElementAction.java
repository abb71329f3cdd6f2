package com.testweaver.driver;

/**
 * Interactions a {@link BrowserDriver} performs on a resolved element.
 */
public enum ElementAction {
    CLICK,
    /** Clears the field, then types the value. */
    TYPE,
    /** Selects the option whose visible text equals the value. */
    SELECT,
    HOVER,
    SCROLL_INTO_VIEW
}
