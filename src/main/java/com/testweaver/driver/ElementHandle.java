package com.testweaver.driver;

/**
 * Opaque reference to an element located by a {@link BrowserDriver}.
 * Only the driver that produced a handle can act on it.
 */
public interface ElementHandle {

    /** The selector kind that located this element. */
    SelectorKind getKind();

    /** The selector value that located this element. */
    String getSelector();

    default String describe() {
        return getKind().name().toLowerCase() + "=" + getSelector();
    }
}
