package com.testweaver.driver;

/**
 * Thrown by {@link BrowserDriver#findCandidate} when the browser rejects a selector
 * as syntactically invalid. Resolvers treat it as "not here" and move on.
 */
public class MalformedSelectorException extends RuntimeException {

    private final SelectorKind kind;
    private final String       selector;

    public MalformedSelectorException(SelectorKind kind, String selector, Throwable cause) {
        super("Malformed " + kind + " selector: " + selector, cause);
        this.kind     = kind;
        this.selector = selector;
    }

    public SelectorKind getKind()   { return kind; }
    public String getSelector()     { return selector; }
}
