package com.testweaver.driver;

/**
 * How a selector string is interpreted by the browser driver.
 */
public enum SelectorKind {
    ID,
    NAME,
    CLASS_NAME,
    TAG_NAME,
    CSS,
    XPATH;

    /**
     * Guesses the kind of a free-form selector: XPath when it starts with {@code /}
     * or {@code (}, CSS otherwise.
     */
    public static SelectorKind infer(String selector) {
        String s = selector == null ? "" : selector.trim();
        if (s.startsWith("/") || s.startsWith("(")) return XPATH;
        return CSS;
    }
}
