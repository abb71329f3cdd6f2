package com.testweaver.model;

import java.util.Locale;
import java.util.Objects;

/**
 * A selector suggested by page-structure analysis, keyed by the word a tester
 * would use for the element ("email", "load more").
 */
public final class StructureHint {

    public enum Category {
        FORM_FIELD,
        DYNAMIC_CONTROL,
        OTHER
    }

    private final String   keyword;
    private final String   selector;
    private final Category category;

    public StructureHint(String keyword, String selector, Category category) {
        this.keyword  = Objects.requireNonNull(keyword, "keyword").trim().toLowerCase(Locale.ROOT);
        this.selector = Objects.requireNonNull(selector, "selector").trim();
        this.category = category != null ? category : Category.OTHER;
    }

    public String getKeyword()    { return keyword; }
    public String getSelector()   { return selector; }
    public Category getCategory() { return category; }

    /**
     * True when the keyword is a substring of the normalized target or the target
     * a substring of the keyword.
     */
    public boolean matches(String normalizedTarget) {
        if (keyword.isEmpty() || normalizedTarget == null || normalizedTarget.isEmpty()) return false;
        return normalizedTarget.contains(keyword) || keyword.contains(normalizedTarget);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StructureHint)) return false;
        StructureHint h = (StructureHint) o;
        return keyword.equals(h.keyword) && selector.equals(h.selector) && category == h.category;
    }

    @Override
    public int hashCode() {
        return Objects.hash(keyword, selector, category);
    }

    @Override
    public String toString() {
        return "StructureHint{'" + keyword + "' -> " + selector + " (" + category + ")}";
    }
}
