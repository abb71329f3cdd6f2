package com.testweaver.model;

import java.util.Objects;

/**
 * A raw step that did not compile. It is reported, attached to its scenario and
 * never executed.
 */
public final class ParseWarning {

    private final String rawText;
    private final String reason;

    public ParseWarning(String rawText, String reason) {
        this.rawText = rawText;
        this.reason  = Objects.requireNonNull(reason, "reason");
    }

    public String getRawText() { return rawText; }
    public String getReason()  { return reason; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParseWarning)) return false;
        ParseWarning w = (ParseWarning) o;
        return Objects.equals(rawText, w.rawText) && reason.equals(w.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rawText, reason);
    }

    @Override
    public String toString() {
        return "ParseWarning{'" + rawText + "': " + reason + "}";
    }
}
