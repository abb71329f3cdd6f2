package com.testweaver.parser;

import com.testweaver.model.ParseWarning;
import com.testweaver.model.Step;

import java.util.Objects;

/**
 * Either a compiled {@link Step} or the {@link ParseWarning} explaining why the raw
 * text did not compile.
 */
public final class ParseOutcome {

    private final Step         step;
    private final ParseWarning warning;

    private ParseOutcome(Step step, ParseWarning warning) {
        this.step    = step;
        this.warning = warning;
    }

    public static ParseOutcome step(Step step) {
        return new ParseOutcome(Objects.requireNonNull(step), null);
    }

    public static ParseOutcome warning(String raw, String reason) {
        return new ParseOutcome(null, new ParseWarning(raw, reason));
    }

    public boolean isStep()             { return step != null; }
    public Step getStep()               { return step; }
    public ParseWarning getWarning()    { return warning; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParseOutcome)) return false;
        ParseOutcome that = (ParseOutcome) o;
        return Objects.equals(step, that.step) && Objects.equals(warning, that.warning);
    }

    @Override
    public int hashCode() {
        return Objects.hash(step, warning);
    }

    @Override
    public String toString() {
        return isStep() ? step.toString() : warning.toString();
    }
}
