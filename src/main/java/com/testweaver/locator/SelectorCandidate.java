package com.testweaver.locator;

import com.testweaver.driver.SelectorKind;

import java.util.Objects;

/**
 * One concrete selector the resolver may probe, tagged with the tier that produced it.
 * Equality ignores the tier so the same selector is never probed twice.
 */
public final class SelectorCandidate {

    private final SelectorKind kind;
    private final String       value;
    private final String       tier;

    public SelectorCandidate(SelectorKind kind, String value, String tier) {
        this.kind  = Objects.requireNonNull(kind, "kind");
        this.value = Objects.requireNonNull(value, "value");
        this.tier  = tier;
    }

    public static SelectorCandidate of(SelectorKind kind, String value, String tier) {
        return new SelectorCandidate(kind, value, tier);
    }

    public SelectorKind getKind() { return kind; }
    public String getValue()      { return value; }
    public String getTier()       { return tier; }

    public String describe() {
        return kind.name().toLowerCase() + "=" + value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SelectorCandidate)) return false;
        SelectorCandidate c = (SelectorCandidate) o;
        return kind == c.kind && value.equals(c.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return "[" + tier + "] " + describe();
    }
}
