package com.testweaver.locator;

import com.testweaver.model.StructureHint;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * What a {@link ResolutionStrategy} gets to work with: the normalized target,
 * the page's structure hints and an optional explicit selector.
 */
public final class ResolutionRequest {

    private final String              target;
    private final List<StructureHint> hints;
    private final String              explicitSelector;

    public ResolutionRequest(String target, List<StructureHint> hints, String explicitSelector) {
        this.target           = normalize(Objects.requireNonNull(target, "target"));
        this.hints            = hints != null ? List.copyOf(hints) : Collections.emptyList();
        this.explicitSelector = (explicitSelector == null || explicitSelector.isBlank()) ? null : explicitSelector.trim();
    }

    public ResolutionRequest(String target, List<StructureHint> hints) {
        this(target, hints, null);
    }

    public String getTarget()               { return target; }
    public List<StructureHint> getHints()   { return hints; }
    public String getExplicitSelector()     { return explicitSelector; }
    public boolean hasExplicitSelector()    { return explicitSelector != null; }

    private static String normalize(String target) {
        return target.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "ResolutionRequest{'" + target + "', hints=" + hints.size() +
            (explicitSelector != null ? ", selector=" + explicitSelector : "") + "}";
    }
}
