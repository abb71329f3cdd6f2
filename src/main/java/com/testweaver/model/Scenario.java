package com.testweaver.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A named, compiled scenario: the steps that parsed plus the warnings for those
 * that did not. {@code preparation} and {@code successCriteria} come from the
 * scenario's {@code modes.human} block and are only used for manual test plans.
 */
public final class Scenario {

    public static final String DEFAULT_NAME = "Unnamed Scenario";

    private final String             name;
    private final String             description;
    private final List<String>       tags;
    private final List<Step>         steps;
    private final List<ParseWarning> warnings;
    private final String             preparation;
    private final String             successCriteria;

    public Scenario(String name, String description, List<String> tags,
                    List<Step> steps, List<ParseWarning> warnings) {
        this(name, description, tags, steps, warnings, null, null);
    }

    public Scenario(String name, String description, List<String> tags,
                    List<Step> steps, List<ParseWarning> warnings,
                    String preparation, String successCriteria) {
        this.name            = (name == null || name.isBlank()) ? DEFAULT_NAME : name;
        this.description     = description != null ? description : "";
        this.tags            = tags != null ? List.copyOf(tags) : Collections.emptyList();
        this.steps           = List.copyOf(Objects.requireNonNull(steps, "steps"));
        this.warnings        = warnings != null ? List.copyOf(warnings) : Collections.emptyList();
        this.preparation     = blankToNull(preparation);
        this.successCriteria = blankToNull(successCriteria);
    }

    public static Scenario of(String name, List<Step> steps) {
        return new Scenario(name, "", null, steps, null);
    }

    public String getName()                   { return name; }
    public String getDescription()            { return description; }
    public List<String> getTags()             { return tags; }
    public List<Step> getSteps()              { return steps; }
    public List<ParseWarning> getWarnings()   { return warnings; }
    public boolean hasWarnings()              { return !warnings.isEmpty(); }
    public String getPreparation()            { return preparation; }
    public String getSuccessCriteria()        { return successCriteria; }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }

    @Override
    public String toString() {
        return "Scenario{'" + name + "', steps=" + steps.size() + ", warnings=" + warnings.size() + "}";
    }
}
