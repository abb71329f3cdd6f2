package com.testweaver.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * One compiled scenario step.
 *
 * Immutable with value equality, so compiling the same raw text twice yields
 * equal steps. {@code target} is always normalized (trimmed, lowercased, leading
 * article removed); {@code value} keeps the casing of the raw text.
 *
 * <pre>
 *   "type 'a@b.com' into email field"
 *     → Step{action=TYPE, target="email field", value="a@b.com", timeoutSeconds=10}
 * </pre>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Step {

    public static final int DEFAULT_TIMEOUT_SECONDS = 10;

    private final String         rawText;
    private final ActionKind     action;
    private final String         target;
    private final String         value;
    private final int            timeoutSeconds;
    private final String         description;
    private final String         humanInstruction;
    private final AutomationSpec automation;

    private Step(Builder b) {
        this.rawText          = Objects.requireNonNull(b.rawText, "rawText");
        this.action           = Objects.requireNonNull(b.action, "action");
        this.target           = Objects.requireNonNull(b.target, "target");
        this.value            = b.value;
        this.timeoutSeconds   = b.timeoutSeconds;
        this.description      = b.description;
        this.humanInstruction = b.humanInstruction;
        this.automation       = b.automation;
        if (target.isEmpty()) throw new IllegalArgumentException("Step target must not be empty");
        if (timeoutSeconds < 0) throw new IllegalArgumentException("timeoutSeconds must be >= 0");
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public String getRawText()              { return rawText; }
    public ActionKind getAction()           { return action; }
    public String getTarget()               { return target; }
    public String getValue()                { return value; }
    public int getTimeoutSeconds()          { return timeoutSeconds; }
    public String getDescription()          { return description; }
    public String getHumanInstruction()     { return humanInstruction; }
    public AutomationSpec getAutomation()   { return automation; }

    public boolean hasValue()               { return value != null; }
    public boolean hasExplicitSelector()    { return automation != null && automation.hasSelector(); }

    /**
     * Timeout used for resolution and waits: the automation override when present,
     * otherwise the step's own timeout.
     */
    public int effectiveTimeoutSeconds() {
        if (automation != null && automation.getTimeout() != null) return automation.getTimeout();
        return timeoutSeconds;
    }

    public Builder toBuilder() {
        return new Builder()
            .rawText(rawText).action(action).target(target).value(value)
            .timeoutSeconds(timeoutSeconds).description(description)
            .humanInstruction(humanInstruction).automation(automation);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Step)) return false;
        Step s = (Step) o;
        return timeoutSeconds == s.timeoutSeconds
            && rawText.equals(s.rawText)
            && action == s.action
            && target.equals(s.target)
            && Objects.equals(value, s.value)
            && Objects.equals(description, s.description)
            && Objects.equals(humanInstruction, s.humanInstruction)
            && Objects.equals(automation, s.automation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rawText, action, target, value, timeoutSeconds,
            description, humanInstruction, automation);
    }

    @Override
    public String toString() {
        return "Step{" + action + " target='" + target + "'" +
            (value != null ? " value='" + value + "'" : "") +
            " timeout=" + timeoutSeconds + "s}";
    }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private String         rawText;
        private ActionKind     action;
        private String         target;
        private String         value;
        private int            timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
        private String         description;
        private String         humanInstruction;
        private AutomationSpec automation;

        public Builder rawText(String raw)                 { this.rawText = raw; return this; }
        public Builder action(ActionKind action)           { this.action = action; return this; }
        public Builder target(String target)               { this.target = target; return this; }
        public Builder value(String value)                 { this.value = value; return this; }
        public Builder timeoutSeconds(int seconds)         { this.timeoutSeconds = seconds; return this; }
        public Builder description(String description)     { this.description = description; return this; }
        public Builder humanInstruction(String text)       { this.humanInstruction = text; return this; }
        public Builder automation(AutomationSpec spec)     { this.automation = spec; return this; }

        public Step build() { return new Step(this); }
    }
}
