package com.testweaver.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The machine half of a dual-mode step: an explicit selector tried before any
 * heuristic tier, the wait applied to it, an optional timeout override and
 * post-action assertions.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class AutomationSpec {

    private final String              selector;
    private final WaitCondition       waitFor;
    private final Integer             timeout;
    private final List<AssertionSpec> assertions;

    @JsonCreator
    public AutomationSpec(
            @JsonProperty("selector")   String selector,
            @JsonProperty("wait_for")   WaitCondition waitFor,
            @JsonProperty("timeout")    Integer timeout,
            @JsonProperty("assertions") List<AssertionSpec> assertions) {
        this.selector   = (selector == null || selector.isBlank()) ? null : selector.trim();
        this.waitFor    = waitFor != null ? waitFor : WaitCondition.ELEMENT_PRESENT;
        this.timeout    = timeout;
        this.assertions = assertions != null ? List.copyOf(assertions) : Collections.emptyList();
    }

    public static AutomationSpec selector(String selector) {
        return new AutomationSpec(selector, null, null, null);
    }

    public String getSelector()                 { return selector; }
    @JsonProperty("wait_for")
    public WaitCondition getWaitFor()           { return waitFor; }
    public Integer getTimeout()                 { return timeout; }
    public List<AssertionSpec> getAssertions()  { return assertions; }
    public boolean hasSelector()                { return selector != null; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AutomationSpec)) return false;
        AutomationSpec that = (AutomationSpec) o;
        return Objects.equals(selector, that.selector)
            && waitFor == that.waitFor
            && Objects.equals(timeout, that.timeout)
            && assertions.equals(that.assertions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(selector, waitFor, timeout, assertions);
    }

    @Override
    public String toString() {
        return "AutomationSpec{selector='" + selector + "', waitFor=" + waitFor +
            ", timeout=" + timeout + ", assertions=" + assertions.size() + "}";
    }
}
