package com.testweaver.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;

/**
 * One post-action assertion of a dual-mode step.
 *
 * <pre>
 *   assertions:
 *     - type: element_visible
 *       selector: "#welcome"
 *     - type: element_count
 *       selector: ".result"
 *       count: 3
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AssertionSpec {

    public enum Type {
        ELEMENT_VISIBLE,
        ELEMENT_PRESENT,
        TEXT_PRESENT,
        ELEMENT_COUNT;

        @JsonCreator
        public static Type fromString(String value) {
            if (value == null) throw new IllegalArgumentException("Assertion type is required");
            try {
                return Type.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown assertion type: '" + value + "'", e);
            }
        }

        @JsonValue
        public String toYaml() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final Type    type;
    private final String  selector;
    private final String  text;
    private final Integer count;

    @JsonCreator
    public AssertionSpec(
            @JsonProperty("type")     Type type,
            @JsonProperty("selector") String selector,
            @JsonProperty("text")     String text,
            @JsonProperty("count")    Integer count) {
        this.type     = Objects.requireNonNull(type, "assertion type");
        this.selector = selector;
        this.text     = text;
        this.count    = count;
    }

    public Type getType()        { return type; }
    public String getSelector()  { return selector; }
    public String getText()      { return text; }
    public Integer getCount()    { return count; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AssertionSpec)) return false;
        AssertionSpec that = (AssertionSpec) o;
        return type == that.type
            && Objects.equals(selector, that.selector)
            && Objects.equals(text, that.text)
            && Objects.equals(count, that.count);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, selector, text, count);
    }

    @Override
    public String toString() {
        return "AssertionSpec{" + type.toYaml() + ", selector='" + selector + "'" +
            (text != null ? ", text='" + text + "'" : "") +
            (count != null ? ", count=" + count : "") + "}";
    }
}
