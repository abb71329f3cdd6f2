package com.testweaver.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The {@code wait_for} mode of a dual-mode step: what must hold for the explicit
 * selector's element before the action runs.
 */
public enum WaitCondition {
    ELEMENT_PRESENT,
    ELEMENT_VISIBLE,
    ELEMENT_CLICKABLE;

    @JsonCreator
    public static WaitCondition fromString(String value) {
        if (value == null || value.isBlank()) return ELEMENT_PRESENT;
        String v = value.trim().toUpperCase(Locale.ROOT);
        if (!v.startsWith("ELEMENT_")) v = "ELEMENT_" + v;
        try {
            return WaitCondition.valueOf(v);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown wait_for value: '" + value +
                "' (expected element_present, element_visible or element_clickable)", e);
        }
    }

    @JsonValue
    public String toYaml() {
        return name().toLowerCase(Locale.ROOT);
    }
}
