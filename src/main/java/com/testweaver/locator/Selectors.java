package com.testweaver.locator;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Helpers for building selector strings from free text.
 */
public final class Selectors {

    private static final String UPPER = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";
    private static final String LOWER = "abcdefghijklmnopqrstuvwxyz";
    private static final Pattern TAG_NAME = Pattern.compile("[a-z][a-z0-9-]*");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_\\-:.]*");

    // Words testers append to a name that never appear in the element's id
    private static final Set<String> ELEMENT_NOUNS = Set.of(
        "field", "input", "box", "textbox", "textarea", "button", "btn", "link",
        "dropdown", "menu", "checkbox", "icon", "tab", "area");

    private Selectors() {}

    /** XPath expression lowercasing {@code expr}, e.g. {@code translate(@aria-label, 'AB..', 'ab..')}. */
    public static String lowerXPath(String expr) {
        return "translate(" + expr + ", '" + UPPER + "', '" + LOWER + "')";
    }

    /**
     * Quotes text as an XPath string literal. Text holding both quote styles is
     * split with {@code concat()}.
     */
    public static String xpathLiteral(String text) {
        if (!text.contains("'")) return "'" + text + "'";
        if (!text.contains("\"")) return "\"" + text + "\"";
        StringBuilder sb = new StringBuilder("concat(");
        String[] parts = text.split("'", -1);
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) sb.append(", \"'\", ");
            sb.append('\'').append(parts[i]).append('\'');
        }
        return sb.append(')').toString();
    }

    /** Quotes text as a CSS attribute value. */
    public static String cssString(String text) {
        return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    public static boolean isTagName(String text) {
        return TAG_NAME.matcher(text).matches();
    }

    public static boolean isIdentifier(String text) {
        return IDENTIFIER.matcher(text).matches();
    }

    /**
     * The target without trailing element nouns: "email field" → "email",
     * "submit button" → "submit". Returns the target itself when nothing is stripped
     * or when stripping would leave nothing.
     */
    public static String coreName(String target) {
        List<String> words = new ArrayList<>(List.of(target.trim().split("\\s+")));
        while (words.size() > 1 && ELEMENT_NOUNS.contains(words.get(words.size() - 1))) {
            words.remove(words.size() - 1);
        }
        return String.join(" ", words);
    }

    /**
     * Identifier spellings of a target, most literal first: as written, hyphenated,
     * underscored, then the same three for {@link #coreName}. Forms with whitespace
     * are dropped.
     *
     * <pre>
     *   "success message" → [success-message, success_message, successmessage]
     *   "email field"     → [email-field, email_field, emailfield, email]
     * </pre>
     */
    public static List<String> identifierVariants(String target) {
        Set<String> variants = new LinkedHashSet<>();
        addSpellings(variants, target.toLowerCase(Locale.ROOT));
        addSpellings(variants, coreName(target.toLowerCase(Locale.ROOT)));
        variants.removeIf(v -> v.isEmpty() || !isIdentifier(v));
        return new ArrayList<>(variants);
    }

    private static void addSpellings(Set<String> out, String text) {
        String t = text.trim();
        out.add(t);
        out.add(t.replaceAll("\\s+", "-"));
        out.add(t.replaceAll("\\s+", "_"));
        out.add(t.replaceAll("\\s+", ""));
    }
}
