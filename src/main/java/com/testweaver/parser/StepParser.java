package com.testweaver.parser;

import com.testweaver.core.ExecutionListener;
import com.testweaver.model.ActionKind;
import com.testweaver.model.AutomationSpec;
import com.testweaver.model.ParseWarning;
import com.testweaver.model.Step;
import com.testweaver.model.StepSpec;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiles one raw scenario step into a typed {@link Step}.
 *
 * ## Text grammar
 *
 * Rules are tried in this order; the first match wins:
 *
 *   scroll   "scroll down to the bottom", "scroll up till top", "scroll down 300",
 *            "scroll to the footer"
 *   click    "click [on] X"
 *   type     "type|enter V into X"
 *   select   "select V from X"
 *   verify   "verify|check [that] X appears", "verify|check [that] X contains|shows V"
 *   wait     "wait for N seconds", "wait for the X"
 *   hover    "hover over|on X", "move to X"
 *   assert   "assert|expect [that] X contains V"
 *
 * Keywords match case-insensitively; values keep the casing of the raw text and
 * lose one pair of surrounding quotes. Targets are normalized: trimmed, lowercased,
 * whitespace collapsed and a leading article removed.
 *
 * Anything else, or a rule that leaves an empty target, becomes a
 * {@link com.testweaver.model.ParseWarning}, reported to the listener and returned.
 *
 * Parsing is pure: the same input always yields an equal outcome.
 */
public class StepParser {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE;

    // Scroll
    private static final Pattern SCROLL_END = Pattern.compile(
        "^scroll\\s+(?:down\\s+)?(?:(?:to|till|until)\\s+)?(?:the\\s+)?(?:bottom|end)\\b.*$", FLAGS);
    private static final Pattern SCROLL_TOP = Pattern.compile(
        "^scroll\\s+(?:up\\s+)?(?:(?:to|till|until)\\s+)?(?:the\\s+)?top\\b.*$", FLAGS);
    private static final Pattern SCROLL_DIRECTION = Pattern.compile(
        "^scroll\\s+(up|down|left|right)\\b(?:\\D*(\\d+))?.*$", FLAGS);
    private static final Pattern SCROLL_ELEMENT = Pattern.compile(
        "^scroll\\s+(?:to|into\\s+view(?:\\s+of)?)\\s+(.+)$", FLAGS);

    // Actions
    private static final Pattern CLICK = Pattern.compile("^click(?:\\s+on)?\\s+(.+)$", FLAGS);
    private static final Pattern TYPE_QUOTED = Pattern.compile(
        "^(?:type|enter)\\s+([\"'])(.*?)\\1\\s+into\\s+(.+)$", FLAGS);
    private static final Pattern TYPE = Pattern.compile("^(?:type|enter)\\s+(.+?)\\s+into\\s+(.+)$", FLAGS);
    private static final Pattern SELECT_QUOTED = Pattern.compile(
        "^select\\s+([\"'])(.*?)\\1\\s+from\\s+(.+)$", FLAGS);
    private static final Pattern SELECT = Pattern.compile("^select\\s+(.+?)\\s+from\\s+(.+)$", FLAGS);
    private static final Pattern VERIFY_APPEARS = Pattern.compile(
        "^(?:verify|check)(?:\\s+that)?\\s+(.+?)\\s+appears\\b.*$", FLAGS);
    private static final Pattern VERIFY_CONTAINS = Pattern.compile(
        "^(?:verify|check)(?:\\s+that)?\\s+(.+?)\\s+(?:contains|shows)\\s+(.+)$", FLAGS);
    private static final Pattern WAIT = Pattern.compile("^wait\\b.*$", FLAGS);
    private static final Pattern WAIT_SECONDS = Pattern.compile("\\bfor\\s+(\\d+)\\s+seconds?\\b", FLAGS);
    private static final Pattern HOVER = Pattern.compile("^(?:hover(?:\\s+(?:over|on))?|move\\s+to)\\s+(.+)$", FLAGS);
    private static final Pattern ASSERT = Pattern.compile(
        "^(?:assert|expect)(?:\\s+that)?\\s+(.+?)\\s+contains\\s+(.+)$", FLAGS);

    private static final Pattern LEADING_ARTICLE = Pattern.compile("^(?:the|a|an)(?:\\s+|$)");
    private static final Pattern TRAILING_APPEARS = Pattern.compile("\\s+appears?$");

    // Structured-form action names
    private static final Map<String, ActionKind> ACTION_NAMES = Map.ofEntries(
        Map.entry("click", ActionKind.CLICK),
        Map.entry("type", ActionKind.TYPE),
        Map.entry("enter", ActionKind.TYPE),
        Map.entry("fill", ActionKind.TYPE),
        Map.entry("select", ActionKind.SELECT),
        Map.entry("verify", ActionKind.VERIFY),
        Map.entry("check", ActionKind.VERIFY),
        Map.entry("wait", ActionKind.WAIT),
        Map.entry("scroll", ActionKind.SCROLL),
        Map.entry("hover", ActionKind.HOVER),
        Map.entry("move", ActionKind.HOVER),
        Map.entry("assert", ActionKind.ASSERT),
        Map.entry("expect", ActionKind.ASSERT)
    );

    public static final String TARGET_PAGE = "page";
    public static final String TARGET_BOTTOM = "down till end";
    public static final String TARGET_TOP = "up till top";

    private final ExecutionListener listener;
    private final int               defaultTimeoutSeconds;

    public StepParser(ExecutionListener listener, int defaultTimeoutSeconds) {
        this.listener              = listener != null ? listener : ExecutionListener.NOOP;
        this.defaultTimeoutSeconds = defaultTimeoutSeconds;
    }

    public StepParser(ExecutionListener listener) {
        this(listener, Step.DEFAULT_TIMEOUT_SECONDS);
    }

    public StepParser() {
        this(ExecutionListener.NOOP);
    }

    // ── Text form ─────────────────────────────────────────────────────────────

    public ParseOutcome parseStep(String raw) {
        ParseOutcome outcome = compile(raw);
        if (!outcome.isStep()) listener.onParseWarning(outcome.getWarning());
        return outcome;
    }

    private ParseOutcome compile(String raw) {
        if (raw == null || raw.isBlank()) {
            return ParseOutcome.warning(raw, "Empty step");
        }
        String text = raw.trim();
        Matcher m;

        // Scroll first: "scroll to the top" must not become an element scroll
        if (SCROLL_END.matcher(text).matches()) {
            return step(text, ActionKind.SCROLL, TARGET_BOTTOM, null, defaultTimeoutSeconds);
        }
        if (SCROLL_TOP.matcher(text).matches()) {
            return step(text, ActionKind.SCROLL, TARGET_TOP, null, defaultTimeoutSeconds);
        }
        if ((m = SCROLL_DIRECTION.matcher(text)).matches()) {
            return step(text, ActionKind.SCROLL, m.group(1), m.group(2), defaultTimeoutSeconds);
        }
        if ((m = SCROLL_ELEMENT.matcher(text)).matches()) {
            return step(text, ActionKind.SCROLL, m.group(1), null, defaultTimeoutSeconds);
        }

        if ((m = CLICK.matcher(text)).matches()) {
            return step(text, ActionKind.CLICK, m.group(1), null, defaultTimeoutSeconds);
        }

        if ((m = TYPE_QUOTED.matcher(text)).matches()) {
            return step(text, ActionKind.TYPE, m.group(3), m.group(2), defaultTimeoutSeconds);
        }
        if ((m = TYPE.matcher(text)).matches()) {
            return step(text, ActionKind.TYPE, m.group(2), unquote(m.group(1)), defaultTimeoutSeconds);
        }

        if ((m = SELECT_QUOTED.matcher(text)).matches()) {
            return step(text, ActionKind.SELECT, m.group(3), m.group(2), defaultTimeoutSeconds);
        }
        if ((m = SELECT.matcher(text)).matches()) {
            return step(text, ActionKind.SELECT, m.group(2), unquote(m.group(1)), defaultTimeoutSeconds);
        }

        if ((m = VERIFY_APPEARS.matcher(text)).matches()) {
            return step(text, ActionKind.VERIFY, m.group(1), null, defaultTimeoutSeconds);
        }
        if ((m = VERIFY_CONTAINS.matcher(text)).matches()) {
            return step(text, ActionKind.VERIFY, m.group(1), unquote(m.group(2)), defaultTimeoutSeconds);
        }

        if (WAIT.matcher(text).matches()) {
            return parseWait(text);
        }

        if ((m = HOVER.matcher(text)).matches()) {
            return step(text, ActionKind.HOVER, m.group(1), null, defaultTimeoutSeconds);
        }

        if ((m = ASSERT.matcher(text)).matches()) {
            return step(text, ActionKind.ASSERT, m.group(1), unquote(m.group(2)), defaultTimeoutSeconds);
        }

        return ParseOutcome.warning(text, "Unrecognized step grammar");
    }

    private ParseOutcome parseWait(String text) {
        Matcher seconds = WAIT_SECONDS.matcher(text);
        int timeout = defaultTimeoutSeconds;
        if (seconds.find()) {
            try {
                timeout = Integer.parseInt(seconds.group(1));
            } catch (NumberFormatException e) {
                return ParseOutcome.warning(text, "Wait time out of range: " + seconds.group(1));
            }
        }

        String lower = text.toLowerCase(Locale.ROOT);
        String target = TARGET_PAGE;
        int at = lower.indexOf(" for the ");
        int skip = " for the ".length();
        if (at < 0) {
            at = lower.indexOf(" the ");
            skip = " the ".length();
        }
        if (at >= 0) {
            String rest = lower.substring(at + skip);
            int cut = rest.indexOf(" for ");
            target = (cut >= 0 ? rest.substring(0, cut) : rest).trim();
        }
        return step(text, ActionKind.WAIT, target, null, timeout);
    }

    // ── Structured form ───────────────────────────────────────────────────────

    /**
     * Compiles the map form. The action name is required; {@code timeout} falls
     * back to {@code automation.timeout}, then to the default.
     */
    public ParseOutcome parseStep(StepSpec spec) {
        ParseOutcome outcome = compile(spec);
        if (!outcome.isStep()) listener.onParseWarning(outcome.getWarning());
        return outcome;
    }

    private ParseOutcome compile(StepSpec spec) {
        String raw = rawTextOf(spec);
        if (spec.getAction() == null || spec.getAction().isBlank()) {
            return ParseOutcome.warning(raw, "Missing action");
        }
        ActionKind action = ACTION_NAMES.get(spec.getAction().trim().toLowerCase(Locale.ROOT));
        if (action == null) {
            return ParseOutcome.warning(raw, "Unknown action '" + spec.getAction() + "'");
        }

        String target = spec.getTarget();
        if ((target == null || target.isBlank()) && action == ActionKind.WAIT) {
            target = TARGET_PAGE;
        }
        if (target == null || target.isBlank()) {
            return ParseOutcome.warning(raw, "Missing target for " + action.name().toLowerCase(Locale.ROOT));
        }
        target = normalizeTarget(target);
        if (action == ActionKind.VERIFY) {
            target = TRAILING_APPEARS.matcher(target).replaceFirst("");
        }
        if (target.isEmpty()) {
            return ParseOutcome.warning(raw, "Empty target");
        }
        if ((action == ActionKind.TYPE || action == ActionKind.SELECT || action == ActionKind.ASSERT)
                && spec.getValue() == null) {
            return ParseOutcome.warning(raw, "Missing value for " + action.name().toLowerCase(Locale.ROOT));
        }

        AutomationSpec automation = spec.getAutomation();
        int timeout = spec.getTimeout() != null ? spec.getTimeout()
            : automation != null && automation.getTimeout() != null ? automation.getTimeout()
            : defaultTimeoutSeconds;
        if (timeout < 0) {
            return ParseOutcome.warning(raw, "Negative timeout " + timeout);
        }

        return ParseOutcome.step(Step.builder()
            .rawText(raw)
            .action(action)
            .target(target)
            .value(spec.getValue())
            .timeoutSeconds(timeout)
            .description(spec.getDescription())
            .humanInstruction(spec.getHumanInstruction())
            .automation(automation)
            .build());
    }

    private static String rawTextOf(StepSpec spec) {
        if (spec.getDescription() != null && !spec.getDescription().isBlank()) {
            return spec.getDescription().trim();
        }
        StringBuilder sb = new StringBuilder();
        if (spec.getAction() != null) sb.append(spec.getAction().trim());
        if (spec.getTarget() != null) sb.append(' ').append(spec.getTarget().trim());
        return sb.toString().trim();
    }

    /** Forwards a warning raised outside the parser, such as a malformed YAML step. */
    public void report(ParseWarning warning) {
        listener.onParseWarning(warning);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private static ParseOutcome step(String raw, ActionKind action, String target, String value, int timeout) {
        String normalized = normalizeTarget(target);
        if (normalized.isEmpty()) {
            return ParseOutcome.warning(raw, "Empty target for " + action.name().toLowerCase(Locale.ROOT));
        }
        return ParseOutcome.step(Step.builder()
            .rawText(raw)
            .action(action)
            .target(normalized)
            .value(value)
            .timeoutSeconds(timeout)
            .build());
    }

    /** Trims, lowercases, collapses whitespace, strips quotes and a leading article. */
    public static String normalizeTarget(String target) {
        if (target == null) return "";
        String t = unquote(target.trim()).toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();
        return LEADING_ARTICLE.matcher(t).replaceFirst("").trim();
    }

    static String unquote(String value) {
        String v = value.trim();
        if (v.length() >= 2) {
            char first = v.charAt(0);
            char last = v.charAt(v.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return v.substring(1, v.length() - 1);
            }
        }
        return v;
    }
}
