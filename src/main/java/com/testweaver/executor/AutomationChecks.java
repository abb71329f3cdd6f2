package com.testweaver.executor;

import com.testweaver.core.ActionException;
import com.testweaver.core.ValidationException;
import com.testweaver.driver.BrowserDriver;
import com.testweaver.driver.ElementHandle;
import com.testweaver.driver.MalformedSelectorException;
import com.testweaver.driver.SelectorKind;
import com.testweaver.model.AssertionSpec;
import com.testweaver.model.AutomationSpec;
import com.testweaver.model.Step;
import com.testweaver.model.WaitCondition;

import java.time.Duration;
import java.util.Optional;

/**
 * The machine-checkable parts of a dual-mode step: the {@code wait_for} condition
 * applied to the resolved element and the post-action {@code assertions}.
 */
class AutomationChecks {

    private final BrowserDriver driver;

    AutomationChecks(BrowserDriver driver) {
        this.driver = driver;
    }

    /**
     * Enforces {@code wait_for} on the element resolved for the step. Presence is
     * already guaranteed by resolution.
     */
    void applyWaitCondition(Step step, ElementHandle element, Duration wait) {
        AutomationSpec automation = step.getAutomation();
        if (automation == null || element == null) return;
        WaitCondition condition = automation.getWaitFor();
        if (condition == WaitCondition.ELEMENT_PRESENT) return;

        if (!driver.waitVisible(element, wait)) {
            throw new ActionException("'" + step.getTarget() + "' (" + element.describe() +
                ") did not become visible");
        }
        if (condition == WaitCondition.ELEMENT_CLICKABLE && !driver.isEnabled(element)) {
            throw new ActionException("'" + step.getTarget() + "' (" + element.describe() +
                ") is visible but not clickable");
        }
    }

    /**
     * Runs every assertion in order and fails on the first that does not hold.
     */
    void runAssertions(Step step) {
        AutomationSpec automation = step.getAutomation();
        if (automation == null) return;
        Duration timeout = Duration.ofSeconds(step.effectiveTimeoutSeconds());
        for (AssertionSpec assertion : automation.getAssertions()) {
            check(assertion, timeout);
        }
    }

    private void check(AssertionSpec assertion, Duration timeout) {
        String selector = assertion.getSelector();
        if (selector == null) {
            throw new ValidationException("Assertion " + assertion.getType().toYaml() + " has no selector");
        }
        SelectorKind kind = SelectorKind.infer(selector);
        switch (assertion.getType()) {
            case ELEMENT_PRESENT:
                find(kind, selector, timeout).orElseThrow(() ->
                    new ValidationException("Expected element " + selector + " to be present"));
                break;
            case ELEMENT_VISIBLE: {
                ElementHandle el = find(kind, selector, timeout).orElseThrow(() ->
                    new ValidationException("Expected element " + selector + " to be visible, but it is absent"));
                if (!driver.waitVisible(el, timeout)) {
                    throw new ValidationException("Expected element " + selector + " to be visible");
                }
                break;
            }
            case TEXT_PRESENT: {
                String text = assertion.getText();
                ElementHandle el = find(kind, selector, timeout).orElseThrow(() ->
                    new ValidationException("Expected text '" + text + "' in " + selector + ", but it is absent"));
                if (text == null || !driver.waitForText(el, text, timeout)) {
                    throw new ValidationException("Expected text '" + text + "' in " + selector +
                        " (actual: '" + driver.textOf(el) + "')");
                }
                break;
            }
            case ELEMENT_COUNT: {
                Integer expected = assertion.getCount();
                int actual = count(kind, selector);
                if (expected == null || actual != expected) {
                    throw new ValidationException("Expected " + expected + " element(s) matching " + selector +
                        ", found " + actual);
                }
                break;
            }
            default:
                throw new ValidationException("Unsupported assertion " + assertion.getType());
        }
    }

    private Optional<ElementHandle> find(SelectorKind kind, String selector, Duration timeout) {
        try {
            return driver.findCandidate(kind, selector, timeout);
        } catch (MalformedSelectorException e) {
            throw new ValidationException("Assertion selector is malformed: " + selector);
        }
    }

    private int count(SelectorKind kind, String selector) {
        try {
            return driver.count(kind, selector);
        } catch (MalformedSelectorException e) {
            throw new ValidationException("Assertion selector is malformed: " + selector);
        }
    }
}
