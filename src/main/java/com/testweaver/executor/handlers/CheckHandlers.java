package com.testweaver.executor.handlers;

import com.testweaver.core.ActionException;
import com.testweaver.core.ValidationException;
import com.testweaver.driver.BrowserDriver;
import com.testweaver.driver.DriverException;
import com.testweaver.driver.ElementHandle;
import com.testweaver.executor.HandlesAction;
import com.testweaver.executor.PageState;
import com.testweaver.executor.StepContext;
import com.testweaver.executor.StepHandler;
import com.testweaver.model.ActionKind;
import com.testweaver.model.Step;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// ── VERIFY ────────────────────────────────────────────────────────────────────

/**
 * "X appears" waits for visibility; "X contains V" waits for the text.
 * A target mentioning "new content" checks that the page grew since the last check.
 */
@HandlesAction(ActionKind.VERIFY)
class VerifyHandler implements StepHandler {

    private static final Logger log = LoggerFactory.getLogger(VerifyHandler.class);
    static final String NEW_CONTENT = "new content";
    static final String HEIGHT_SCRIPT = "return document.body.scrollHeight;";
    private static final long POLL_MS = 250;

    @Override
    public boolean requiresElement(Step step) {
        return !isNewContentCheck(step);
    }

    @Override
    public void execute(StepContext ctx) {
        Step step = ctx.getStep();
        if (isNewContentCheck(step)) {
            verifyNewContent(ctx);
            return;
        }
        if (step.hasValue()) {
            TextChecks.requireText(ctx, step.getValue());
            return;
        }
        ElementHandle el = ctx.getElement();
        if (!ctx.getDriver().waitVisible(el, ctx.stepTimeout())) {
            throw new ValidationException("'" + step.getTarget() + "' is present (" + el.describe() +
                ") but did not become visible within " + step.effectiveTimeoutSeconds() + "s");
        }
    }

    static boolean isNewContentCheck(Step step) {
        return step.getTarget().contains(NEW_CONTENT);
    }

    private void verifyNewContent(StepContext ctx) {
        PageState state = ctx.getPageState();
        long before = state.getLastScrollHeight();
        long attempts = Math.max(1, ctx.stepTimeout().toMillis() / POLL_MS);
        long height = before;
        for (long i = 0; i < attempts; i++) {
            height = scrollHeight(ctx.getDriver());
            if (height > before) {
                log.debug("VerifyHandler: page grew from {} to {}px", before, height);
                state.setLastScrollHeight(height);
                return;
            }
            try {
                ctx.getSleeper().sleep(POLL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ActionException("Interrupted while waiting for new content", e);
            }
        }
        state.setLastScrollHeight(height);
        throw new ValidationException("No new content loaded: page height stayed at " + height + "px");
    }

    static long scrollHeight(BrowserDriver driver) {
        try {
            Object result = driver.evaluateScript(HEIGHT_SCRIPT);
            return result instanceof Number ? ((Number) result).longValue() : -1;
        } catch (DriverException e) {
            throw new ActionException("Could not measure page height: " + e.getMessage(), e);
        }
    }
}

// ── ASSERT ────────────────────────────────────────────────────────────────────

@HandlesAction(ActionKind.ASSERT)
class AssertHandler implements StepHandler {

    @Override
    public void execute(StepContext ctx) {
        String expected = ctx.getStep().getValue();
        if (expected == null) {
            throw new ValidationException("Nothing to assert for '" + ctx.getStep().getTarget() + "'");
        }
        TextChecks.requireText(ctx, expected);
    }
}

// ── Shared ────────────────────────────────────────────────────────────────────

final class TextChecks {

    private TextChecks() {}

    /** Case-sensitive containment, waited for up to the step timeout. */
    static void requireText(StepContext ctx, String expected) {
        ElementHandle el = ctx.getElement();
        BrowserDriver driver = ctx.getDriver();
        if (driver.waitForText(el, expected, ctx.stepTimeout())) return;

        String actual;
        try {
            actual = driver.textOf(el);
        } catch (DriverException e) {
            actual = "<unreadable: " + e.getMessage() + ">";
        }
        throw new ValidationException("'" + ctx.getStep().getTarget() + "' does not contain '" + expected +
            "' (actual text: '" + actual + "')");
    }
}
