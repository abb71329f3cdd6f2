package com.testweaver.executor.handlers;

import com.testweaver.core.ActionException;
import com.testweaver.driver.DriverException;
import com.testweaver.driver.ElementAction;
import com.testweaver.executor.HandlesAction;
import com.testweaver.executor.StepContext;
import com.testweaver.executor.StepHandler;
import com.testweaver.model.ActionKind;
import com.testweaver.model.Step;
import com.testweaver.model.StructureAnalysis;
import com.testweaver.parser.StepParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

// ── WAIT ──────────────────────────────────────────────────────────────────────

/**
 * "wait for N seconds" pauses for N seconds. Waiting for a named element is done
 * by the resolver before this handler runs, so there is nothing left to do.
 */
@HandlesAction(ActionKind.WAIT)
class WaitHandler implements StepHandler {

    private static final Logger log = LoggerFactory.getLogger(WaitHandler.class);

    @Override
    public boolean requiresElement(Step step) {
        return !StepParser.TARGET_PAGE.equals(step.getTarget()) || step.hasExplicitSelector();
    }

    @Override
    public void execute(StepContext ctx) {
        Step step = ctx.getStep();
        if (requiresElement(step)) {
            log.debug("WaitHandler: '{}' is present ({})", step.getTarget(), ctx.getElement().describe());
            return;
        }
        long waitMs = step.effectiveTimeoutSeconds() * 1000L;
        try {
            ctx.getSleeper().sleep(waitMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ActionException("Wait interrupted after less than " + waitMs + "ms", e);
        }
    }
}

// ── SCROLL ────────────────────────────────────────────────────────────────────

/**
 * Page scrolls (bottom, top, a direction with an optional pixel amount) and
 * scrolling an element into view.
 *
 * When the page is known to scroll inside a container (infinite-scroll feeds),
 * top and bottom scrolls move that container instead of the window.
 */
@HandlesAction(ActionKind.SCROLL)
class ScrollHandler implements StepHandler {

    private static final Logger log = LoggerFactory.getLogger(ScrollHandler.class);

    private static final Set<String> PAGE_TARGETS = Set.of(
        StepParser.TARGET_BOTTOM, StepParser.TARGET_TOP, "up", "down", "left", "right");

    static final String WINDOW_BOTTOM = "window.scrollTo(0, document.body.scrollHeight);";
    static final String WINDOW_TOP = "window.scrollTo(0, 0);";
    static final String WINDOW_BY = "window.scrollBy(arguments[0], arguments[1]);";
    static final String WINDOW_LEFT = "window.scrollTo(0, window.pageYOffset);";
    static final String WINDOW_RIGHT = "window.scrollTo(document.body.scrollWidth, window.pageYOffset);";
    static final String CONTAINER_BOTTOM =
        "var c = document.querySelector(arguments[0]);" +
        " if (!c) return false; c.scrollTo(0, c.scrollHeight); return true;";
    static final String CONTAINER_TOP =
        "var c = document.querySelector(arguments[0]);" +
        " if (!c) return false; c.scrollTo(0, 0); return true;";

    @Override
    public boolean requiresElement(Step step) {
        return !PAGE_TARGETS.contains(step.getTarget());
    }

    @Override
    public void execute(StepContext ctx) {
        Step step = ctx.getStep();
        try {
            if (requiresElement(step)) {
                ctx.getDriver().act(ctx.getElement(), ElementAction.SCROLL_INTO_VIEW, null);
                return;
            }
            switch (step.getTarget()) {
                case StepParser.TARGET_BOTTOM:
                    scrollEdge(ctx, CONTAINER_BOTTOM, WINDOW_BOTTOM);
                    break;
                case StepParser.TARGET_TOP:
                    scrollEdge(ctx, CONTAINER_TOP, WINDOW_TOP);
                    break;
                default:
                    scrollDirection(ctx, step.getTarget(), amount(step));
            }
        } catch (DriverException e) {
            throw new ActionException("Could not scroll " + step.getTarget() + ": " + e.getMessage(), e);
        }
    }

    private void scrollEdge(StepContext ctx, String containerScript, String windowScript) {
        StructureAnalysis.DynamicContent dynamic = ctx.getAnalysis().getDynamicContent();
        String container = dynamic.getScrollContainer();
        if (dynamic.isInfiniteScroll() && container != null) {
            Object moved = ctx.getDriver().evaluateScript(containerScript, container);
            if (Boolean.TRUE.equals(moved)) {
                log.debug("ScrollHandler: scrolled container {}", container);
                return;
            }
            log.debug("ScrollHandler: container {} not on page, scrolling the window", container);
        }
        ctx.getDriver().evaluateScript(windowScript);
    }

    private void scrollDirection(StepContext ctx, String direction, Integer amount) {
        if (amount == null) {
            switch (direction) {
                case "down":  scrollEdge(ctx, CONTAINER_BOTTOM, WINDOW_BOTTOM); return;
                case "up":    scrollEdge(ctx, CONTAINER_TOP, WINDOW_TOP); return;
                case "left":  ctx.getDriver().evaluateScript(WINDOW_LEFT); return;
                default:      ctx.getDriver().evaluateScript(WINDOW_RIGHT); return;
            }
        }
        long dx = 0;
        long dy = 0;
        switch (direction) {
            case "down":  dy = amount; break;
            case "up":    dy = -amount; break;
            case "left":  dx = -amount; break;
            default:      dx = amount; break;
        }
        ctx.getDriver().evaluateScript(WINDOW_BY, dx, dy);
    }

    private static Integer amount(Step step) {
        if (!step.hasValue()) return null;
        try {
            return Integer.parseInt(step.getValue().trim());
        } catch (NumberFormatException e) {
            throw new ActionException("Scroll amount must be a number of pixels, got '" + step.getValue() + "'", e);
        }
    }
}
