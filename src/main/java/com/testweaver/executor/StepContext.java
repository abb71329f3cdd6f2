package com.testweaver.executor;

import com.testweaver.core.ActionException;
import com.testweaver.core.TestWeaverConfig;
import com.testweaver.driver.BrowserDriver;
import com.testweaver.driver.ElementHandle;
import com.testweaver.model.Step;
import com.testweaver.model.StructureAnalysis;

import java.time.Duration;

/**
 * Everything a {@link StepHandler} needs for one step.
 */
public class StepContext {

    private final BrowserDriver     driver;
    private final Step              step;
    private final ElementHandle     element;   // null when the handler needs no element
    private final StructureAnalysis analysis;
    private final PageState         pageState;
    private final TestWeaverConfig  config;
    private final Sleeper           sleeper;

    public StepContext(BrowserDriver driver, Step step, ElementHandle element,
                       StructureAnalysis analysis, PageState pageState,
                       TestWeaverConfig config, Sleeper sleeper) {
        this.driver    = driver;
        this.step      = step;
        this.element   = element;
        this.analysis  = analysis;
        this.pageState = pageState;
        this.config    = config;
        this.sleeper   = sleeper;
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public BrowserDriver getDriver()            { return driver; }
    public Step getStep()                       { return step; }
    public StructureAnalysis getAnalysis()      { return analysis; }
    public PageState getPageState()             { return pageState; }
    public TestWeaverConfig getConfig()         { return config; }
    public Sleeper getSleeper()                 { return sleeper; }

    /**
     * The resolved element.
     *
     * @throws IllegalStateException if the handler declared it needs no element
     */
    public ElementHandle getElement() {
        if (element == null) {
            throw new IllegalStateException("No element was resolved for " + step);
        }
        return element;
    }

    public Duration stepTimeout() {
        return Duration.ofSeconds(step.effectiveTimeoutSeconds());
    }

    public Duration interactWait() {
        return Duration.ofMillis(config.getInteractWaitMs());
    }

    // ── Shared checks ─────────────────────────────────────────────────────────

    /**
     * Fails the step unless the resolved element becomes visible within the interact
     * wait and is enabled.
     */
    public void requireInteractable() {
        ElementHandle el = getElement();
        if (!driver.waitVisible(el, interactWait())) {
            throw new ActionException("'" + step.getTarget() + "' was found (" + el.describe() +
                ") but is not visible");
        }
        if (!driver.isEnabled(el)) {
            throw new ActionException("'" + step.getTarget() + "' was found (" + el.describe() +
                ") but is disabled");
        }
    }
}
