package com.testweaver.executor;

import com.testweaver.core.ExecutionListener;
import com.testweaver.core.NavigationException;
import com.testweaver.core.StepExecutionException;
import com.testweaver.core.TestWeaverConfig;
import com.testweaver.driver.BrowserDriver;
import com.testweaver.driver.DriverException;
import com.testweaver.driver.ElementHandle;
import com.testweaver.hints.StructureHintProvider;
import com.testweaver.locator.ElementResolver;
import com.testweaver.locator.ResolutionRequest;
import com.testweaver.locator.StrategyRegistry;
import com.testweaver.model.ActionKind;
import com.testweaver.model.AutomationSpec;
import com.testweaver.model.ErrorKind;
import com.testweaver.model.ExecutionState;
import com.testweaver.model.Scenario;
import com.testweaver.model.ScenarioResult;
import com.testweaver.model.Step;
import com.testweaver.model.StepResult;
import com.testweaver.model.StructureAnalysis;
import com.testweaver.model.StructureHint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one {@link Scenario} against a live page.
 *
 * ## Execution model
 *
 *   IDLE → NAVIGATING → RUNNING → COMPLETED | ABORTED
 *
 *   1. Structure hints for the URL are fetched. A failing provider is reported and
 *      the run continues without hints.
 *   2. The URL is opened and {@code document.readyState} polled until "complete",
 *      bounded by the page load timeout. Failure aborts before any step runs.
 *   3. Steps run in order. For each one the target is resolved when the handler
 *      needs an element, the handler runs, then any automation assertions.
 *   4. The first failing step is recorded with its error kind and diagnostic, a
 *      screenshot is requested, and the run aborts. Later steps never run.
 *   5. A settle delay separates successful steps.
 *
 * Cancellation is cooperative: {@link #cancel()} may be called from any thread and
 * is honoured before the next step starts.
 *
 * One executor drives one browser session; it is not meant to run scenarios
 * concurrently.
 */
public class ScenarioExecutor {

    private static final Logger log = LoggerFactory.getLogger(ScenarioExecutor.class);
    private static final long READY_POLL_MS = 100;
    private static final String READY_COMPLETE = "complete";

    private final BrowserDriver         driver;
    private final ElementResolver       resolver;
    private final StepHandlerRegistry   handlers;
    private final StructureHintProvider hintProvider;
    private final TestWeaverConfig      config;
    private final ExecutionListener     listener;
    private final Sleeper               sleeper;
    private final AutomationChecks      automationChecks;

    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private volatile ExecutionState state = ExecutionState.IDLE;

    public ScenarioExecutor(BrowserDriver driver,
                            ElementResolver resolver,
                            StepHandlerRegistry handlers,
                            StructureHintProvider hintProvider,
                            TestWeaverConfig config,
                            ExecutionListener listener,
                            Sleeper sleeper) {
        this.driver           = driver;
        this.resolver         = resolver;
        this.handlers         = handlers;
        this.hintProvider     = hintProvider != null ? hintProvider : StructureHintProvider.none();
        this.config           = config;
        this.listener         = listener != null ? listener : ExecutionListener.NOOP;
        this.sleeper          = sleeper != null ? sleeper : Sleeper.SYSTEM;
        this.automationChecks = new AutomationChecks(driver);
    }

    public ScenarioExecutor(BrowserDriver driver, TestWeaverConfig config,
                            StructureHintProvider hintProvider, ExecutionListener listener) {
        this(driver, new ElementResolver(driver, new StrategyRegistry(), listener), new StepHandlerRegistry(),
            hintProvider, config, listener, Sleeper.SYSTEM);
    }

    // ── Primary API ───────────────────────────────────────────────────────────

    public ScenarioResult run(Scenario scenario, String url) {
        String name = scenario.getName();
        Instant startedAt = Instant.now();
        long start = System.nanoTime();
        List<StepResult> results = new ArrayList<>();
        log.info("ScenarioExecutor: Running '{}' ({} step(s)) on {}", name, scenario.getSteps().size(), url);

        try {
            transition(name, ExecutionState.NAVIGATING);
            StructureAnalysis analysis = analyze(url);
            List<StructureHint> hints = analysis.toHints();
            try {
                navigate(url);
            } catch (NavigationException e) {
                return finish(ScenarioResult.aborted(name, results, null, e.getErrorKind(),
                    e.getMessage(), startedAt, elapsedMs(start)));
            }

            PageState pageState = new PageState();
            pageState.setLastScrollHeight(initialHeight());
            transition(name, ExecutionState.RUNNING);

            List<Step> steps = scenario.getSteps();
            for (int i = 0; i < steps.size(); i++) {
                if (cancelRequested.get() || Thread.currentThread().isInterrupted()) {
                    return finish(ScenarioResult.aborted(name, results, null, ErrorKind.CANCELLED,
                        "Cancelled before step " + (i + 1), startedAt, elapsedMs(start)));
                }

                Step step = steps.get(i);
                listener.onStepStarted(i, step);
                StepResult result = executeStep(i, step, hints, analysis, pageState);
                if (!result.isSucceeded()) {
                    result = withScreenshot(result, name, i);
                    results.add(result);
                    listener.onStepFinished(result);
                    return finish(ScenarioResult.aborted(name, results, i, result.getErrorKind(),
                        result.getDiagnostic(), startedAt, elapsedMs(start)));
                }
                results.add(result);
                listener.onStepFinished(result);

                if (i < steps.size() - 1) settle();
            }
            return finish(ScenarioResult.completed(name, results, startedAt, elapsedMs(start)));
        } finally {
            cancelRequested.set(false);
        }
    }

    /**
     * Requests that the current run stop before its next step. Safe to call from
     * any thread. A request made while idle applies to the next run.
     */
    public void cancel() {
        cancelRequested.set(true);
        log.info("ScenarioExecutor: Cancellation requested");
    }

    public ExecutionState getState() {
        return state;
    }

    // ── Step execution ────────────────────────────────────────────────────────

    private StepResult executeStep(int index, Step step, List<StructureHint> hints,
                                   StructureAnalysis analysis, PageState pageState) {
        long start = System.nanoTime();
        StepHandler handler = handlers.handlerFor(step.getAction());
        try {
            if (!isAssertionOnly(step)) {
                ElementHandle element = null;
                if (handler.requiresElement(step)) {
                    ResolutionRequest request = new ResolutionRequest(step.getTarget(), hints,
                        step.hasExplicitSelector() ? step.getAutomation().getSelector() : null);
                    element = resolver.resolve(request, step.effectiveTimeoutSeconds() * 1000L);
                    automationChecks.applyWaitCondition(step, element, Duration.ofMillis(config.getInteractWaitMs()));
                }
                handler.execute(new StepContext(driver, step, element, analysis, pageState, config, sleeper));
            }
            automationChecks.runAssertions(step);
            return StepResult.success(step, index, elapsedMs(start));
        } catch (StepExecutionException e) {
            return StepResult.failure(step, index, e.getErrorKind(),
                FailureDiagnostics.describe(step, e, analysis), elapsedMs(start));
        } catch (DriverException e) {
            return StepResult.failure(step, index, ErrorKind.ACTION_ERROR,
                FailureDiagnostics.describe(step, e, analysis), elapsedMs(start));
        } catch (RuntimeException e) {
            log.error("ScenarioExecutor: Unexpected failure in step {}: {}", index + 1, e.getMessage(), e);
            return StepResult.failure(step, index, ErrorKind.ACTION_ERROR,
                FailureDiagnostics.describe(step, e, analysis), elapsedMs(start));
        }
    }

    /**
     * A verify step that carries assertions but no selector is checked by its
     * assertions alone; its target is descriptive text.
     */
    private static boolean isAssertionOnly(Step step) {
        AutomationSpec automation = step.getAutomation();
        return step.getAction() == ActionKind.VERIFY
            && automation != null
            && !automation.hasSelector()
            && !automation.getAssertions().isEmpty();
    }

    // ── Navigation ────────────────────────────────────────────────────────────

    private StructureAnalysis analyze(String url) {
        try {
            StructureAnalysis analysis = hintProvider.analyze(url);
            return analysis != null ? analysis : StructureAnalysis.empty();
        } catch (RuntimeException e) {
            listener.onWarning("Structure hints unavailable for " + url + ", continuing without hints", e);
            return StructureAnalysis.empty();
        }
    }

    private void navigate(String url) {
        if (url == null || url.isBlank()) {
            throw new NavigationException("No URL to open");
        }
        try {
            driver.navigate(url);
        } catch (DriverException e) {
            throw new NavigationException("Could not open " + url + ": " + e.getMessage(), e);
        }

        long attempts = Math.max(1, TimeUnit.SECONDS.toMillis(config.getPageLoadTimeoutSeconds()) / READY_POLL_MS);
        String readyState = null;
        for (long i = 0; i < attempts; i++) {
            try {
                readyState = driver.readyState();
            } catch (DriverException e) {
                throw new NavigationException("Could not read page state of " + url + ": " + e.getMessage(), e);
            }
            if (READY_COMPLETE.equals(readyState)) return;
            try {
                sleeper.sleep(READY_POLL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new NavigationException("Interrupted while waiting for " + url + " to load", e);
            }
        }
        throw new NavigationException(url + " did not finish loading within " +
            config.getPageLoadTimeoutSeconds() + "s (readyState=" + readyState + ")");
    }

    private long initialHeight() {
        try {
            Object height = driver.evaluateScript("return document.body.scrollHeight;");
            return height instanceof Number ? ((Number) height).longValue() : -1;
        } catch (DriverException e) {
            listener.onWarning("Could not measure initial page height", e);
            return -1;
        }
    }

    // ── Private helpers ───────────────────────────────────────────────────────

    private StepResult withScreenshot(StepResult result, String scenario, int index) {
        if (!config.isCaptureScreenshots()) return result;
        Path path = config.getScreenshotDir().resolve(fileSafe(scenario) + "_step_" + (index + 1) + "_error.png");
        try {
            return result.withScreenshot(driver.screenshot(path).toString());
        } catch (RuntimeException e) {
            listener.onWarning("Failure screenshot not captured", e);
            return result;
        }
    }

    private void settle() {
        long delay = config.getStepDelayMs();
        if (delay <= 0) return;
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            // Seen as a cancellation at the next step boundary
            Thread.currentThread().interrupt();
        }
    }

    private ScenarioResult finish(ScenarioResult result) {
        transition(result.getName(), result.getFinalState());
        listener.onScenarioFinished(result);
        return result;
    }

    private void transition(String scenario, ExecutionState next) {
        ExecutionState previous = state;
        state = next;
        listener.onStateChange(scenario, previous, next);
    }

    static String fileSafe(String name) {
        return name.replaceAll("[^A-Za-z0-9._-]+", "_");
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
