package com.testweaver.core;

import com.testweaver.locator.SelectorCandidate;
import com.testweaver.model.ExecutionState;
import com.testweaver.model.ParseWarning;
import com.testweaver.model.ScenarioResult;
import com.testweaver.model.Step;
import com.testweaver.model.StepResult;

/**
 * Receives progress events from the parser, the resolver and the executor.
 *
 * Every method has an empty default so listeners implement only what they need.
 * {@link LoggingExecutionListener} forwards everything to SLF4J.
 */
public interface ExecutionListener {

    ExecutionListener NOOP = new ExecutionListener() {};

    default void onParseWarning(ParseWarning warning) {}

    default void onStateChange(String scenario, ExecutionState from, ExecutionState to) {}

    default void onProbe(String target, SelectorCandidate candidate, long waitMs) {}

    default void onMalformedSelector(String target, SelectorCandidate candidate, String message) {}

    default void onResolved(String target, SelectorCandidate candidate, int attempt, int planned) {}

    default void onResolutionFailed(String target, int attempted, int planned) {}

    default void onStepStarted(int index, Step step) {}

    default void onStepFinished(StepResult result) {}

    default void onScenarioFinished(ScenarioResult result) {}

    /** Non-fatal problems: hint provider failures, screenshot failures. */
    default void onWarning(String message, Throwable cause) {}
}
