package com.testweaver.core;

import com.testweaver.locator.SelectorCandidate;
import com.testweaver.model.ExecutionState;
import com.testweaver.model.ParseWarning;
import com.testweaver.model.ScenarioResult;
import com.testweaver.model.Step;
import com.testweaver.model.StepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link ExecutionListener}: writes every event to SLF4J.
 * Probes go to DEBUG, step and scenario outcomes to INFO, problems to WARN.
 */
public class LoggingExecutionListener implements ExecutionListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingExecutionListener.class);

    @Override
    public void onParseWarning(ParseWarning warning) {
        log.warn("Skipping step '{}': {}", warning.getRawText(), warning.getReason());
    }

    @Override
    public void onStateChange(String scenario, ExecutionState from, ExecutionState to) {
        log.debug("Scenario '{}': {} -> {}", scenario, from, to);
    }

    @Override
    public void onProbe(String target, SelectorCandidate candidate, long waitMs) {
        log.debug("Resolving '{}': probing {} (wait {}ms)", target, candidate, waitMs);
    }

    @Override
    public void onMalformedSelector(String target, SelectorCandidate candidate, String message) {
        log.debug("Resolving '{}': skipped malformed selector {} ({})", target, candidate, message);
    }

    @Override
    public void onResolved(String target, SelectorCandidate candidate, int attempt, int planned) {
        log.info("Resolved '{}' via {} (candidate {}/{})", target, candidate, attempt, planned);
    }

    @Override
    public void onResolutionFailed(String target, int attempted, int planned) {
        log.warn("Could not resolve '{}' after {}/{} candidate(s)", target, attempted, planned);
    }

    @Override
    public void onStepStarted(int index, Step step) {
        log.info("Step {}: {}", index + 1, step.getRawText());
    }

    @Override
    public void onStepFinished(StepResult result) {
        if (result.isSucceeded()) {
            log.info("Step {} passed ({}ms)", result.getIndex() + 1, result.getElapsedMs());
        } else {
            log.error("Step {} failed [{}]: {}", result.getIndex() + 1, result.getErrorKind(),
                result.getDiagnostic());
        }
    }

    @Override
    public void onScenarioFinished(ScenarioResult result) {
        if (result.isSuccessful()) {
            log.info("Scenario '{}' COMPLETED: {} step(s) in {}ms",
                result.getName(), result.getResults().size(), result.getElapsedMs());
        } else {
            log.warn("Scenario '{}' ABORTED at step {} [{}] after {}ms", result.getName(),
                result.getAbortedAtIndex() != null ? result.getAbortedAtIndex() + 1 : "-",
                result.getFailureKind(), result.getElapsedMs());
        }
    }

    @Override
    public void onWarning(String message, Throwable cause) {
        if (cause != null) {
            log.warn("{}: {}", message, cause.getMessage());
            log.debug("Cause", cause);
        } else {
            log.warn(message);
        }
    }
}
