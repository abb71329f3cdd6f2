package com.testweaver.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one scenario run.
 *
 * {@code results} holds exactly the steps that were attempted. When the run aborts,
 * {@code abortedAtIndex} is the index of the failing step, or {@code null} when no
 * step failed: the run never got past navigation or was cancelled between steps.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ScenarioResult {

    private final String           name;
    private final List<StepResult> results;
    private final ExecutionState   finalState;
    private final Integer          abortedAtIndex;
    private final ErrorKind        failureKind;
    private final String           failureDiagnostic;
    private final Instant          startedAt;
    private final long             elapsedMs;

    private ScenarioResult(String name, List<StepResult> results, ExecutionState finalState,
                           Integer abortedAtIndex, ErrorKind failureKind, String failureDiagnostic,
                           Instant startedAt, long elapsedMs) {
        this.name              = name;
        this.results           = List.copyOf(results);
        this.finalState        = finalState;
        this.abortedAtIndex    = abortedAtIndex;
        this.failureKind       = failureKind;
        this.failureDiagnostic = failureDiagnostic;
        this.startedAt         = startedAt;
        this.elapsedMs         = elapsedMs;
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static ScenarioResult completed(String name, List<StepResult> results,
                                           Instant startedAt, long elapsedMs) {
        return new ScenarioResult(name, results, ExecutionState.COMPLETED,
            null, null, null, startedAt, elapsedMs);
    }

    public static ScenarioResult aborted(String name, List<StepResult> results, Integer abortedAtIndex,
                                         ErrorKind kind, String diagnostic,
                                         Instant startedAt, long elapsedMs) {
        return new ScenarioResult(name, results, ExecutionState.ABORTED,
            abortedAtIndex, kind, diagnostic, startedAt, elapsedMs);
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public String getName()                 { return name; }
    public List<StepResult> getResults()    { return results; }
    public ExecutionState getFinalState()   { return finalState; }
    public boolean isAborted()              { return finalState == ExecutionState.ABORTED; }
    public Integer getAbortedAtIndex()      { return abortedAtIndex; }
    public ErrorKind getFailureKind()       { return failureKind; }
    public String getFailureDiagnostic()    { return failureDiagnostic; }
    public Instant getStartedAt()           { return startedAt; }
    public long getElapsedMs()              { return elapsedMs; }

    public boolean isSuccessful() {
        return finalState == ExecutionState.COMPLETED;
    }

    public long getSucceededCount() {
        return results.stream().filter(StepResult::isSucceeded).count();
    }

    @Override
    public String toString() {
        return "ScenarioResult{'" + name + "' " + finalState + ", steps=" + results.size() +
            (abortedAtIndex != null ? ", abortedAt=" + abortedAtIndex : "") +
            (failureKind != null ? ", " + failureKind : "") + "}";
    }
}
