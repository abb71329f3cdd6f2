package com.testweaver.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of one attempted step. Immutable; use the static factories.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class StepResult {

    private final Step      step;
    private final int       index;
    private final boolean   succeeded;
    private final ErrorKind errorKind;    // null when succeeded
    private final String    diagnostic;   // null when succeeded
    private final long      elapsedMs;
    private final String    screenshotPath;

    private StepResult(Step step, int index, boolean succeeded, ErrorKind errorKind,
                       String diagnostic, long elapsedMs, String screenshotPath) {
        this.step           = step;
        this.index          = index;
        this.succeeded      = succeeded;
        this.errorKind      = errorKind;
        this.diagnostic     = diagnostic;
        this.elapsedMs      = elapsedMs;
        this.screenshotPath = screenshotPath;
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static StepResult success(Step step, int index, long elapsedMs) {
        return new StepResult(step, index, true, null, null, elapsedMs, null);
    }

    public static StepResult failure(Step step, int index, ErrorKind kind,
                                     String diagnostic, long elapsedMs) {
        return new StepResult(step, index, false, kind, diagnostic, elapsedMs, null);
    }

    /** Returns a copy carrying the path of the failure screenshot. */
    public StepResult withScreenshot(String path) {
        return new StepResult(step, index, succeeded, errorKind, diagnostic, elapsedMs, path);
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public Step getStep()               { return step; }
    public int getIndex()               { return index; }
    public boolean isSucceeded()        { return succeeded; }
    public ErrorKind getErrorKind()     { return errorKind; }
    public String getDiagnostic()       { return diagnostic; }
    public long getElapsedMs()          { return elapsedMs; }
    public String getScreenshotPath()   { return screenshotPath; }

    @Override
    public String toString() {
        return succeeded
            ? "StepResult{#" + index + " OK " + elapsedMs + "ms}"
            : "StepResult{#" + index + " " + errorKind + " " + elapsedMs + "ms: " + diagnostic + "}";
    }
}
