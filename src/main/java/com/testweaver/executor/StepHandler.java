package com.testweaver.executor;

import com.testweaver.model.Step;

/**
 * Performs one kind of step against the browser.
 *
 * <h3>Registration</h3>
 * Annotate the class with {@link HandlesAction}, give it a no-arg constructor and
 * put it in {@code com.testweaver.executor.handlers}.
 *
 * <h3>Implementation rules</h3>
 * <ul>
 *   <li>Return normally on success. Signal failure by throwing a
 *       {@link com.testweaver.core.StepExecutionException} subclass.</li>
 *   <li>Bound every wait by the step's timeout or the configured interact wait.</li>
 *   <li>Be stateless. Per-run state lives in {@link PageState}.</li>
 * </ul>
 */
public interface StepHandler {

    void execute(StepContext context);

    /**
     * Whether the executor must resolve the step's target before calling
     * {@link #execute}. Handlers for page-level steps return false.
     */
    default boolean requiresElement(Step step) {
        return true;
    }
}
