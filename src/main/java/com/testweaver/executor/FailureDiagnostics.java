package com.testweaver.executor;

import com.testweaver.locator.ElementNotFoundException;
import com.testweaver.model.Step;
import com.testweaver.model.StructureAnalysis;

/**
 * Builds the human-readable diagnostic stored on a failed step.
 *
 * <pre>
 * Failed to execute: click on the checkout button
 * Could not find 'checkout button' after trying 24 of 24 candidate selector(s)
 * Suggested selector: #checkout-btn
 * Try:
 * 1. Adding a wait step before this action
 * 2. Checking that the element name matches the page text
 * 3. Verifying the element is visible on the page
 * </pre>
 */
final class FailureDiagnostics {

    private FailureDiagnostics() {}

    static String describe(Step step, RuntimeException failure, StructureAnalysis analysis) {
        StringBuilder sb = new StringBuilder("Failed to execute: ").append(step.getRawText());
        sb.append('\n').append(failure.getMessage());

        if (failure instanceof ElementNotFoundException) {
            ElementNotFoundException nf = (ElementNotFoundException) failure;
            if (nf.hasSuggestion()) {
                sb.append("\nSuggested selector: ").append(nf.getSuggestedSelector());
            }
            sb.append("\nTry:")
              .append("\n1. Adding a wait step before this action")
              .append("\n2. Checking that the element name matches the page text")
              .append("\n3. Verifying the element is visible on the page");
            if (step.getHumanInstruction() != null) {
                sb.append("\nManual instruction: ").append(step.getHumanInstruction());
            }
        } else if (step.getTarget().contains("new content")) {
            StructureAnalysis.DynamicContent dynamic = analysis.getDynamicContent();
            sb.append("\nDynamic content: infinite scroll=").append(dynamic.isInfiniteScroll())
              .append(", load more=").append(dynamic.isLoadMore());
            if (dynamic.getLoadMoreButton() != null) {
                sb.append("\nTry clicking the load more button first: ").append(dynamic.getLoadMoreButton());
            } else {
                sb.append("\nTry scrolling down before checking for new content");
            }
        }
        return sb.toString();
    }
}
