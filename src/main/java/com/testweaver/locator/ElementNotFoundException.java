package com.testweaver.locator;

import com.testweaver.core.StepExecutionException;
import com.testweaver.model.ErrorKind;

/**
 * Every resolution tier was exhausted inside the budget.
 *
 * Carries how many candidates were probed out of how many were planned, and an
 * alternate selector worth trying when the page's hints suggest one.
 */
public class ElementNotFoundException extends StepExecutionException {

    private final String target;
    private final int    attempted;
    private final int    planned;
    private final String suggestedSelector;

    public ElementNotFoundException(String target, int attempted, int planned, String suggestedSelector) {
        super(ErrorKind.ELEMENT_NOT_FOUND, buildMessage(target, attempted, planned));
        this.target            = target;
        this.attempted         = attempted;
        this.planned           = planned;
        this.suggestedSelector = suggestedSelector;
    }

    public String getTarget()             { return target; }
    public int getAttempted()             { return attempted; }
    public int getPlanned()               { return planned; }
    public String getSuggestedSelector()  { return suggestedSelector; }
    public boolean hasSuggestion()        { return suggestedSelector != null; }

    private static String buildMessage(String target, int attempted, int planned) {
        if (planned == 0) return "No selector candidates could be built for '" + target + "'";
        return "Could not find '" + target + "' after trying " + attempted + " of " +
            planned + " candidate selector(s)";
    }
}
