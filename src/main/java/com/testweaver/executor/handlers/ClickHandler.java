package com.testweaver.executor.handlers;

import com.testweaver.core.ActionException;
import com.testweaver.driver.DriverException;
import com.testweaver.driver.ElementAction;
import com.testweaver.executor.HandlesAction;
import com.testweaver.executor.StepContext;
import com.testweaver.executor.StepHandler;
import com.testweaver.model.ActionKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Clicks the resolved element once it is visible and enabled.
 */
@HandlesAction(ActionKind.CLICK)
public class ClickHandler implements StepHandler {

    private static final Logger log = LoggerFactory.getLogger(ClickHandler.class);

    @Override
    public void execute(StepContext ctx) {
        ctx.requireInteractable();
        try {
            ctx.getDriver().act(ctx.getElement(), ElementAction.CLICK, null);
            log.debug("ClickHandler: clicked '{}' ({})", ctx.getStep().getTarget(), ctx.getElement().describe());
        } catch (DriverException e) {
            throw new ActionException("Could not click '" + ctx.getStep().getTarget() + "': " + e.getMessage(), e);
        }
    }
}
