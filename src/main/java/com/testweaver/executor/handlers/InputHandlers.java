package com.testweaver.executor.handlers;

import com.testweaver.core.ActionException;
import com.testweaver.driver.DriverException;
import com.testweaver.driver.ElementAction;
import com.testweaver.executor.HandlesAction;
import com.testweaver.executor.StepContext;
import com.testweaver.executor.StepHandler;
import com.testweaver.model.ActionKind;

// ── TYPE ──────────────────────────────────────────────────────────────────────

@HandlesAction(ActionKind.TYPE)
class TypeHandler implements StepHandler {

    @Override
    public void execute(StepContext ctx) {
        String value = ctx.getStep().getValue();
        if (value == null) {
            throw new ActionException("Nothing to type into '" + ctx.getStep().getTarget() + "'");
        }
        ctx.requireInteractable();
        try {
            ctx.getDriver().act(ctx.getElement(), ElementAction.TYPE, value);
        } catch (DriverException e) {
            throw new ActionException("Could not type into '" + ctx.getStep().getTarget() + "': " + e.getMessage(), e);
        }
    }
}

// ── SELECT ────────────────────────────────────────────────────────────────────

@HandlesAction(ActionKind.SELECT)
class SelectHandler implements StepHandler {

    @Override
    public void execute(StepContext ctx) {
        String option = ctx.getStep().getValue();
        if (option == null) {
            throw new ActionException("No option given for '" + ctx.getStep().getTarget() + "'");
        }
        ctx.requireInteractable();
        try {
            ctx.getDriver().act(ctx.getElement(), ElementAction.SELECT, option);
        } catch (DriverException e) {
            throw new ActionException("Could not select '" + option + "' from '" +
                ctx.getStep().getTarget() + "': " + e.getMessage(), e);
        }
    }
}

// ── HOVER ─────────────────────────────────────────────────────────────────────

@HandlesAction(ActionKind.HOVER)
class HoverHandler implements StepHandler {

    @Override
    public void execute(StepContext ctx) {
        ctx.requireInteractable();
        try {
            ctx.getDriver().act(ctx.getElement(), ElementAction.HOVER, null);
        } catch (DriverException e) {
            throw new ActionException("Could not hover over '" + ctx.getStep().getTarget() + "': " + e.getMessage(), e);
        }
    }
}
