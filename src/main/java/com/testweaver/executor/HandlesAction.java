package com.testweaver.executor;

import com.testweaver.model.ActionKind;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as the handler for one {@link ActionKind}.
 *
 * The {@link StepHandlerRegistry} scans {@code com.testweaver.executor.handlers} at
 * startup and registers every annotated class under its kind.
 *
 * <pre>
 *   {@literal @}HandlesAction(ActionKind.CLICK)
 *   class ClickHandler implements StepHandler { ... }
 * </pre>
 *
 * Rules:
 *   - The annotated class must implement {@link StepHandler}.
 *   - It must have a no-arg constructor.
 *   - Each kind has exactly one handler. Duplicates and gaps cause startup failure.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface HandlesAction {
    ActionKind value();
}
