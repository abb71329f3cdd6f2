package com.testweaver.locator;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a {@link ResolutionStrategy} for discovery by the {@link StrategyRegistry}.
 *
 * <pre>
 *   {@literal @}ResolutionTier(id = "semantic", priority = 20)
 *   public class SemanticStrategy implements ResolutionStrategy { ... }
 * </pre>
 *
 * Ids must be unique. Duplicates cause startup failure.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface ResolutionTier {

    /** Unique tier name, used in logs and diagnostics. */
    String id();

    /** Lower runs first. Ties are broken by id. */
    int priority() default 100;
}
