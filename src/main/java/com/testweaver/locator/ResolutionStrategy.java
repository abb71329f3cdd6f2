package com.testweaver.locator;

import java.util.stream.Stream;

/**
 * One tier of the element resolution chain.
 *
 * <h3>Registration</h3>
 * Implementations must be annotated with {@link ResolutionTier}, have a no-arg
 * constructor, and live in {@code com.testweaver.locator.strategies} so the
 * {@link StrategyRegistry} discovers them.
 *
 * <h3>Rules</h3>
 * <ul>
 *   <li>{@link #candidates} is pure: it builds selectors and never touches the browser.</li>
 *   <li>Return candidates in the order they should be probed.</li>
 *   <li>Be stateless; one instance serves every resolution.</li>
 * </ul>
 */
public interface ResolutionStrategy {
    Stream<SelectorCandidate> candidates(ResolutionRequest request);
}
