package com.testweaver.locator.strategies;

import com.testweaver.driver.SelectorKind;
import com.testweaver.locator.ResolutionRequest;
import com.testweaver.locator.ResolutionStrategy;
import com.testweaver.locator.ResolutionTier;
import com.testweaver.locator.SelectorCandidate;

import java.util.stream.Stream;

/**
 * The selector a dual-mode step spells out in {@code automation.selector}.
 * Runs before every heuristic tier.
 */
@ResolutionTier(id = "explicit", priority = 5)
public class ExplicitSelectorStrategy implements ResolutionStrategy {

    @Override
    public Stream<SelectorCandidate> candidates(ResolutionRequest request) {
        if (!request.hasExplicitSelector()) return Stream.empty();
        String selector = request.getExplicitSelector();
        return Stream.of(SelectorCandidate.of(SelectorKind.infer(selector), selector, "explicit"));
    }
}
