package com.testweaver.locator.strategies;

import com.testweaver.driver.SelectorKind;
import com.testweaver.locator.ResolutionRequest;
import com.testweaver.locator.ResolutionStrategy;
import com.testweaver.locator.ResolutionTier;
import com.testweaver.locator.SelectorCandidate;

import java.util.stream.Stream;

/**
 * Selectors from structure hints whose keyword overlaps the target, in hint order.
 */
@ResolutionTier(id = "hint", priority = 10)
public class HintStrategy implements ResolutionStrategy {

    @Override
    public Stream<SelectorCandidate> candidates(ResolutionRequest request) {
        String target = request.getTarget();
        return request.getHints().stream()
            .filter(hint -> hint.matches(target))
            .map(hint -> SelectorCandidate.of(SelectorKind.infer(hint.getSelector()), hint.getSelector(), "hint"));
    }
}
