package com.testweaver.locator.strategies;

import com.testweaver.driver.SelectorKind;
import com.testweaver.locator.ResolutionRequest;
import com.testweaver.locator.ResolutionStrategy;
import com.testweaver.locator.ResolutionTier;
import com.testweaver.locator.SelectorCandidate;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static com.testweaver.locator.Selectors.cssString;
import static com.testweaver.locator.Selectors.isTagName;
import static com.testweaver.locator.Selectors.lowerXPath;
import static com.testweaver.locator.Selectors.xpathLiteral;

/**
 * Accessibility and landmark matches: ARIA role, aria-label, tag name, and the
 * nav/header/footer landmark whose text mentions the target.
 */
@ResolutionTier(id = "semantic", priority = 20)
public class SemanticStrategy implements ResolutionStrategy {

    private static final String TIER = "semantic";
    private static final String[] LANDMARKS = {"nav", "header", "footer"};

    @Override
    public Stream<SelectorCandidate> candidates(ResolutionRequest request) {
        String target = request.getTarget();
        String literal = xpathLiteral(target);
        List<SelectorCandidate> out = new ArrayList<>();

        out.add(SelectorCandidate.of(SelectorKind.CSS, "[role=" + cssString(target) + "]", TIER));
        out.add(SelectorCandidate.of(SelectorKind.XPATH,
            "//*[contains(" + lowerXPath("@aria-label") + ", " + literal + ")]", TIER));
        if (isTagName(target)) {
            out.add(SelectorCandidate.of(SelectorKind.TAG_NAME, target, TIER));
        }
        for (String landmark : LANDMARKS) {
            out.add(SelectorCandidate.of(SelectorKind.XPATH,
                "//" + landmark + "[contains(" + lowerXPath("normalize-space(.)") + ", " + literal + ")]", TIER));
        }
        return out.stream();
    }
}
