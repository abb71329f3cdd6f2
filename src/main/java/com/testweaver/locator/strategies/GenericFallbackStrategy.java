package com.testweaver.locator.strategies;

import com.testweaver.driver.SelectorKind;
import com.testweaver.locator.ResolutionRequest;
import com.testweaver.locator.ResolutionStrategy;
import com.testweaver.locator.ResolutionTier;
import com.testweaver.locator.SelectorCandidate;
import com.testweaver.locator.Selectors;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static com.testweaver.locator.Selectors.lowerXPath;
import static com.testweaver.locator.Selectors.xpathLiteral;

/**
 * Last-resort guesses from the target text alone.
 *
 * Order: id, name, class (identifier spellings of the target), the target as raw
 * CSS, exact text, then button, input, label-associated control and link matches.
 * Text matches are case-insensitive and also try the target without trailing
 * element nouns ("submit button" → "submit").
 */
@ResolutionTier(id = "generic", priority = 30)
public class GenericFallbackStrategy implements ResolutionStrategy {

    private static final String TIER = "generic";
    private static final String TEXT = lowerXPath("normalize-space(.)");
    private static final String ARIA = lowerXPath("@aria-label");

    @Override
    public Stream<SelectorCandidate> candidates(ResolutionRequest request) {
        String target = request.getTarget();
        List<String> variants = Selectors.identifierVariants(target);
        List<String> phrases = phrases(target);
        List<SelectorCandidate> out = new ArrayList<>();

        for (String v : variants) out.add(SelectorCandidate.of(SelectorKind.ID, v, TIER));
        for (String v : variants) out.add(SelectorCandidate.of(SelectorKind.NAME, v, TIER));
        for (String v : variants) {
            if (!v.contains(".") && !v.contains(":")) out.add(SelectorCandidate.of(SelectorKind.CLASS_NAME, v, TIER));
        }
        out.add(SelectorCandidate.of(SelectorKind.CSS, target, TIER));

        String exact = xpathLiteral(target);
        out.add(SelectorCandidate.of(SelectorKind.XPATH,
            "//*[text()[" + TEXT + "=" + exact + "]]", TIER));

        for (String phrase : phrases) {
            String p = xpathLiteral(phrase);
            out.add(SelectorCandidate.of(SelectorKind.XPATH,
                "//button[contains(" + TEXT + ", " + p + ") or contains(" + ARIA + ", " + p + ")]", TIER));
            out.add(SelectorCandidate.of(SelectorKind.XPATH,
                "//input[@type='submit' or @type='button'][contains(" + lowerXPath("@value") + ", " + p + ")]", TIER));
        }
        for (String phrase : phrases) {
            String p = xpathLiteral(phrase);
            out.add(SelectorCandidate.of(SelectorKind.XPATH,
                "//*[self::input or self::textarea][contains(" + lowerXPath("@placeholder") + ", " + p +
                    ") or contains(" + ARIA + ", " + p + ")]", TIER));
        }
        for (String phrase : phrases) {
            String p = xpathLiteral(phrase);
            out.add(SelectorCandidate.of(SelectorKind.XPATH,
                "//*[@id=//label[contains(" + TEXT + ", " + p + ")]/@for]", TIER));
            out.add(SelectorCandidate.of(SelectorKind.XPATH,
                "//label[contains(" + TEXT + ", " + p + ")]//*[self::input or self::select or self::textarea]", TIER));
        }
        for (String phrase : phrases) {
            String p = xpathLiteral(phrase);
            out.add(SelectorCandidate.of(SelectorKind.XPATH,
                "//a[contains(" + TEXT + ", " + p + ") or contains(" + ARIA + ", " + p + ")]", TIER));
        }
        return out.stream();
    }

    private static List<String> phrases(String target) {
        Set<String> phrases = new LinkedHashSet<>();
        phrases.add(target);
        phrases.add(Selectors.coreName(target));
        return new ArrayList<>(phrases);
    }
}
