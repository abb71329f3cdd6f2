package com.testweaver.locator;

import com.testweaver.driver.SelectorKind;
import com.testweaver.model.StructureHint;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Discovery of the resolution tiers and the candidates each one produces.
 */
public class StrategyRegistryTest {

    private StrategyRegistry registry;

    @BeforeClass
    public void setUp() {
        registry = new StrategyRegistry();
    }

    private List<SelectorCandidate> candidatesOf(String tierId, ResolutionRequest request) {
        return registry.getTiers().stream()
            .filter(t -> t.getId().equals(tierId))
            .findFirst()
            .orElseThrow()
            .getStrategy()
            .candidates(request)
            .collect(Collectors.toList());
    }

    @Test
    public void registry_discoversTiersInPriorityOrder() {
        assertThat(registry.tierIds()).containsExactly("explicit", "hint", "semantic", "generic");
        for (int i = 0; i < registry.size() - 1; i++) {
            assertThat(registry.getTiers().get(i).getPriority())
                .isLessThanOrEqualTo(registry.getTiers().get(i + 1).getPriority());
        }
    }

    @Test
    public void explicit_infersXPathOrCss() {
        assertThat(candidatesOf("explicit", new ResolutionRequest("x", List.of(), "//button[@id='go']")))
            .extracting(SelectorCandidate::getKind).containsExactly(SelectorKind.XPATH);
        assertThat(candidatesOf("explicit", new ResolutionRequest("x", List.of(), "button.go")))
            .extracting(SelectorCandidate::getKind).containsExactly(SelectorKind.CSS);
        assertThat(candidatesOf("explicit", new ResolutionRequest("x", List.of()))).isEmpty();
    }

    @Test
    public void hint_matchesEitherDirectionInHintOrder() {
        List<StructureHint> hints = List.of(
            new StructureHint("password", "#pass", StructureHint.Category.FORM_FIELD),
            new StructureHint("email", "#email", StructureHint.Category.FORM_FIELD),
            new StructureHint("email address input", "//input[@type='email']", StructureHint.Category.OTHER));

        List<SelectorCandidate> out = candidatesOf("hint", new ResolutionRequest("Email Address", hints));

        assertThat(out).extracting(SelectorCandidate::getValue)
            .containsExactly("#email", "//input[@type='email']");
        assertThat(out.get(1).getKind()).isEqualTo(SelectorKind.XPATH);
    }

    @Test
    public void semantic_addsTagNameOnlyForSingleWords() {
        assertThat(candidatesOf("semantic", new ResolutionRequest("footer", List.of())))
            .extracting(SelectorCandidate::getKind).contains(SelectorKind.TAG_NAME);
        assertThat(candidatesOf("semantic", new ResolutionRequest("site footer", List.of())))
            .extracting(SelectorCandidate::getKind).doesNotContain(SelectorKind.TAG_NAME);
    }

    @Test
    public void generic_startsWithIdVariantsAndStripsElementNouns() {
        List<SelectorCandidate> out = candidatesOf("generic", new ResolutionRequest("submit button", List.of()));

        assertThat(out.subList(0, 4)).extracting(SelectorCandidate::getValue)
            .containsExactly("submit-button", "submit_button", "submitbutton", "submit");
        assertThat(out.subList(0, 4)).extracting(SelectorCandidate::getKind).containsOnly(SelectorKind.ID);
        assertThat(out).extracting(SelectorCandidate::getValue)
            .anyMatch(v -> v.startsWith("//button[") && v.contains("'submit'"));
    }

    @Test
    public void generic_quotesApostrophesInXPath() {
        List<SelectorCandidate> out = candidatesOf("generic", new ResolutionRequest("today's deals", List.of()));

        assertThat(out).filteredOn(c -> c.getKind() == SelectorKind.XPATH)
            .allSatisfy(c -> assertThat(c.getValue()).contains("\"today's deals\""));
    }
}
