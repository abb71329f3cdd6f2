package com.testweaver.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.testng.annotations.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Value semantics of the model types and their YAML mapping.
 */
public class ModelTest {

    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());

    @Test
    public void step_rejectsEmptyTargetAndNegativeTimeout() {
        assertThatThrownBy(() -> Step.builder().rawText("click").action(ActionKind.CLICK).target("").build())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Step.builder().rawText("x").action(ActionKind.CLICK).target("x")
                .timeoutSeconds(-1).build())
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void step_automationTimeoutTakesPrecedence() {
        Step step = Step.builder().rawText("click go").action(ActionKind.CLICK).target("go").timeoutSeconds(10)
            .automation(new AutomationSpec("#go", null, 3, null)).build();

        assertThat(step.effectiveTimeoutSeconds()).isEqualTo(3);
        assertThat(step.toBuilder().automation(null).build().effectiveTimeoutSeconds()).isEqualTo(10);
    }

    @Test
    public void automationSpec_readsWaitForAliases() throws Exception {
        AutomationSpec spec = yaml.readValue("selector: '#go'\nwait_for: clickable\n"
            + "assertions:\n  - type: element_count\n    selector: li\n    count: 3\n", AutomationSpec.class);

        assertThat(spec.getWaitFor()).isEqualTo(WaitCondition.ELEMENT_CLICKABLE);
        assertThat(spec.getAssertions()).containsExactly(
            new AssertionSpec(AssertionSpec.Type.ELEMENT_COUNT, "li", null, 3));
        assertThat(yaml.readValue("selector: ' '\n", AutomationSpec.class).hasSelector()).isFalse();
        assertThat(yaml.readValue("{}", AutomationSpec.class).getWaitFor()).isEqualTo(WaitCondition.ELEMENT_PRESENT);
    }

    @Test
    public void structureAnalysis_dropsEntriesWithoutSelector() throws Exception {
        StructureAnalysis analysis = yaml.readValue(
            "forms:\n"
                + "  - id: login\n"
                + "    inputs:\n"
                + "      username: '#user'\n"
                + "      password:\n"
                + "  - ~\n"
                + "suggested_selectors:\n"
                + "  submit:\n"
                + "  cart: '  '\n"
                + "  help: '#help'\n",
            StructureAnalysis.class);

        assertThat(analysis.getForms()).hasSize(1);
        assertThat(analysis.getForms().get(0).getInputs()).containsOnlyKeys("username");
        assertThat(analysis.getSuggestedSelectors()).containsOnlyKeys("help");
        assertThat(analysis.toHints())
            .extracting(StructureHint::getKeyword, StructureHint::getSelector)
            .containsExactly(tuple("username", "#user"), tuple("help", "#help"));
    }

    @Test
    public void structureHint_matchesSubstringsBothWays() {
        StructureHint hint = new StructureHint("Email", "#email", StructureHint.Category.FORM_FIELD);

        assertThat(hint.getKeyword()).isEqualTo("email");
        assertThat(hint.matches("email field")).isTrue();
        assertThat(hint.matches("mail")).isTrue();
        assertThat(hint.matches("password")).isFalse();
        assertThat(hint.matches("")).isFalse();
    }

    @Test
    public void scenarioResult_countsAndStates() {
        Step step = Step.builder().rawText("click go").action(ActionKind.CLICK).target("go").build();
        ScenarioResult aborted = ScenarioResult.aborted("s",
            List.of(StepResult.success(step, 0, 1), StepResult.failure(step, 1, ErrorKind.ACTION_ERROR, "x", 1)),
            1, ErrorKind.ACTION_ERROR, "x", java.time.Instant.now(), 2);

        assertThat(aborted.isAborted()).isTrue();
        assertThat(aborted.isSuccessful()).isFalse();
        assertThat(aborted.getSucceededCount()).isEqualTo(1);
        assertThat(aborted.getFinalState().isTerminal()).isTrue();
        assertThat(ExecutionState.RUNNING.isTerminal()).isFalse();
    }
}
