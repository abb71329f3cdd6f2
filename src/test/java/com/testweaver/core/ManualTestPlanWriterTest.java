package com.testweaver.core;

import com.testweaver.model.Scenario;
import com.testweaver.parser.ScenarioLoader;
import com.testweaver.parser.StepParser;
import org.testng.annotations.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class ManualTestPlanWriterTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-05-01T10:15:30Z"), ZoneOffset.UTC);

    private static Path resource(String name) throws Exception {
        return Paths.get(ManualTestPlanWriterTest.class.getResource(name).toURI());
    }

    private static List<Scenario> signup() throws Exception {
        return new ScenarioLoader(new StepParser()).load(resource("/scenarios/signup.yml"));
    }

    @Test
    public void render_dualModeScenarioAsChecklist() throws Exception {
        String plan = new ManualTestPlanWriter(Path.of("unused"), FIXED)
            .render(signup(), LocalDateTime.now(FIXED));

        assertThat(plan)
            .startsWith("# Manual Test Plan\n\nGenerated: 2024-05-01 10:15:30\n")
            .contains("This test plan contains 1 scenario to be executed manually.")
            .contains("## Scenario 1: Sign up\n")
            .contains("### Tags\ndual-mode\n")
            .contains("### Prerequisites\n- Use an email address that has not signed up before\n")
            .contains("1. [ ] Type your email address into the Email box at the top of the form\n"
                + "   - Input: `user@example.com`\n"
                + "   - Wait up to 5 seconds\n"
                + "2. [ ] Choose a plan\n"
                + "   - Input: `Premium`\n"
                + "3. [ ] Submit the form\n"
                + "\n### Success Criteria\n- The welcome banner greets you by name\n")
            .endsWith("\n---\n");
        assertThat(plan).doesNotContain("this is not a step");
    }

    @Test
    public void render_textStepsUseDefaults() {
        StepParser parser = new StepParser();
        Scenario scenario = Scenario.of("Browse", List.of(
            parser.parseStep("click on the catalog link").getStep(),
            parser.parseStep("wait for 3 seconds").getStep()));

        String plan = new ManualTestPlanWriter(Path.of("unused"), FIXED)
            .render(List.of(scenario, scenario), LocalDateTime.now(FIXED));

        assertThat(plan)
            .contains("This test plan contains 2 scenarios")
            .contains("## Scenario 2: Browse\n")
            .contains("### Tags\nnone\n")
            .contains("- " + ManualTestPlanWriter.NO_PREPARATION + "\n")
            .contains("1. [ ] click on the catalog link\n2. [ ] wait for 3 seconds\n   - Wait up to 3 seconds\n")
            .contains("- " + ManualTestPlanWriter.NO_CRITERIA + "\n");
    }

    @Test
    public void write_createsTimestampedFile() throws Exception {
        Path dir = Files.createTempDirectory("plans").resolve("nested");

        Path written = new ManualTestPlanWriter(dir, FIXED).write(signup());

        assertThat(written).isEqualTo(dir.resolve("manual_test_plan_20240501_101530.md")).exists();
        assertThat(Files.readString(written)).contains("## Scenario 1: Sign up");
    }
}
