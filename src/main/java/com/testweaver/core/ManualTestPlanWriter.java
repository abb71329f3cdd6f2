package com.testweaver.core;

import com.testweaver.model.ActionKind;
import com.testweaver.model.Scenario;
import com.testweaver.model.Step;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Renders loaded scenarios as a Markdown checklist for a tester working by hand,
 * written to {@code <dir>/manual_test_plan_<yyyyMMdd_HHmmss>.md}.
 *
 * <pre>
 * ## Scenario 1: Sign up
 *
 * ### Steps
 * 1. [ ] Type your email address into the Email box
 *    - Input: `user@example.com`
 *    - Wait up to 5 seconds
 * </pre>
 *
 * Each step reads its human instruction when it has one, then its description,
 * then the raw step text. The wait line is shown for wait steps and for steps
 * whose automation block sets a timeout.
 */
public class ManualTestPlanWriter {

    private static final Logger log = LoggerFactory.getLogger(ManualTestPlanWriter.class);

    static final String NO_PREPARATION = "No specific preparation required";
    static final String NO_CRITERIA    = "No specific success criteria defined";

    private static final DateTimeFormatter FILE_STAMP   = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final DateTimeFormatter HEADER_STAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path  outputDir;
    private final Clock clock;

    public ManualTestPlanWriter(Path outputDir) {
        this(outputDir, Clock.systemDefaultZone());
    }

    public ManualTestPlanWriter(Path outputDir, Clock clock) {
        this.outputDir = outputDir;
        this.clock     = clock;
    }

    /**
     * @return the path of the written plan
     * @throws ConfigurationException if the output directory cannot be written
     */
    public Path write(List<Scenario> scenarios) {
        LocalDateTime now = LocalDateTime.now(clock);
        Path target = outputDir.resolve("manual_test_plan_" + FILE_STAMP.format(now) + ".md");
        try {
            Files.createDirectories(outputDir);
            Files.writeString(target, render(scenarios, now), StandardCharsets.UTF_8);
            log.info("ManualTestPlanWriter: {} scenario(s) written to {}", scenarios.size(), target);
            return target;
        } catch (IOException e) {
            throw new ConfigurationException("Could not write manual test plan to " + target + ": " + e.getMessage(), e);
        }
    }

    String render(List<Scenario> scenarios, LocalDateTime generatedAt) {
        StringBuilder text = new StringBuilder();
        text.append("# Manual Test Plan\n\n");
        text.append("Generated: ").append(HEADER_STAMP.format(generatedAt)).append("\n\n");
        text.append("## Overview\n");
        text.append("This test plan contains ").append(scenarios.size())
            .append(scenarios.size() == 1 ? " scenario" : " scenarios")
            .append(" to be executed manually.\n");

        for (int i = 0; i < scenarios.size(); i++) {
            text.append("\n## Scenario ").append(i + 1).append(": ").append(scenarios.get(i).getName()).append("\n");
            appendScenario(text, scenarios.get(i));
            text.append("\n---\n");
        }
        return text.toString();
    }

    private static void appendScenario(StringBuilder text, Scenario scenario) {
        if (!scenario.getDescription().isBlank()) {
            text.append("\n").append(scenario.getDescription().trim()).append("\n");
        }

        text.append("\n### Tags\n");
        text.append(scenario.getTags().isEmpty() ? "none" : String.join(", ", scenario.getTags())).append("\n");

        text.append("\n### Prerequisites\n");
        text.append("- ").append(orElse(scenario.getPreparation(), NO_PREPARATION)).append("\n");

        text.append("\n### Steps\n");
        List<Step> steps = scenario.getSteps();
        for (int i = 0; i < steps.size(); i++) {
            Step step = steps.get(i);
            text.append(i + 1).append(". [ ] ").append(instructionOf(step)).append("\n");
            if (step.getValue() != null && !step.getValue().isEmpty()) {
                text.append("   - Input: `").append(step.getValue()).append("`\n");
            }
            if (showsWait(step)) {
                text.append("   - Wait up to ").append(step.effectiveTimeoutSeconds()).append(" seconds\n");
            }
        }

        text.append("\n### Success Criteria\n");
        text.append("- ").append(orElse(scenario.getSuccessCriteria(), NO_CRITERIA)).append("\n");
    }

    private static String instructionOf(Step step) {
        if (step.getHumanInstruction() != null && !step.getHumanInstruction().isBlank()) {
            return step.getHumanInstruction().trim();
        }
        if (step.getDescription() != null && !step.getDescription().isBlank()) {
            return step.getDescription().trim();
        }
        return step.getRawText();
    }

    private static boolean showsWait(Step step) {
        return step.getAction() == ActionKind.WAIT
            || (step.getAutomation() != null && step.getAutomation().getTimeout() != null);
    }

    private static String orElse(String value, String fallback) {
        return value != null ? value : fallback;
    }
}
