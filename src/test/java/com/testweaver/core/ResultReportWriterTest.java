package com.testweaver.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.testweaver.model.ActionKind;
import com.testweaver.model.ErrorKind;
import com.testweaver.model.ScenarioResult;
import com.testweaver.model.Step;
import com.testweaver.model.StepResult;
import org.testng.annotations.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ResultReportWriterTest {

    @Test
    public void write_producesSummaryAndScenarioRecords() throws Exception {
        Path dir = Files.createTempDirectory("reports").resolve("nested");
        Step click = Step.builder().rawText("click go").action(ActionKind.CLICK).target("go").build();
        Instant started = Instant.parse("2024-05-01T10:15:30Z");
        ScenarioResult passed = ScenarioResult.completed("Passes",
            List.of(StepResult.success(click, 0, 12)), started, 40);
        ScenarioResult failed = ScenarioResult.aborted("Fails",
            List.of(StepResult.failure(click, 0, ErrorKind.ELEMENT_NOT_FOUND, "Could not find 'go'", 9)),
            0, ErrorKind.ELEMENT_NOT_FOUND, "Could not find 'go'", started, 15);

        Path written = new ResultReportWriter(dir).write(List.of(passed, failed));

        assertThat(written).isEqualTo(dir.resolve(ResultReportWriter.FILE_NAME)).exists();
        JsonNode root = new ObjectMapper().readTree(written.toFile());
        assertThat(root.get("total").asInt()).isEqualTo(2);
        assertThat(root.get("passed").asInt()).isEqualTo(1);
        assertThat(root.get("failed").asInt()).isEqualTo(1);
        JsonNode second = root.get("scenarios").get(1);
        assertThat(second.get("name").asText()).isEqualTo("Fails");
        assertThat(second.get("finalState").asText()).isEqualTo("ABORTED");
        assertThat(second.get("abortedAtIndex").asInt()).isEqualTo(0);
        assertThat(second.get("startedAt").asText()).isEqualTo("2024-05-01T10:15:30Z");
        assertThat(second.get("results").get(0).get("errorKind").asText()).isEqualTo("ELEMENT_NOT_FOUND");
        try (var files = Files.list(dir)) {
            assertThat(files).containsExactly(written);
        }
    }

    @Test
    public void write_failedMove_leavesNoTempFile() throws Exception {
        Path dir = Files.createTempDirectory("reports");
        Path blocker = Files.createDirectories(dir.resolve(ResultReportWriter.FILE_NAME));
        Files.writeString(blocker.resolve("keep.txt"), "x");

        assertThatThrownBy(() -> new ResultReportWriter(dir).write(List.of()))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Could not write report");
        try (var files = Files.list(dir)) {
            assertThat(files).containsExactly(blocker);
        }
    }
}
