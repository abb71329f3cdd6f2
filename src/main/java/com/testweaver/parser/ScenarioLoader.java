package com.testweaver.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.testweaver.model.ParseWarning;
import com.testweaver.model.Scenario;
import com.testweaver.model.Step;
import com.testweaver.model.StepSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads scenario YAML and compiles every step through a {@link StepParser}.
 *
 * <pre>
 * scenarios:
 *   - name: Sign up
 *     tags: [smoke]
 *     modes:
 *       human: { preparation: "Use a fresh mailbox", success_criteria: "Welcome page shows" }
 *     steps:
 *       - type "a@b.com" into email field
 *       - action: click
 *         target: submit button
 *         automation: { selector: "#submit", wait_for: element_clickable }
 * </pre>
 *
 * Shape errors (no {@code scenarios} list, {@code steps} not a list) fail the whole
 * file with {@link ScenarioLoadException}. Individual steps that do not compile are
 * kept as warnings on their scenario.
 */
public class ScenarioLoader {

    private static final Logger log = LoggerFactory.getLogger(ScenarioLoader.class);

    private final StepParser   parser;
    private final ObjectMapper mapper;

    public ScenarioLoader(StepParser parser) {
        this.parser = parser;
        this.mapper = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    // ── Primary API ───────────────────────────────────────────────────────────

    /**
     * Loads one YAML file, or every {@code *.yaml} / {@code *.yml} file of a directory
     * in file-name order.
     */
    public List<Scenario> load(Path path) {
        if (Files.isDirectory(path)) {
            List<Path> files = yamlFiles(path);
            if (files.isEmpty()) {
                throw new ScenarioLoadException("No .yaml or .yml files in " + path);
            }
            List<Scenario> all = new ArrayList<>();
            for (Path file : files) {
                all.addAll(loadFile(file));
            }
            return all;
        }
        return loadFile(path);
    }

    public List<Scenario> loadFile(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ScenarioLoadException("Scenario file not found: " + file);
        }
        try (InputStream in = Files.newInputStream(file)) {
            List<Scenario> scenarios = read(in, file.toString());
            log.info("ScenarioLoader: {} scenario(s) loaded from {}", scenarios.size(), file);
            return scenarios;
        } catch (IOException e) {
            throw new ScenarioLoadException("Could not read " + file + ": " + e.getMessage(), e);
        }
    }

    /** Parses YAML text; {@code source} names it in error messages. */
    public List<Scenario> read(String yaml, String source) {
        try {
            return compile(mapper.readTree(yaml), source);
        } catch (JsonProcessingException e) {
            throw new ScenarioLoadException("Invalid YAML in " + source + ": " + e.getOriginalMessage(), e);
        }
    }

    private List<Scenario> read(InputStream in, String source) throws IOException {
        try {
            return compile(mapper.readTree(in), source);
        } catch (JsonProcessingException e) {
            throw new ScenarioLoadException("Invalid YAML in " + source + ": " + e.getOriginalMessage(), e);
        }
    }

    // ── Compilation ───────────────────────────────────────────────────────────

    private List<Scenario> compile(JsonNode root, String source) {
        if (root == null || !root.isObject() || !root.has("scenarios")) {
            throw new ScenarioLoadException("Invalid scenario file format in " + source + ": expected a 'scenarios' key");
        }
        JsonNode list = root.get("scenarios");
        if (!list.isArray()) {
            throw new ScenarioLoadException("'scenarios' in " + source + " must be a list");
        }
        List<Scenario> scenarios = new ArrayList<>();
        for (JsonNode node : list) {
            scenarios.add(compileScenario(node, source));
        }
        return scenarios;
    }

    private Scenario compileScenario(JsonNode node, String source) {
        if (!node.isObject()) {
            throw new ScenarioLoadException("Invalid scenario entry in " + source + ": " + node);
        }
        String name = node.path("name").asText(Scenario.DEFAULT_NAME);
        String description = node.path("description").asText("");
        List<String> tags = new ArrayList<>();
        node.path("tags").forEach(t -> tags.add(t.asText()));

        JsonNode stepsNode = node.path("steps");
        if (!stepsNode.isMissingNode() && !stepsNode.isArray()) {
            throw new ScenarioLoadException("Steps of scenario '" + name + "' in " + source + " must be a list");
        }

        List<Step> steps = new ArrayList<>();
        List<ParseWarning> warnings = new ArrayList<>();
        for (JsonNode stepNode : stepsNode) {
            ParseOutcome outcome = compileStep(stepNode, name);
            if (outcome.isStep()) {
                steps.add(outcome.getStep());
            } else {
                warnings.add(outcome.getWarning());
            }
        }
        if (!warnings.isEmpty()) {
            log.warn("ScenarioLoader: scenario '{}' has {} step(s) that did not compile", name, warnings.size());
        }
        JsonNode human = node.path("modes").path("human");
        return new Scenario(name, description, tags, steps, warnings,
            textOrNull(human.path("preparation")), textOrNull(human.path("success_criteria")));
    }

    private ParseOutcome compileStep(JsonNode stepNode, String scenario) {
        if (stepNode.isTextual()) {
            return parser.parseStep(stepNode.asText());
        }
        if (stepNode.isObject()) {
            try {
                return parser.parseStep(mapper.treeToValue(stepNode, StepSpec.class));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                ParseOutcome warning = ParseOutcome.warning(stepNode.toString(),
                    "Invalid step in scenario '" + scenario + "': " + rootMessage(e));
                return reported(warning);
            }
        }
        return reported(ParseOutcome.warning(stepNode.toString(),
            "Invalid step format in scenario '" + scenario + "'"));
    }

    private ParseOutcome reported(ParseOutcome warning) {
        // Route through the parser so the listener sees loader-level warnings too
        parser.report(warning.getWarning());
        return warning;
    }

    private static String textOrNull(JsonNode node) {
        return node.isValueNode() && !node.isNull() ? node.asText() : null;
    }

    private static String rootMessage(Throwable e) {
        Throwable t = e;
        while (t.getCause() != null && t.getCause() != t) t = t.getCause();
        return t.getMessage();
    }

    private static List<Path> yamlFiles(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files
                .filter(Files::isRegularFile)
                .filter(p -> {
                    String n = p.getFileName().toString().toLowerCase(Locale.ROOT);
                    return n.endsWith(".yaml") || n.endsWith(".yml");
                })
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ScenarioLoadException("Could not list " + dir + ": " + e.getMessage(), e);
        }
    }
}
