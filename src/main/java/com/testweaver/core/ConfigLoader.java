package com.testweaver.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.function.Function;

/**
 * Builds a {@link TestWeaverConfig} from a YAML file and the environment.
 *
 * Precedence: built-in defaults, then the file, then TESTWEAVER_* variables.
 * Command-line flags are applied on top by the caller through
 * {@link TestWeaverConfig#toBuilder()}.
 *
 * <pre>
 * browser:
 *   name: chrome
 *   headless: false
 *   window_size: [1920, 1080]     # or "1920x1080"
 *   page_load_timeout: 30
 * test:
 *   base_url: http://localhost:3000
 *   screenshot_dir: test_output/screenshots
 *   report_dir: test_output/reports
 *   wait_timeout: 10
 *   step_delay_ms: 1000
 *   interact_wait_ms: 2000
 *   hints: hints/site.json
 * </pre>
 *
 * Unknown sections (reporting, logging, test data...) are ignored.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());
    private final Function<String, String> env;

    public ConfigLoader() {
        this(System::getenv);
    }

    public ConfigLoader(Function<String, String> env) {
        this.env = env;
    }

    /**
     * Loads the given file (may be null for "no file") and applies the environment.
     *
     * @throws ConfigurationException if the file is missing, unreadable or holds invalid values
     */
    public TestWeaverConfig load(Path configFile) {
        TestWeaverConfig.Builder builder = TestWeaverConfig.builder();
        if (configFile != null) {
            applyFile(builder, configFile);
        }
        TestWeaverConfig config = builder.applyEnvironment(env).build();
        log.debug("ConfigLoader: {}", config);
        return config;
    }

    private void applyFile(TestWeaverConfig.Builder builder, Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException("Config file not found: " + file);
        }
        JsonNode root;
        try {
            root = yaml.readTree(file.toFile());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration file " + file + ": " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            log.warn("ConfigLoader: {} is empty, using defaults", file);
            return;
        }
        if (!root.isObject()) {
            throw new ConfigurationException("Config file " + file + " must contain a mapping at the top level");
        }

        JsonNode browser = root.path("browser");
        if (browser.has("name"))              builder.browser(browser.get("name").asText());
        if (browser.has("headless"))          builder.headless(bool(browser.get("headless"), "browser.headless"));
        if (browser.has("page_load_timeout")) builder.pageLoadTimeoutSeconds(integer(browser.get("page_load_timeout"), "browser.page_load_timeout"));
        if (browser.has("window_size"))       applyWindowSize(builder, browser.get("window_size"));
        if (browser.has("implicit_wait")) {
            log.info("ConfigLoader: browser.implicit_wait is ignored; element waits are budgeted explicitly");
        }

        JsonNode test = root.path("test");
        if (test.has("base_url"))         builder.baseUrl(test.get("base_url").asText());
        if (test.has("screenshot_dir"))   builder.screenshotDir(Paths.get(test.get("screenshot_dir").asText()));
        if (test.has("report_dir"))       builder.reportDir(Paths.get(test.get("report_dir").asText()));
        if (test.has("wait_timeout"))     builder.waitTimeoutSeconds(integer(test.get("wait_timeout"), "test.wait_timeout"));
        if (test.has("step_delay_ms"))    builder.stepDelayMs(integer(test.get("step_delay_ms"), "test.step_delay_ms"));
        if (test.has("interact_wait_ms")) builder.interactWaitMs(integer(test.get("interact_wait_ms"), "test.interact_wait_ms"));
        if (test.has("screenshots"))      builder.captureScreenshots(bool(test.get("screenshots"), "test.screenshots"));
        if (test.has("hints"))            builder.hintsPath(test.get("hints").asText());
    }

    private static void applyWindowSize(TestWeaverConfig.Builder builder, JsonNode node) {
        if (node.isArray() && node.size() == 2) {
            builder.windowSize(integer(node.get(0), "browser.window_size[0]"),
                               integer(node.get(1), "browser.window_size[1]"));
            return;
        }
        if (node.isTextual()) {
            String[] parts = node.asText().toLowerCase().split("x");
            if (parts.length == 2) {
                try {
                    builder.windowSize(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()));
                    return;
                } catch (NumberFormatException e) {
                    throw new ConfigurationException("browser.window_size must look like 1920x1080, got '" +
                        node.asText() + "'", e);
                }
            }
        }
        throw new ConfigurationException("browser.window_size must be [width, height] or \"WIDTHxHEIGHT\", got " + node);
    }

    private static int integer(JsonNode node, String key) {
        if (node.canConvertToInt()) return node.asInt();
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException(key + " must be an integer, got '" + node.asText() + "'", e);
            }
        }
        throw new ConfigurationException(key + " must be an integer, got " + node);
    }

    private static boolean bool(JsonNode node, String key) {
        if (node.isBoolean()) return node.asBoolean();
        if (node.isTextual()) {
            String v = node.asText().trim();
            if (v.equalsIgnoreCase("true") || v.equalsIgnoreCase("false")) return Boolean.parseBoolean(v);
        }
        throw new ConfigurationException(key + " must be true or false, got " + node);
    }
}
