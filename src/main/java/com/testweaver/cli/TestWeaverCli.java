package com.testweaver.cli;

import com.testweaver.core.ConfigLoader;
import com.testweaver.core.ConfigurationException;
import com.testweaver.core.ExecutionListener;
import com.testweaver.core.LoggingExecutionListener;
import com.testweaver.core.ManualTestPlanWriter;
import com.testweaver.core.ResultReportWriter;
import com.testweaver.core.TestWeaverConfig;
import com.testweaver.driver.DriverFactory;
import com.testweaver.driver.SeleniumBrowserDriver;
import com.testweaver.executor.ScenarioExecutor;
import com.testweaver.hints.StaticStructureHintProvider;
import com.testweaver.hints.StructureHintProvider;
import com.testweaver.model.Scenario;
import com.testweaver.model.ScenarioResult;
import com.testweaver.parser.ScenarioLoadException;
import com.testweaver.parser.ScenarioLoader;
import com.testweaver.parser.StepParser;
import org.openqa.selenium.WebDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line entry point.
 *
 * <pre>
 *   testweaver -t scenarios/ -u https://shop.example.com --browser firefox --headless
 *   testweaver -t scenarios/ --manual-plan build/plans
 * </pre>
 *
 * {@code --manual-plan} writes the plan as soon as the scenarios load, before any
 * browser starts.
 *
 * Exit code 0 when every scenario completes, 1 on any load or execution failure.
 */
@Command(
    name = "testweaver",
    mixinStandardHelpOptions = true,
    version = "testweaver 1.0.0",
    description = "Runs plain-language browser test scenarios."
)
public class TestWeaverCli implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TestWeaverCli.class);

    @Option(names = {"-t", "--test"}, required = true,
            description = "Scenario YAML file, or a directory of them")
    Path scenarios;

    @Option(names = {"-c", "--config"}, description = "Config YAML file")
    Path configFile;

    @Option(names = {"-u", "--url"}, description = "Start URL (overrides test.base_url)")
    String url;

    @Option(names = "--browser", description = "chrome or firefox")
    String browser;

    @Option(names = "--headless", description = "Run the browser headless")
    Boolean headless;

    @Option(names = "--hints", description = "Structure hints file (JSON or YAML)")
    Path hints;

    @Option(names = "--manual-plan", paramLabel = "<dir>",
            description = "Also write a Markdown manual test plan for the loaded scenarios to this directory")
    Path manualPlanDir;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new TestWeaverCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        ExecutionListener listener = new LoggingExecutionListener();
        TestWeaverConfig config;
        List<Scenario> loaded;
        StructureHintProvider hintProvider;
        try {
            config = resolveConfig();
            loaded = new ScenarioLoader(new StepParser(listener, config.getWaitTimeoutSeconds())).load(scenarios);
            if (manualPlanDir != null && !loaded.isEmpty()) {
                new ManualTestPlanWriter(manualPlanDir).write(loaded);
            }
            hintProvider = config.isHintsEnabled()
                ? StaticStructureHintProvider.fromFile(config.getHintsPath())
                : StructureHintProvider.none();
        } catch (ConfigurationException | ScenarioLoadException e) {
            log.error("TestWeaverCli: {}", e.getMessage());
            return 1;
        }
        if (loaded.isEmpty()) {
            log.error("TestWeaverCli: No scenarios found in {}", scenarios);
            return 1;
        }
        if (config.getBaseUrl() == null) {
            log.error("TestWeaverCli: No URL given; pass -u or set test.base_url");
            return 1;
        }

        List<ScenarioResult> results = new ArrayList<>();
        WebDriver webDriver = DriverFactory.create(config);
        try {
            ScenarioExecutor executor = new ScenarioExecutor(
                new SeleniumBrowserDriver(webDriver), config, hintProvider, listener);
            for (Scenario scenario : loaded) {
                results.add(executor.run(scenario, config.getBaseUrl()));
            }
        } finally {
            DriverFactory.quit(webDriver);
        }

        new ResultReportWriter(config.getReportDir()).write(results);
        long failed = results.stream().filter(r -> !r.isSuccessful()).count();
        log.info("TestWeaverCli: {} scenario(s), {} passed, {} failed",
            results.size(), results.size() - failed, failed);
        return failed == 0 ? 0 : 1;
    }

    TestWeaverConfig resolveConfig() {
        TestWeaverConfig.Builder builder = new ConfigLoader().load(configFile).toBuilder();
        if (url != null)      builder.baseUrl(url);
        if (browser != null)  builder.browser(browser);
        if (headless != null) builder.headless(headless);
        if (hints != null)    builder.hintsPath(hints);
        return builder.build();
    }
}
