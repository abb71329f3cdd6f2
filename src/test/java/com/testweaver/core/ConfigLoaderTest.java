package com.testweaver.core;

import org.testng.annotations.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ConfigLoaderTest {

    private static final ConfigLoader NO_ENV = new ConfigLoader(name -> null);

    private static Path resource(String name) throws Exception {
        return Paths.get(ConfigLoaderTest.class.getResource(name).toURI());
    }

    private static Path yaml(String content) throws Exception {
        Path file = Files.createTempFile("testweaver", ".yaml");
        Files.writeString(file, content);
        return file;
    }

    @Test
    public void load_readsBrowserAndTestSections() throws Exception {
        TestWeaverConfig config = NO_ENV.load(resource("/config/testweaver.yaml"));

        assertThat(config.getBrowser()).isEqualTo("firefox");
        assertThat(config.isHeadless()).isTrue();
        assertThat(config.getWindowWidth()).isEqualTo(1280);
        assertThat(config.getWindowHeight()).isEqualTo(720);
        assertThat(config.getPageLoadTimeoutSeconds()).isEqualTo(20);
        assertThat(config.getBaseUrl()).isEqualTo("https://shop.example.com");
        assertThat(config.getScreenshotDir()).isEqualTo(Paths.get("build/shots"));
        assertThat(config.getReportDir()).isEqualTo(Paths.get("build/reports"));
        assertThat(config.getWaitTimeoutSeconds()).isEqualTo(7);
        assertThat(config.getStepDelayMs()).isEqualTo(250);
        assertThat(config.getInteractWaitMs()).isEqualTo(500);
        assertThat(config.isCaptureScreenshots()).isFalse();
    }

    @Test
    public void noFile_givesDefaults() {
        assertThat(NO_ENV.load(null)).usingRecursiveComparison().isEqualTo(TestWeaverConfig.defaults());
    }

    @Test
    public void environment_winsOverFile() throws Exception {
        ConfigLoader loader = new ConfigLoader(Map.of(
            "TESTWEAVER_BROWSER", "chrome",
            "TESTWEAVER_WAIT_TIMEOUT", "3")::get);

        TestWeaverConfig config = loader.load(resource("/config/testweaver.yaml"));

        assertThat(config.getBrowser()).isEqualTo("chrome");
        assertThat(config.getWaitTimeoutSeconds()).isEqualTo(3);
        assertThat(config.getStepDelayMs()).isEqualTo(250);
    }

    @Test
    public void windowSize_acceptsWidthByHeightString() throws Exception {
        TestWeaverConfig config = NO_ENV.load(yaml("browser:\n  window_size: 1366x768\n"));

        assertThat(config.getWindowWidth()).isEqualTo(1366);
        assertThat(config.getWindowHeight()).isEqualTo(768);
    }

    @Test
    public void emptyFile_givesDefaults() throws Exception {
        assertThat(NO_ENV.load(yaml("")).getBrowser()).isEqualTo("chrome");
    }

    @Test
    public void badFiles_areConfigurationErrors() throws Exception {
        assertThatThrownBy(() -> NO_ENV.load(Paths.get("does/not/exist.yaml")))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("not found");
        Path badSize = yaml("browser:\n  window_size: huge\n");
        assertThatThrownBy(() -> NO_ENV.load(badSize))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("window_size");
        Path badTimeout = yaml("test:\n  wait_timeout: soon\n");
        assertThatThrownBy(() -> NO_ENV.load(badTimeout))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("test.wait_timeout");
        Path badBrowser = yaml("browser:\n  name: netscape\n");
        assertThatThrownBy(() -> NO_ENV.load(badBrowser))
            .isInstanceOf(ConfigurationException.class);
    }
}
