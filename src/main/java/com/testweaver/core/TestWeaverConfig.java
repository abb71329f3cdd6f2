package com.testweaver.core;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.function.Function;

/**
 * Run settings for TestWeaver.
 *
 * Load from environment variables, from a YAML file via {@link ConfigLoader}, or
 * construct programmatically.
 *
 * Environment variables:
 *   TESTWEAVER_BROWSER            - chrome | firefox (default: chrome)
 *   TESTWEAVER_HEADLESS           - Run the browser headless (default: false)
 *   TESTWEAVER_BASE_URL           - Page each scenario starts on (no default)
 *   TESTWEAVER_WAIT_TIMEOUT       - Default step timeout in seconds (default: 10)
 *   TESTWEAVER_PAGE_LOAD_TIMEOUT  - Page load timeout in seconds (default: 30)
 *   TESTWEAVER_STEP_DELAY_MS      - Settle delay between successful steps (default: 1000)
 *   TESTWEAVER_SCREENSHOT_DIR     - Failure screenshots (default: test_output/screenshots)
 *   TESTWEAVER_REPORT_DIR         - results.json location (default: test_output/reports)
 *   TESTWEAVER_HINTS_PATH         - JSON/YAML structure hints file (optional)
 */
public class TestWeaverConfig {

    public static final String DEFAULT_BROWSER = "chrome";
    public static final int DEFAULT_WINDOW_WIDTH = 1920;
    public static final int DEFAULT_WINDOW_HEIGHT = 1080;
    public static final int DEFAULT_WAIT_TIMEOUT_SECONDS = 10;
    public static final int DEFAULT_PAGE_LOAD_TIMEOUT_SECONDS = 30;
    public static final long DEFAULT_STEP_DELAY_MS = 1_000;
    public static final long DEFAULT_INTERACT_WAIT_MS = 2_000;
    public static final Path DEFAULT_SCREENSHOT_DIR = Paths.get("test_output", "screenshots");
    public static final Path DEFAULT_REPORT_DIR = Paths.get("test_output", "reports");

    private final String  browser;
    private final boolean headless;
    private final int     windowWidth;
    private final int     windowHeight;
    private final int     waitTimeoutSeconds;
    private final int     pageLoadTimeoutSeconds;
    private final long    stepDelayMs;
    private final long    interactWaitMs;     // how long a resolved element may take to become interactable
    private final boolean captureScreenshots;
    private final String  baseUrl;
    private final Path    screenshotDir;
    private final Path    reportDir;
    private final Path    hintsPath;          // null = no structure hints

    private TestWeaverConfig(Builder b) {
        this.browser                = b.browser;
        this.headless               = b.headless;
        this.windowWidth            = b.windowWidth;
        this.windowHeight           = b.windowHeight;
        this.waitTimeoutSeconds     = b.waitTimeoutSeconds;
        this.pageLoadTimeoutSeconds = b.pageLoadTimeoutSeconds;
        this.stepDelayMs            = b.stepDelayMs;
        this.interactWaitMs         = b.interactWaitMs;
        this.captureScreenshots     = b.captureScreenshots;
        this.baseUrl                = b.baseUrl;
        this.screenshotDir          = b.screenshotDir;
        this.reportDir              = b.reportDir;
        this.hintsPath              = b.hintsPath;
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static TestWeaverConfig defaults() {
        return builder().build();
    }

    public static TestWeaverConfig fromEnvironment() {
        return builder().applyEnvironment(System::getenv).build();
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public String getBrowser()                  { return browser; }
    public boolean isHeadless()                 { return headless; }
    public int getWindowWidth()                 { return windowWidth; }
    public int getWindowHeight()                { return windowHeight; }
    public int getWaitTimeoutSeconds()          { return waitTimeoutSeconds; }
    public int getPageLoadTimeoutSeconds()      { return pageLoadTimeoutSeconds; }
    public long getStepDelayMs()                { return stepDelayMs; }
    public long getInteractWaitMs()             { return interactWaitMs; }
    public boolean isCaptureScreenshots()       { return captureScreenshots; }
    public String getBaseUrl()                  { return baseUrl; }
    public Path getScreenshotDir()              { return screenshotDir; }
    public Path getReportDir()                  { return reportDir; }
    public Path getHintsPath()                  { return hintsPath; }
    public boolean isHintsEnabled()             { return hintsPath != null; }

    public Builder toBuilder() {
        return new Builder()
            .browser(browser).headless(headless).windowSize(windowWidth, windowHeight)
            .waitTimeoutSeconds(waitTimeoutSeconds).pageLoadTimeoutSeconds(pageLoadTimeoutSeconds)
            .stepDelayMs(stepDelayMs).interactWaitMs(interactWaitMs)
            .captureScreenshots(captureScreenshots).baseUrl(baseUrl)
            .screenshotDir(screenshotDir).reportDir(reportDir).hintsPath(hintsPath);
    }

    @Override
    public String toString() {
        return "TestWeaverConfig{browser=" + browser + ", headless=" + headless +
            ", window=" + windowWidth + "x" + windowHeight +
            ", waitTimeout=" + waitTimeoutSeconds + "s, pageLoad=" + pageLoadTimeoutSeconds + "s" +
            ", stepDelay=" + stepDelayMs + "ms, baseUrl=" + baseUrl +
            ", hints=" + (hintsPath != null ? hintsPath : "none") + "}";
    }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private String  browser = DEFAULT_BROWSER;
        private boolean headless = false;
        private int     windowWidth = DEFAULT_WINDOW_WIDTH;
        private int     windowHeight = DEFAULT_WINDOW_HEIGHT;
        private int     waitTimeoutSeconds = DEFAULT_WAIT_TIMEOUT_SECONDS;
        private int     pageLoadTimeoutSeconds = DEFAULT_PAGE_LOAD_TIMEOUT_SECONDS;
        private long    stepDelayMs = DEFAULT_STEP_DELAY_MS;
        private long    interactWaitMs = DEFAULT_INTERACT_WAIT_MS;
        private boolean captureScreenshots = true;
        private String  baseUrl = null;
        private Path    screenshotDir = DEFAULT_SCREENSHOT_DIR;
        private Path    reportDir = DEFAULT_REPORT_DIR;
        private Path    hintsPath = null;

        public Builder browser(String b)                  { this.browser = normalizeBrowser(b); return this; }
        public Builder headless(boolean b)                { this.headless = b; return this; }
        public Builder windowSize(int width, int height)  { this.windowWidth = width; this.windowHeight = height; return this; }
        public Builder waitTimeoutSeconds(int s)          { this.waitTimeoutSeconds = nonNegative("wait timeout", s); return this; }
        public Builder pageLoadTimeoutSeconds(int s)      { this.pageLoadTimeoutSeconds = nonNegative("page load timeout", s); return this; }
        public Builder stepDelayMs(long ms)               { this.stepDelayMs = nonNegative("step delay", ms); return this; }
        public Builder interactWaitMs(long ms)            { this.interactWaitMs = nonNegative("interact wait", ms); return this; }
        public Builder captureScreenshots(boolean b)      { this.captureScreenshots = b; return this; }
        public Builder baseUrl(String url)                { this.baseUrl = (url != null && !url.isBlank()) ? url.trim() : null; return this; }
        public Builder screenshotDir(Path dir)            { this.screenshotDir = dir; return this; }
        public Builder reportDir(Path dir)                { this.reportDir = dir; return this; }
        public Builder hintsPath(Path path)               { this.hintsPath = path; return this; }
        public Builder hintsPath(String path) {
            this.hintsPath = (path != null && !path.isBlank()) ? Paths.get(path) : null;
            return this;
        }

        /**
         * Overrides any setting whose TESTWEAVER_* variable is present in {@code env}.
         * Unset variables leave the current value untouched.
         */
        public Builder applyEnvironment(Function<String, String> env) {
            String browserEnv = env.apply("TESTWEAVER_BROWSER");
            if (isSet(browserEnv)) browser(browserEnv);
            String headlessEnv = env.apply("TESTWEAVER_HEADLESS");
            if (isSet(headlessEnv)) headless(Boolean.parseBoolean(headlessEnv.trim()));
            String baseUrlEnv = env.apply("TESTWEAVER_BASE_URL");
            if (isSet(baseUrlEnv)) baseUrl(baseUrlEnv);
            waitTimeoutSeconds(intEnvOrDefault(env, "TESTWEAVER_WAIT_TIMEOUT", waitTimeoutSeconds));
            pageLoadTimeoutSeconds(intEnvOrDefault(env, "TESTWEAVER_PAGE_LOAD_TIMEOUT", pageLoadTimeoutSeconds));
            stepDelayMs(intEnvOrDefault(env, "TESTWEAVER_STEP_DELAY_MS", (int) stepDelayMs));
            screenshotDir(pathEnvOrDefault(env, "TESTWEAVER_SCREENSHOT_DIR", screenshotDir));
            reportDir(pathEnvOrDefault(env, "TESTWEAVER_REPORT_DIR", reportDir));
            hintsPath(pathEnvOrDefault(env, "TESTWEAVER_HINTS_PATH", hintsPath));
            return this;
        }

        public TestWeaverConfig build() {
            return new TestWeaverConfig(this);
        }
    }

    // ── Env helpers ───────────────────────────────────────────────────────────

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }

    private static int intEnvOrDefault(Function<String, String> env, String key, int defaultValue) {
        String val = env.apply(key);
        if (!isSet(val)) return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " must be an integer, got '" + val + "'", e);
        }
    }

    private static Path pathEnvOrDefault(Function<String, String> env, String key, Path defaultValue) {
        String val = env.apply(key);
        return isSet(val) ? Paths.get(val.trim()) : defaultValue;
    }

    private static String normalizeBrowser(String browser) {
        if (browser == null || browser.isBlank()) return DEFAULT_BROWSER;
        String b = browser.trim().toLowerCase(Locale.ROOT);
        if (!b.equals("chrome") && !b.equals("firefox")) {
            throw new ConfigurationException("Unsupported browser '" + browser + "' (expected chrome or firefox)");
        }
        return b;
    }

    private static int nonNegative(String what, int value) {
        if (value < 0) throw new ConfigurationException(what + " must be >= 0, got " + value);
        return value;
    }

    private static long nonNegative(String what, long value) {
        if (value < 0) throw new ConfigurationException(what + " must be >= 0, got " + value);
        return value;
    }
}
