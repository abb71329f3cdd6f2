package com.testweaver.driver;

import com.testweaver.core.ConfigurationException;
import com.testweaver.core.TestWeaverConfig;
import io.github.bonigarcia.wdm.WebDriverManager;
import org.openqa.selenium.Dimension;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.firefox.FirefoxDriver;
import org.openqa.selenium.firefox.FirefoxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Creates Chrome or Firefox WebDriver instances from a {@link TestWeaverConfig}.
 *
 * The implicit wait is always forced to zero. Element waits are budgeted by the
 * resolver; an implicit wait would multiply every probe.
 */
public final class DriverFactory {

    private static final Logger log = LoggerFactory.getLogger(DriverFactory.class);

    private DriverFactory() {}

    public static WebDriver create(TestWeaverConfig config) {
        WebDriver driver;
        switch (config.getBrowser()) {
            case "chrome":
                driver = createChrome(config);
                break;
            case "firefox":
                driver = createFirefox(config);
                break;
            default:
                throw new ConfigurationException("Unsupported browser: " + config.getBrowser());
        }

        driver.manage().timeouts().implicitlyWait(Duration.ZERO);
        driver.manage().timeouts().pageLoadTimeout(Duration.ofSeconds(config.getPageLoadTimeoutSeconds()));
        if (!config.isHeadless()) {
            driver.manage().window().setSize(new Dimension(config.getWindowWidth(), config.getWindowHeight()));
        }
        log.info("DriverFactory: {} started (headless={}, window={}x{})", config.getBrowser(),
            config.isHeadless(), config.getWindowWidth(), config.getWindowHeight());
        return driver;
    }

    private static WebDriver createChrome(TestWeaverConfig config) {
        WebDriverManager.chromedriver().setup();
        ChromeOptions options = new ChromeOptions();
        if (config.isHeadless()) {
            options.addArguments("--headless=new");
        }
        options.addArguments(
            "--no-sandbox",
            "--disable-dev-shm-usage",
            "--disable-gpu",
            "--window-size=" + config.getWindowWidth() + "," + config.getWindowHeight(),
            "--disable-search-engine-choice-screen"
        );
        return new ChromeDriver(options);
    }

    private static WebDriver createFirefox(TestWeaverConfig config) {
        WebDriverManager.firefoxdriver().setup();
        FirefoxOptions options = new FirefoxOptions();
        if (config.isHeadless()) {
            options.addArguments("-headless");
        }
        options.addArguments("--width=" + config.getWindowWidth(), "--height=" + config.getWindowHeight());
        return new FirefoxDriver(options);
    }

    /**
     * Quits the driver. Teardown failures are logged, since the browser may already be gone.
     */
    public static void quit(WebDriver driver) {
        if (driver == null) return;
        try {
            driver.quit();
            log.debug("DriverFactory: WebDriver quit");
        } catch (WebDriverException e) {
            log.warn("DriverFactory: Exception during driver quit: {}", e.getMessage());
        }
    }
}
