package com.testweaver.driver;

import org.openqa.selenium.By;
import org.openqa.selenium.InvalidSelectorException;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.StaleElementReferenceException;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.interactions.Actions;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.Select;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link BrowserDriver} adapter over a Selenium {@link WebDriver}.
 *
 * The wrapped driver must have its implicit wait set to zero (see {@link DriverFactory});
 * every wait here is an explicit {@link WebDriverWait} bounded by the caller's duration.
 */
public class SeleniumBrowserDriver implements BrowserDriver {

    private static final Logger log = LoggerFactory.getLogger(SeleniumBrowserDriver.class);
    private static final Duration POLL_INTERVAL = Duration.ofMillis(100);

    private final WebDriver driver;

    public SeleniumBrowserDriver(WebDriver driver) {
        this.driver = Objects.requireNonNull(driver, "driver");
    }

    public WebDriver getWebDriver() {
        return driver;
    }

    // ── Navigation ────────────────────────────────────────────────────────────

    @Override
    public void navigate(String url) {
        try {
            driver.get(url);
        } catch (WebDriverException e) {
            throw new DriverException("Navigation to " + url + " failed: " + firstLine(e), e);
        }
    }

    @Override
    public String readyState() {
        try {
            return String.valueOf(js().executeScript("return document.readyState"));
        } catch (WebDriverException e) {
            throw new DriverException("Could not read document.readyState: " + firstLine(e), e);
        }
    }

    // ── Probing ───────────────────────────────────────────────────────────────

    @Override
    public Optional<ElementHandle> findCandidate(SelectorKind kind, String value, Duration wait) {
        By by = toBy(kind, value);
        try {
            // An immediate lookup surfaces invalid selectors before any waiting
            List<WebElement> now = driver.findElements(by);
            if (!now.isEmpty()) {
                return Optional.of(new SeleniumElementHandle(now.get(0), kind, value));
            }
            if (wait == null || wait.isZero() || wait.isNegative()) {
                return Optional.empty();
            }
            WebElement found = new WebDriverWait(driver, wait, POLL_INTERVAL)
                .until(ExpectedConditions.presenceOfElementLocated(by));
            return Optional.of(new SeleniumElementHandle(found, kind, value));
        } catch (TimeoutException e) {
            return Optional.empty();
        } catch (InvalidSelectorException e) {
            throw new MalformedSelectorException(kind, value, e);
        } catch (WebDriverException e) {
            throw new DriverException("Probe " + kind + "=" + value + " failed: " + firstLine(e), e);
        }
    }

    @Override
    public boolean waitVisible(ElementHandle handle, Duration timeout) {
        WebElement el = unwrap(handle);
        try {
            if (el.isDisplayed()) return true;
            new WebDriverWait(driver, timeout, POLL_INTERVAL).until(ExpectedConditions.visibilityOf(el));
            return true;
        } catch (TimeoutException | StaleElementReferenceException e) {
            return false;
        } catch (WebDriverException e) {
            throw new DriverException("Visibility check failed for " + handle.describe(), e);
        }
    }

    @Override
    public boolean isEnabled(ElementHandle handle) {
        try {
            return unwrap(handle).isEnabled();
        } catch (StaleElementReferenceException e) {
            return false;
        } catch (WebDriverException e) {
            throw new DriverException("Enabled check failed for " + handle.describe(), e);
        }
    }

    @Override
    public boolean waitForText(ElementHandle handle, String text, Duration timeout) {
        WebElement el = unwrap(handle);
        try {
            new WebDriverWait(driver, timeout, POLL_INTERVAL)
                .until(ExpectedConditions.textToBePresentInElement(el, text));
            return true;
        } catch (TimeoutException | StaleElementReferenceException e) {
            return false;
        } catch (WebDriverException e) {
            throw new DriverException("Text check failed for " + handle.describe(), e);
        }
    }

    @Override
    public String textOf(ElementHandle handle) {
        try {
            return unwrap(handle).getText();
        } catch (WebDriverException e) {
            throw new DriverException("Could not read text of " + handle.describe(), e);
        }
    }

    @Override
    public int count(SelectorKind kind, String value) {
        try {
            return driver.findElements(toBy(kind, value)).size();
        } catch (InvalidSelectorException e) {
            throw new MalformedSelectorException(kind, value, e);
        } catch (WebDriverException e) {
            throw new DriverException("Count " + kind + "=" + value + " failed: " + firstLine(e), e);
        }
    }

    // ── Interaction ───────────────────────────────────────────────────────────

    @Override
    public void act(ElementHandle handle, ElementAction action, String value) {
        WebElement el = unwrap(handle);
        try {
            switch (action) {
                case CLICK:
                    el.click();
                    break;
                case TYPE:
                    el.clear();
                    el.sendKeys(value != null ? value : "");
                    break;
                case SELECT:
                    new Select(el).selectByVisibleText(value);
                    break;
                case HOVER:
                    new Actions(driver).moveToElement(el).perform();
                    break;
                case SCROLL_INTO_VIEW:
                    js().executeScript("arguments[0].scrollIntoView({block:'center'});", el);
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported action: " + action);
            }
            log.debug("SeleniumBrowserDriver: {} on {}", action, handle.describe());
        } catch (WebDriverException e) {
            throw new DriverException(action + " on " + handle.describe() + " failed: " + firstLine(e), e);
        }
    }

    @Override
    public Path screenshot(Path path) {
        if (!(driver instanceof TakesScreenshot)) {
            throw new DriverException("Driver " + driver.getClass().getSimpleName() +
                " cannot take screenshots");
        }
        try {
            byte[] png = ((TakesScreenshot) driver).getScreenshotAs(OutputType.BYTES);
            Path parent = path.getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.write(path, png);
            return path;
        } catch (IOException e) {
            throw new DriverException("Could not write screenshot to " + path, e);
        } catch (WebDriverException e) {
            throw new DriverException("Screenshot failed: " + firstLine(e), e);
        }
    }

    @Override
    public Object evaluateScript(String script, Object... args) {
        Object[] unwrapped = new Object[args.length];
        for (int i = 0; i < args.length; i++) {
            unwrapped[i] = args[i] instanceof ElementHandle ? unwrap((ElementHandle) args[i]) : args[i];
        }
        try {
            return js().executeScript(script, unwrapped);
        } catch (WebDriverException e) {
            throw new DriverException("Script failed: " + firstLine(e), e);
        }
    }

    // ── Private helpers ───────────────────────────────────────────────────────

    static By toBy(SelectorKind kind, String value) {
        switch (kind) {
            case ID:         return By.id(value);
            case NAME:       return By.name(value);
            case CLASS_NAME: return By.className(value);
            case TAG_NAME:   return By.tagName(value);
            case XPATH:      return By.xpath(value);
            case CSS:
            default:         return By.cssSelector(value);
        }
    }

    private JavascriptExecutor js() {
        if (!(driver instanceof JavascriptExecutor)) {
            throw new DriverException("Driver " + driver.getClass().getSimpleName() +
                " cannot execute JavaScript");
        }
        return (JavascriptExecutor) driver;
    }

    private static WebElement unwrap(ElementHandle handle) {
        if (!(handle instanceof SeleniumElementHandle)) {
            throw new IllegalArgumentException("Handle was not produced by SeleniumBrowserDriver: " + handle);
        }
        return ((SeleniumElementHandle) handle).getElement();
    }

    private static String firstLine(Throwable e) {
        String msg = e.getMessage();
        if (msg == null) return e.getClass().getSimpleName();
        int nl = msg.indexOf('\n');
        return nl >= 0 ? msg.substring(0, nl) : msg;
    }
}
