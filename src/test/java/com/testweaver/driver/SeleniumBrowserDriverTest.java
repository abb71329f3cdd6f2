package com.testweaver.driver;

import org.mockito.Mockito;
import org.openqa.selenium.By;
import org.openqa.selenium.InvalidSelectorException;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.NoSuchSessionException;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.mockito.Mockito.withSettings;

/**
 * The Selenium adapter against a mocked WebDriver: probe semantics, error
 * translation and action mapping. No browser is started.
 */
public class SeleniumBrowserDriverTest {

    private WebDriver             webDriver;
    private WebElement            element;
    private SeleniumBrowserDriver driver;

    @BeforeMethod
    public void setUp() {
        webDriver = mock(WebDriver.class,
            withSettings().extraInterfaces(JavascriptExecutor.class, TakesScreenshot.class));
        element   = mock(WebElement.class);
        driver    = new SeleniumBrowserDriver(webDriver);
    }

    private ElementHandle handle() {
        return new SeleniumElementHandle(element, SelectorKind.ID, "email");
    }

    // ── Probing ───────────────────────────────────────────────────────────────

    @Test
    public void findCandidate_immediateHitSkipsWaiting() {
        when(webDriver.findElements(By.id("email"))).thenReturn(List.of(element));

        Optional<ElementHandle> found = driver.findCandidate(SelectorKind.ID, "email", Duration.ofSeconds(5));

        assertThat(found).isPresent();
        assertThat(found.get().describe()).isEqualTo("id=email");
        verify(webDriver, never()).findElement(any(By.class));
    }

    @Test
    public void findCandidate_missWithZeroWaitIsEmpty() {
        when(webDriver.findElements(any(By.class))).thenReturn(List.of());

        assertThat(driver.findCandidate(SelectorKind.CSS, "#nope", Duration.ZERO)).isEmpty();
    }

    @Test
    public void findCandidate_missAfterWaitIsEmpty() {
        when(webDriver.findElements(any(By.class))).thenReturn(List.of());
        when(webDriver.findElement(any(By.class))).thenThrow(new org.openqa.selenium.NoSuchElementException("no"));

        assertThat(driver.findCandidate(SelectorKind.XPATH, "//nope", Duration.ofMillis(200))).isEmpty();
    }

    @Test
    public void findCandidate_invalidSelectorIsMalformed() {
        when(webDriver.findElements(any(By.class))).thenThrow(new InvalidSelectorException("bad xpath"));

        assertThatThrownBy(() -> driver.findCandidate(SelectorKind.XPATH, "//[", Duration.ZERO))
            .isInstanceOf(MalformedSelectorException.class)
            .satisfies(e -> assertThat(((MalformedSelectorException) e).getSelector()).isEqualTo("//["));
    }

    @Test
    public void findCandidate_sessionFaultIsDriverException() {
        when(webDriver.findElements(any(By.class))).thenThrow(new NoSuchSessionException("gone"));

        assertThatThrownBy(() -> driver.findCandidate(SelectorKind.ID, "email", Duration.ZERO))
            .isInstanceOf(DriverException.class);
    }

    @Test
    public void count_returnsCurrentMatches() {
        when(webDriver.findElements(By.cssSelector("li"))).thenReturn(List.of(element, element));

        assertThat(driver.count(SelectorKind.CSS, "li")).isEqualTo(2);
    }

    @Test
    public void toBy_mapsEveryKind() {
        assertThat(SeleniumBrowserDriver.toBy(SelectorKind.ID, "a")).isEqualTo(By.id("a"));
        assertThat(SeleniumBrowserDriver.toBy(SelectorKind.NAME, "a")).isEqualTo(By.name("a"));
        assertThat(SeleniumBrowserDriver.toBy(SelectorKind.CLASS_NAME, "a")).isEqualTo(By.className("a"));
        assertThat(SeleniumBrowserDriver.toBy(SelectorKind.TAG_NAME, "a")).isEqualTo(By.tagName("a"));
        assertThat(SeleniumBrowserDriver.toBy(SelectorKind.CSS, "a")).isEqualTo(By.cssSelector("a"));
        assertThat(SeleniumBrowserDriver.toBy(SelectorKind.XPATH, "//a")).isEqualTo(By.xpath("//a"));
    }

    // ── Element state ─────────────────────────────────────────────────────────

    @Test
    public void waitVisible_displayedElementIsImmediate() {
        when(element.isDisplayed()).thenReturn(true);

        assertThat(driver.waitVisible(handle(), Duration.ofSeconds(5))).isTrue();
    }

    @Test
    public void isEnabled_staleElementIsFalse() {
        when(element.isEnabled()).thenThrow(new org.openqa.selenium.StaleElementReferenceException("stale"));

        assertThat(driver.isEnabled(handle())).isFalse();
    }

    // ── Interaction ───────────────────────────────────────────────────────────

    @Test
    public void act_typeClearsThenSendsKeys() {
        driver.act(handle(), ElementAction.TYPE, "a@b.com");

        var order = inOrder(element);
        order.verify(element).clear();
        order.verify(element).sendKeys("a@b.com");
    }

    @Test
    public void act_failureIsDriverException() {
        Mockito.doThrow(new WebDriverException("element click intercepted")).when(element).click();

        assertThatThrownBy(() -> driver.act(handle(), ElementAction.CLICK, null))
            .isInstanceOf(DriverException.class)
            .hasMessageContaining("CLICK");
    }

    @Test
    public void navigate_failureIsDriverException() {
        Mockito.doThrow(new WebDriverException("net::ERR_NAME_NOT_RESOLVED")).when(webDriver).get("http://nowhere");

        assertThatThrownBy(() -> driver.navigate("http://nowhere"))
            .isInstanceOf(DriverException.class)
            .hasMessageContaining("http://nowhere");
    }

    @Test
    public void evaluateScript_unwrapsHandles() {
        JavascriptExecutor js = (JavascriptExecutor) webDriver;
        when(js.executeScript("return arguments[0].id;", element, 5)).thenReturn("email");

        assertThat(driver.evaluateScript("return arguments[0].id;", handle(), 5)).isEqualTo("email");
    }

    @Test
    public void readyState_readsDocumentState() {
        when(((JavascriptExecutor) webDriver).executeScript("return document.readyState")).thenReturn("complete");

        assertThat(driver.readyState()).isEqualTo("complete");
    }

    @Test
    public void screenshot_writesPngCreatingDirectories() throws Exception {
        byte[] png = {(byte) 0x89, 'P', 'N', 'G'};
        when(((TakesScreenshot) webDriver).getScreenshotAs(OutputType.BYTES)).thenReturn(png);
        Path target = Files.createTempDirectory("shots").resolve("nested/step_1_error.png");

        Path written = driver.screenshot(target);

        assertThat(written).isEqualTo(target);
        assertThat(Files.readAllBytes(target)).isEqualTo(png);
    }
}
