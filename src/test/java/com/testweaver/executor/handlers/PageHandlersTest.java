package com.testweaver.executor.handlers;

import com.testweaver.core.ActionException;
import com.testweaver.core.TestWeaverConfig;
import com.testweaver.core.ValidationException;
import com.testweaver.driver.ElementAction;
import com.testweaver.driver.ElementHandle;
import com.testweaver.driver.SelectorKind;
import com.testweaver.executor.PageState;
import com.testweaver.executor.StepContext;
import com.testweaver.model.ActionKind;
import com.testweaver.model.Step;
import com.testweaver.model.StructureAnalysis;
import com.testweaver.parser.StepParser;
import com.testweaver.support.FakeBrowserDriver;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Page-level handlers (scroll, wait, verify) driven directly with a StepContext.
 * Same package gives access to the package-private handlers.
 */
public class PageHandlersTest {

    private static final StructureAnalysis FEED = new StructureAnalysis(List.of(),
        new StructureAnalysis.DynamicContent(true, false, ".feed", null), Map.of());

    private final StepParser parser = new StepParser();

    private FakeBrowserDriver driver;
    private PageState         pageState;
    private List<Long>        sleeps;

    @BeforeMethod
    public void setUp() {
        driver    = new FakeBrowserDriver();
        pageState = new PageState();
        sleeps    = new ArrayList<>();
    }

    private StepContext context(String raw, ElementHandle element, StructureAnalysis analysis) {
        Step step = parser.parseStep(raw).getStep();
        return new StepContext(driver, step, element, analysis, pageState, TestWeaverConfig.defaults(), sleeps::add);
    }

    private StepContext context(String raw) {
        return context(raw, null, StructureAnalysis.empty());
    }

    private ElementHandle find(String id) {
        return driver.findCandidate(SelectorKind.ID, id, Duration.ZERO).orElseThrow();
    }

    // ════════════════════════════════════════════════════════════════════════
    // SCROLL
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void scrollBottom_usesWindowWithoutContainer() {
        new ScrollHandler().execute(context("scroll down till end"));

        assertThat(driver.getScripts()).extracting(s -> s.source).containsExactly(ScrollHandler.WINDOW_BOTTOM);
    }

    @Test
    public void scrollBottom_prefersInfiniteScrollContainer() {
        new ScrollHandler().execute(context("scroll to the bottom", null, FEED));

        assertThat(driver.getScripts()).hasSize(1);
        assertThat(driver.getScripts().get(0).source).isEqualTo(ScrollHandler.CONTAINER_BOTTOM);
        assertThat(driver.getScripts().get(0).args).containsExactly(".feed");
    }

    @Test
    public void scrollTop_fallsBackToWindowWhenContainerMissing() {
        driver.containerPresent(false);

        new ScrollHandler().execute(context("scroll up till top", null, FEED));

        assertThat(driver.getScripts()).extracting(s -> s.source)
            .containsExactly(ScrollHandler.CONTAINER_TOP, ScrollHandler.WINDOW_TOP);
    }

    @Test
    public void scrollDirectionWithAmount_scrollsBy() {
        new ScrollHandler().execute(context("scroll up 250"));
        new ScrollHandler().execute(context("scroll right 40"));

        assertThat(driver.getScripts()).extracting(s -> s.source)
            .containsOnly(ScrollHandler.WINDOW_BY);
        assertThat(driver.getScripts().get(0).args).containsExactly(0L, -250L);
        assertThat(driver.getScripts().get(1).args).containsExactly(40L, 0L);
    }

    @Test
    public void scrollToElement_scrollsIntoView() {
        driver.element("footer").id("footer");
        ScrollHandler handler = new ScrollHandler();
        StepContext ctx = context("scroll to the footer", find("footer"), StructureAnalysis.empty());

        assertThat(handler.requiresElement(ctx.getStep())).isTrue();
        handler.execute(ctx);

        assertThat(driver.getActions()).extracting(a -> a.action).containsExactly(ElementAction.SCROLL_INTO_VIEW);
    }

    @Test
    public void scrollWithNonNumericAmount_isActionError() {
        Step step = Step.builder().rawText("scroll down lots").action(ActionKind.SCROLL)
            .target("down").value("lots").build();
        StepContext ctx = new StepContext(driver, step, null, StructureAnalysis.empty(), pageState,
            TestWeaverConfig.defaults(), sleeps::add);

        assertThatThrownBy(() -> new ScrollHandler().execute(ctx))
            .isInstanceOf(ActionException.class)
            .hasMessageContaining("lots");
    }

    // ════════════════════════════════════════════════════════════════════════
    // WAIT
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void waitForPage_sleepsStepTimeout() {
        WaitHandler handler = new WaitHandler();
        StepContext ctx = context("wait for 3 seconds");

        assertThat(handler.requiresElement(ctx.getStep())).isFalse();
        handler.execute(ctx);

        assertThat(sleeps).containsExactly(3_000L);
    }

    @Test
    public void waitForElement_isSatisfiedByResolution() {
        driver.element("spinner").id("spinner");
        WaitHandler handler = new WaitHandler();
        StepContext ctx = context("wait for the spinner", find("spinner"), StructureAnalysis.empty());

        assertThat(handler.requiresElement(ctx.getStep())).isTrue();
        handler.execute(ctx);

        assertThat(sleeps).isEmpty();
    }

    // ════════════════════════════════════════════════════════════════════════
    // VERIFY / ASSERT
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void verifyAppears_requiresVisibility() {
        driver.element("toast").id("toast").hidden();

        assertThatThrownBy(() -> new VerifyHandler().execute(
                context("verify that toast appears", find("toast"), StructureAnalysis.empty())))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("did not become visible");
    }

    @Test
    public void verifyContains_isCaseSensitive() {
        driver.element("banner").id("banner").text("Welcome back");

        new VerifyHandler().execute(context("verify banner contains Welcome", find("banner"), StructureAnalysis.empty()));
        assertThatThrownBy(() -> new VerifyHandler().execute(
                context("verify banner contains welcome", find("banner"), StructureAnalysis.empty())))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("actual text: 'Welcome back'");
    }

    @Test
    public void verifyNewContent_updatesRecordedHeight() {
        pageState.setLastScrollHeight(900);
        driver.scrollHeights(900, 1400);
        VerifyHandler handler = new VerifyHandler();
        StepContext ctx = context("verify that new content appears");

        assertThat(handler.requiresElement(ctx.getStep())).isFalse();
        handler.execute(ctx);

        assertThat(pageState.getLastScrollHeight()).isEqualTo(1400);
        assertThat(sleeps).containsExactly(250L);
    }

    @Test
    public void assertContains_checksText() {
        driver.element("status").id("order-status").text("Shipped on Monday");

        new AssertHandler().execute(context("assert order status contains Shipped",
            find("order-status"), StructureAnalysis.empty()));
        assertThatThrownBy(() -> new AssertHandler().execute(context("expect order status contains Delivered",
                find("order-status"), StructureAnalysis.empty())))
            .isInstanceOf(ValidationException.class);
    }
}
