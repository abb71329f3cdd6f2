package com.testweaver.driver;

import org.openqa.selenium.WebElement;

/**
 * {@link ElementHandle} backed by a Selenium {@link WebElement}.
 */
public final class SeleniumElementHandle implements ElementHandle {

    private final WebElement   element;
    private final SelectorKind kind;
    private final String       selector;

    public SeleniumElementHandle(WebElement element, SelectorKind kind, String selector) {
        this.element  = element;
        this.kind     = kind;
        this.selector = selector;
    }

    public WebElement getElement()  { return element; }

    @Override
    public SelectorKind getKind()   { return kind; }

    @Override
    public String getSelector()     { return selector; }

    @Override
    public String toString() {
        return "SeleniumElementHandle{" + describe() + "}";
    }
}
