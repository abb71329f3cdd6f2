package com.testweaver.driver;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * The only way the locator and the executor touch a browser.
 *
 * <h3>Contract</h3>
 * <ul>
 *   <li>Probes ({@link #findCandidate}) return an empty Optional for "not here"
 *       after waiting at most {@code wait}. They never throw for absence.</li>
 *   <li>A syntactically invalid selector raises {@link MalformedSelectorException}.</li>
 *   <li>Session-level faults raise {@link DriverException}.</li>
 *   <li>All waits are bounded by the duration passed in; implementations must not
 *       add implicit waits of their own.</li>
 * </ul>
 */
public interface BrowserDriver {

    void navigate(String url);

    /** {@code document.readyState} of the current page. */
    String readyState();

    Optional<ElementHandle> findCandidate(SelectorKind kind, String value, Duration wait);

    /** Waits up to {@code timeout} for the element to be displayed. */
    boolean waitVisible(ElementHandle handle, Duration timeout);

    boolean isEnabled(ElementHandle handle);

    /** Waits up to {@code timeout} for the element's text to contain {@code text} (case-sensitive). */
    boolean waitForText(ElementHandle handle, String text, Duration timeout);

    String textOf(ElementHandle handle);

    /** Number of elements currently matching the selector, without waiting. */
    int count(SelectorKind kind, String value);

    void act(ElementHandle handle, ElementAction action, String value);

    /**
     * Writes a PNG of the current viewport to {@code path}, creating parent directories.
     *
     * @return the written path
     */
    Path screenshot(Path path);

    /**
     * Runs a script in the page. {@link ElementHandle} arguments are passed as elements.
     */
    Object evaluateScript(String script, Object... args);
}
