package com.testweaver.support;

import com.testweaver.driver.BrowserDriver;
import com.testweaver.driver.DriverException;
import com.testweaver.driver.ElementAction;
import com.testweaver.driver.ElementHandle;
import com.testweaver.driver.MalformedSelectorException;
import com.testweaver.driver.SelectorKind;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory page for executor, resolver and handler tests.
 *
 * Elements are registered with the selectors that find them; every probe, action,
 * script and screenshot request is recorded for assertions. Nothing waits unless
 * {@link #sleepOnMiss()} is set, in which case a missed probe sleeps for its full
 * wait like a real browser would.
 */
public class FakeBrowserDriver implements BrowserDriver {

    private final List<FakeElement> elements   = new ArrayList<>();
    private final Set<String>       malformed  = new HashSet<>();
    private final List<Probe>       probes     = new ArrayList<>();
    private final List<Action>      actions    = new ArrayList<>();
    private final List<Script>      scripts    = new ArrayList<>();
    private final List<Path>        screenshots = new ArrayList<>();
    private final List<String>      visited    = new ArrayList<>();
    private final Deque<Long>       scrollHeights = new ArrayDeque<>();
    private final Deque<String>     readyStates   = new ArrayDeque<>();

    private long    scrollHeight = 1000;
    private boolean containerPresent = true;
    private boolean sleepOnMiss;
    private RuntimeException navigateFailure;
    private RuntimeException screenshotFailure;

    // ── Page setup ────────────────────────────────────────────────────────────

    public FakeElement element(String label) {
        FakeElement el = new FakeElement(label);
        elements.add(el);
        return el;
    }

    /** Probing this selector value raises {@link MalformedSelectorException}. */
    public FakeBrowserDriver malformed(String value) {
        malformed.add(value);
        return this;
    }

    /** Successive page heights returned by scrollHeight scripts; the last one sticks. */
    public FakeBrowserDriver scrollHeights(long... heights) {
        for (long h : heights) scrollHeights.add(h);
        return this;
    }

    /** Successive {@code document.readyState} values; afterwards "complete". */
    public FakeBrowserDriver readyStates(String... states) {
        for (String s : states) readyStates.add(s);
        return this;
    }

    public FakeBrowserDriver containerPresent(boolean present) {
        this.containerPresent = present;
        return this;
    }

    public FakeBrowserDriver sleepOnMiss() {
        this.sleepOnMiss = true;
        return this;
    }

    public FakeBrowserDriver failNavigation(RuntimeException failure) {
        this.navigateFailure = failure;
        return this;
    }

    public FakeBrowserDriver failScreenshots(RuntimeException failure) {
        this.screenshotFailure = failure;
        return this;
    }

    // ── Recorded calls ────────────────────────────────────────────────────────

    public List<Probe> getProbes()          { return probes; }
    public List<Action> getActions()        { return actions; }
    public List<Script> getScripts()        { return scripts; }
    public List<Path> getScreenshots()      { return screenshots; }
    public List<String> getVisited()        { return visited; }

    public List<Action> actionsOn(String label) {
        List<Action> out = new ArrayList<>();
        for (Action a : actions) if (a.label.equals(label)) out.add(a);
        return out;
    }

    public long totalProbeWaitMs() {
        return probes.stream().mapToLong(p -> p.wait.toMillis()).sum();
    }

    // ── BrowserDriver ─────────────────────────────────────────────────────────

    @Override
    public void navigate(String url) {
        visited.add(url);
        if (navigateFailure != null) throw navigateFailure;
    }

    @Override
    public String readyState() {
        return readyStates.isEmpty() ? "complete" : readyStates.poll();
    }

    @Override
    public Optional<ElementHandle> findCandidate(SelectorKind kind, String value, Duration wait) {
        probes.add(new Probe(kind, value, wait));
        if (malformed.contains(value)) {
            throw new MalformedSelectorException(kind, value, new IllegalArgumentException("bad selector"));
        }
        for (FakeElement el : elements) {
            if (el.present && el.matches(kind, value)) {
                return Optional.of(new FakeHandle(el, kind, value));
            }
        }
        if (sleepOnMiss && !wait.isZero()) {
            try {
                Thread.sleep(wait.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        return Optional.empty();
    }

    @Override
    public boolean waitVisible(ElementHandle handle, Duration timeout) {
        return el(handle).visible;
    }

    @Override
    public boolean isEnabled(ElementHandle handle) {
        return el(handle).enabled;
    }

    @Override
    public boolean waitForText(ElementHandle handle, String text, Duration timeout) {
        return el(handle).text.contains(text);
    }

    @Override
    public String textOf(ElementHandle handle) {
        return el(handle).text;
    }

    @Override
    public int count(SelectorKind kind, String value) {
        if (malformed.contains(value)) {
            throw new MalformedSelectorException(kind, value, new IllegalArgumentException("bad selector"));
        }
        return (int) elements.stream().filter(e -> e.present && e.matches(kind, value)).count();
    }

    @Override
    public void act(ElementHandle handle, ElementAction action, String value) {
        FakeElement el = el(handle);
        if (el.actFailure != null) throw el.actFailure;
        actions.add(new Action(el.label, action, value));
        switch (action) {
            case TYPE:   el.value = value; break;
            case SELECT: el.value = value; break;
            case CLICK:  if (el.onClick != null) el.onClick.run(); break;
            default:     break;
        }
    }

    @Override
    public Path screenshot(Path path) {
        if (screenshotFailure != null) throw screenshotFailure;
        screenshots.add(path);
        return path;
    }

    @Override
    public Object evaluateScript(String script, Object... args) {
        scripts.add(new Script(script, args));
        if (script.contains("scrollHeight") && script.startsWith("return")) {
            if (!scrollHeights.isEmpty()) {
                scrollHeight = scrollHeights.size() > 1 ? scrollHeights.poll() : scrollHeights.peek();
            }
            return scrollHeight;
        }
        if (script.contains("querySelector")) {
            return containerPresent;
        }
        return null;
    }

    private static FakeElement el(ElementHandle handle) {
        return ((FakeHandle) handle).element;
    }

    // ── Page model ────────────────────────────────────────────────────────────

    public static final class FakeElement {
        private final String      label;
        private final Set<String> selectors = new HashSet<>();
        private String  text = "";
        private String  value;
        private boolean present = true;
        private boolean visible = true;
        private boolean enabled = true;
        private Runnable onClick;
        private RuntimeException actFailure;

        FakeElement(String label) {
            this.label = label;
        }

        /** Found by id, and by the equivalent {@code #id} CSS selector. */
        public FakeElement id(String id) {
            return by(SelectorKind.ID, id).by(SelectorKind.CSS, "#" + id);
        }

        public FakeElement name(String name) {
            return by(SelectorKind.NAME, name);
        }

        public FakeElement by(SelectorKind kind, String value) {
            selectors.add(kind + ":" + value);
            return this;
        }

        public FakeElement text(String text)            { this.text = text; return this; }
        public FakeElement hidden()                     { this.visible = false; return this; }
        public FakeElement disabled()                   { this.enabled = false; return this; }
        public FakeElement absent()                     { this.present = false; return this; }
        public FakeElement onClick(Runnable r)          { this.onClick = r; return this; }
        public FakeElement failActions(RuntimeException e) { this.actFailure = e; return this; }

        public void appear()                            { this.present = true; this.visible = true; }

        public String getValue()                        { return value; }
        public String getLabel()                        { return label; }

        boolean matches(SelectorKind kind, String value) {
            return selectors.contains(kind + ":" + value);
        }
    }

    static final class FakeHandle implements ElementHandle {
        private final FakeElement  element;
        private final SelectorKind kind;
        private final String       selector;

        FakeHandle(FakeElement element, SelectorKind kind, String selector) {
            this.element  = element;
            this.kind     = kind;
            this.selector = selector;
        }

        @Override public SelectorKind getKind()  { return kind; }
        @Override public String getSelector()    { return selector; }

        @Override
        public String toString() {
            return element.label + "(" + describe() + ")";
        }
    }

    public static final class Probe {
        public final SelectorKind kind;
        public final String       value;
        public final Duration     wait;

        Probe(SelectorKind kind, String value, Duration wait) {
            this.kind  = kind;
            this.value = value;
            this.wait  = wait;
        }

        @Override
        public String toString() {
            return kind + "=" + value + " (" + wait.toMillis() + "ms)";
        }
    }

    public static final class Action {
        public final String        label;
        public final ElementAction action;
        public final String        value;

        Action(String label, ElementAction action, String value) {
            this.label  = label;
            this.action = action;
            this.value  = value;
        }

        @Override
        public String toString() {
            return action + " " + label + (value != null ? " '" + value + "'" : "");
        }
    }

    public static final class Script {
        public final String   source;
        public final Object[] args;

        Script(String source, Object[] args) {
            this.source = source;
            this.args   = args;
        }

        @Override
        public String toString() {
            return source;
        }
    }
}
