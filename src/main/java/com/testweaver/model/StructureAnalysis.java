package com.testweaver.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * What is known about a page's structure before the scenario runs: its forms,
 * its dynamic-content behaviour and any extra keyword → selector suggestions.
 *
 * Immutable and safe to share between concurrent runs. Entries with a blank keyword
 * or selector are dropped on construction.
 *
 * <pre>
 * {
 *   "forms": [ { "id": "signup", "inputs": { "email": "#email" } } ],
 *   "dynamic_content": { "infinite_scroll": true, "scroll_container": ".feed" },
 *   "suggested_selectors": { "submit": "button[type=submit]" }
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class StructureAnalysis {

    private static final StructureAnalysis EMPTY =
        new StructureAnalysis(null, null, null);

    private final List<FormStructure> forms;
    private final DynamicContent      dynamicContent;
    private final Map<String, String> suggestedSelectors;
    private final List<StructureHint> hints;

    @JsonCreator
    public StructureAnalysis(
            @JsonProperty("forms")               List<FormStructure> forms,
            @JsonProperty("dynamic_content")     DynamicContent dynamicContent,
            @JsonProperty("suggested_selectors") Map<String, String> suggestedSelectors) {
        this.forms              = forms != null
            ? forms.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableList())
            : Collections.emptyList();
        this.dynamicContent     = dynamicContent != null ? dynamicContent : DynamicContent.NONE;
        this.suggestedSelectors = usable(suggestedSelectors);
        this.hints              = buildHints();
    }

    public static StructureAnalysis empty() {
        return EMPTY;
    }

    public List<FormStructure> getForms()               { return forms; }
    @JsonProperty("dynamic_content")
    public DynamicContent getDynamicContent()           { return dynamicContent; }
    @JsonProperty("suggested_selectors")
    public Map<String, String> getSuggestedSelectors()  { return suggestedSelectors; }

    /**
     * Flattens the analysis into hints in resolution order: form fields, then
     * dynamic-content controls, then free suggestions.
     */
    @JsonIgnore
    public List<StructureHint> toHints() {
        return hints;
    }

    private List<StructureHint> buildHints() {
        List<StructureHint> built = new ArrayList<>();
        for (FormStructure form : forms) {
            form.getInputs().forEach((name, selector) ->
                built.add(new StructureHint(name, selector, StructureHint.Category.FORM_FIELD)));
        }
        if (dynamicContent.getLoadMoreButton() != null) {
            built.add(new StructureHint("load more", dynamicContent.getLoadMoreButton(),
                StructureHint.Category.DYNAMIC_CONTROL));
        }
        if (dynamicContent.getScrollContainer() != null) {
            built.add(new StructureHint("scroll container", dynamicContent.getScrollContainer(),
                StructureHint.Category.DYNAMIC_CONTROL));
        }
        suggestedSelectors.forEach((keyword, selector) ->
            built.add(new StructureHint(keyword, selector, StructureHint.Category.OTHER)));
        return Collections.unmodifiableList(built);
    }

    private static Map<String, String> usable(Map<String, String> selectors) {
        if (selectors == null) return Collections.emptyMap();
        Map<String, String> kept = new LinkedHashMap<>();
        selectors.forEach((keyword, selector) -> {
            if (keyword != null && !keyword.isBlank() && selector != null && !selector.isBlank()) {
                kept.put(keyword, selector);
            }
        });
        return Collections.unmodifiableMap(kept);
    }

    // ── Nested types ──────────────────────────────────────────────────────────

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class FormStructure {
        private final String              id;
        private final Map<String, String> inputs;

        @JsonCreator
        public FormStructure(@JsonProperty("id") String id,
                             @JsonProperty("inputs") Map<String, String> inputs) {
            this.id     = id;
            this.inputs = usable(inputs);
        }

        public String getId()                   { return id; }
        public Map<String, String> getInputs()  { return inputs; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class DynamicContent {
        static final DynamicContent NONE = new DynamicContent(false, false, null, null);

        private final boolean infiniteScroll;
        private final boolean loadMore;
        private final String  scrollContainer;
        private final String  loadMoreButton;

        @JsonCreator
        public DynamicContent(@JsonProperty("infinite_scroll")  boolean infiniteScroll,
                              @JsonProperty("load_more")        boolean loadMore,
                              @JsonProperty("scroll_container") String scrollContainer,
                              @JsonProperty("load_more_button") String loadMoreButton) {
            this.infiniteScroll  = infiniteScroll;
            this.loadMore        = loadMore;
            this.scrollContainer = blankToNull(scrollContainer);
            this.loadMoreButton  = blankToNull(loadMoreButton);
        }

        @JsonProperty("infinite_scroll")
        public boolean isInfiniteScroll()   { return infiniteScroll; }
        @JsonProperty("load_more")
        public boolean isLoadMore()         { return loadMore; }
        @JsonProperty("scroll_container")
        public String getScrollContainer()  { return scrollContainer; }
        @JsonProperty("load_more_button")
        public String getLoadMoreButton()   { return loadMoreButton; }

        private static String blankToNull(String s) {
            return (s == null || s.isBlank()) ? null : s.trim();
        }
    }
}
