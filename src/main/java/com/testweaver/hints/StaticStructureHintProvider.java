package com.testweaver.hints;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.testweaver.core.ConfigurationException;
import com.testweaver.model.StructureAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Serves structure analyses prepared ahead of time.
 *
 * A hints file (JSON, or YAML when the extension is .yaml/.yml) holds either one
 * analysis applied to every URL, or a {@code pages} map from URL prefix to analysis:
 *
 * <pre>
 * pages:
 *   "https://shop.example.com/login":
 *     forms: [ { id: login, inputs: { email: "#user-email" } } ]
 *   "https://shop.example.com":
 *     dynamic_content: { infinite_scroll: true, scroll_container: ".feed" }
 * </pre>
 *
 * The longest matching prefix wins. Top-level keys next to {@code pages} form the
 * analysis for URLs with no matching prefix; without them such URLs get an empty one.
 */
public class StaticStructureHintProvider implements StructureHintProvider {

    private static final Logger log = LoggerFactory.getLogger(StaticStructureHintProvider.class);

    private final Map<String, StructureAnalysis> byPrefix;
    private final StructureAnalysis              fallback;

    public StaticStructureHintProvider(Map<String, StructureAnalysis> byPrefix, StructureAnalysis fallback) {
        this.byPrefix = Collections.unmodifiableMap(new LinkedHashMap<>(byPrefix));
        this.fallback = fallback != null ? fallback : StructureAnalysis.empty();
    }

    /** One analysis for every URL. */
    public StaticStructureHintProvider(StructureAnalysis analysis) {
        this(Collections.emptyMap(), analysis);
    }

    // ── Loading ───────────────────────────────────────────────────────────────

    public static StaticStructureHintProvider fromFile(Path file) {
        ObjectMapper mapper = mapperFor(file);
        try {
            JsonNode root = mapper.readTree(file.toFile());
            if (root == null || !root.isObject()) {
                throw new ConfigurationException("Hints file " + file + " must contain a JSON/YAML object");
            }
            StaticStructureHintProvider provider;
            if (root.has("pages")) {
                Map<String, StructureAnalysis> pages = new LinkedHashMap<>();
                Iterator<Map.Entry<String, JsonNode>> it = root.get("pages").fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> e = it.next();
                    pages.put(e.getKey(), mapper.treeToValue(e.getValue(), StructureAnalysis.class));
                }
                ObjectNode rest = ((ObjectNode) root).deepCopy();
                rest.remove("pages");
                StructureAnalysis fallback = rest.isEmpty() ? null : mapper.treeToValue(rest, StructureAnalysis.class);
                provider = new StaticStructureHintProvider(pages, fallback);
            } else {
                provider = new StaticStructureHintProvider(mapper.treeToValue(root, StructureAnalysis.class));
            }
            log.info("StaticStructureHintProvider: loaded {} ({} page prefix(es))", file, provider.byPrefix.size());
            return provider;
        } catch (IOException e) {
            throw new ConfigurationException("Could not read hints file " + file + ": " + e.getMessage(), e);
        }
    }

    // ── StructureHintProvider ─────────────────────────────────────────────────

    @Override
    public StructureAnalysis analyze(String url) {
        String best = null;
        for (String prefix : byPrefix.keySet()) {
            if (url != null && url.startsWith(prefix) && (best == null || prefix.length() > best.length())) {
                best = prefix;
            }
        }
        return best != null ? byPrefix.get(best) : fallback;
    }

    private static ObjectMapper mapperFor(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        ObjectMapper mapper = (name.endsWith(".yaml") || name.endsWith(".yml"))
            ? new ObjectMapper(new YAMLFactory())
            : new ObjectMapper();
        return mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }
}
