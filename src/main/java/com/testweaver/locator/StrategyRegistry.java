package com.testweaver.locator;

import org.reflections.Reflections;
import org.reflections.scanners.Scanners;
import org.reflections.util.ConfigurationBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Discovers and holds the {@link ResolutionStrategy} tiers in a fixed total order.
 *
 * At construction time the registry scans {@code com.testweaver.locator.strategies}
 * for classes annotated with {@link ResolutionTier}, instantiates each through its
 * no-arg constructor and sorts them by priority, then id. The order never depends
 * on classpath scanning order.
 *
 * Adding a tier requires only a new annotated class in the strategies package.
 */
public class StrategyRegistry {

    private static final Logger log = LoggerFactory.getLogger(StrategyRegistry.class);
    private static final String STRATEGIES_PACKAGE = "com.testweaver.locator.strategies";

    private final List<Tier> tiers;

    public StrategyRegistry() {
        this.tiers = Collections.unmodifiableList(discoverAndSort());
        log.info("StrategyRegistry: {} tier(s) registered in order: {}", tiers.size(), tierIds());
    }

    /**
     * Builds a registry from explicit tiers, already in probe order.
     */
    public StrategyRegistry(List<Tier> tiers) {
        this.tiers = List.copyOf(tiers);
    }

    // ── Primary API ───────────────────────────────────────────────────────────

    public List<Tier> getTiers() {
        return tiers;
    }

    public int size() {
        return tiers.size();
    }

    public List<String> tierIds() {
        return tiers.stream().map(Tier::getId).toList();
    }

    // ── Discovery ─────────────────────────────────────────────────────────────

    private List<Tier> discoverAndSort() {
        Reflections reflections = new Reflections(
            new ConfigurationBuilder()
                .forPackage(STRATEGIES_PACKAGE)
                .setScanners(Scanners.TypesAnnotated)
        );

        Set<Class<?>> annotated = reflections.getTypesAnnotatedWith(ResolutionTier.class);

        List<Tier> discovered = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();

        for (Class<?> cls : annotated) {
            ResolutionTier annotation = cls.getAnnotation(ResolutionTier.class);
            String id = annotation.id();

            if (!ResolutionStrategy.class.isAssignableFrom(cls)) {
                throw new IllegalStateException(
                    "Class " + cls.getName() + " is annotated @ResolutionTier(id=\"" + id +
                    "\") but does not implement ResolutionStrategy");
            }
            if (!seenIds.add(id)) {
                throw new IllegalStateException(
                    "Duplicate resolution tier id \"" + id + "\" found in " + cls.getName());
            }

            try {
                var constructor = cls.getDeclaredConstructor();
                constructor.setAccessible(true);
                ResolutionStrategy strategy = (ResolutionStrategy) constructor.newInstance();
                discovered.add(new Tier(id, annotation.priority(), strategy));
                log.debug("StrategyRegistry: registered '{}' (priority={}) -> {}",
                    id, annotation.priority(), cls.getSimpleName());
            } catch (ReflectiveOperationException e) {
                throw new IllegalStateException(
                    "Failed to instantiate resolution strategy " + cls.getName() + ".", e);
            }
        }

        discovered.sort(Comparator.comparingInt(Tier::getPriority).thenComparing(Tier::getId));
        return discovered;
    }

    // ── Tier ──────────────────────────────────────────────────────────────────

    /** A strategy together with its registration metadata. */
    public static final class Tier {
        private final String             id;
        private final int                priority;
        private final ResolutionStrategy strategy;

        public Tier(String id, int priority, ResolutionStrategy strategy) {
            this.id       = id;
            this.priority = priority;
            this.strategy = strategy;
        }

        public String getId()                   { return id; }
        public int getPriority()                { return priority; }
        public ResolutionStrategy getStrategy() { return strategy; }
    }
}
