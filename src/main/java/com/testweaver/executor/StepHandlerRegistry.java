package com.testweaver.executor;

import com.testweaver.model.ActionKind;
import org.reflections.Reflections;
import org.reflections.scanners.Scanners;
import org.reflections.util.ConfigurationBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * The dispatch table from {@link ActionKind} to {@link StepHandler}.
 *
 * At construction time the registry:
 *   1. Scans {@code com.testweaver.executor.handlers} with Reflections
 *   2. Finds every class annotated with {@link HandlesAction}
 *   3. Instantiates each one via its no-arg constructor
 *   4. Registers it under the annotated kind
 *   5. Fails if any kind is left without a handler
 *
 * Duplicates, wrong types and gaps all raise {@link IllegalStateException} at
 * startup, so a scenario can never reach a step kind nobody handles.
 */
public class StepHandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(StepHandlerRegistry.class);
    private static final String HANDLERS_PACKAGE = "com.testweaver.executor.handlers";

    private final Map<ActionKind, StepHandler> registry;

    public StepHandlerRegistry() {
        this.registry = Collections.unmodifiableMap(requireComplete(discover()));
        log.info("StepHandlerRegistry: {} handler(s) registered", registry.size());
    }

    /**
     * Builds a registry from an explicit table. Every kind must be present.
     */
    public StepHandlerRegistry(Map<ActionKind, StepHandler> handlers) {
        EnumMap<ActionKind, StepHandler> table = new EnumMap<>(ActionKind.class);
        table.putAll(handlers);
        this.registry = Collections.unmodifiableMap(requireComplete(table));
    }

    /**
     * Returns a copy of this registry with one kind served by a different handler.
     */
    public StepHandlerRegistry with(ActionKind kind, StepHandler handler) {
        EnumMap<ActionKind, StepHandler> copy = new EnumMap<>(registry);
        copy.put(kind, handler);
        return new StepHandlerRegistry(copy);
    }

    // ── Lookup ────────────────────────────────────────────────────────────────

    public StepHandler handlerFor(ActionKind kind) {
        return registry.get(kind);
    }

    public int size() {
        return registry.size();
    }

    // ── Discovery ─────────────────────────────────────────────────────────────

    private static EnumMap<ActionKind, StepHandler> discover() {
        Reflections reflections = new Reflections(
            new ConfigurationBuilder()
                .forPackage(HANDLERS_PACKAGE)
                .setScanners(Scanners.TypesAnnotated)
        );

        Set<Class<?>> annotated = reflections.getTypesAnnotatedWith(HandlesAction.class);
        EnumMap<ActionKind, StepHandler> found = new EnumMap<>(ActionKind.class);

        for (Class<?> cls : annotated) {
            ActionKind kind = cls.getAnnotation(HandlesAction.class).value();

            if (!StepHandler.class.isAssignableFrom(cls)) {
                throw new IllegalStateException(
                    "Class " + cls.getName() + " is annotated @HandlesAction(" + kind +
                    ") but does not implement StepHandler");
            }
            if (found.containsKey(kind)) {
                throw new IllegalStateException(
                    "Duplicate handler for action kind " + kind + ": " +
                    found.get(kind).getClass().getName() + " and " + cls.getName());
            }

            try {
                var constructor = cls.getDeclaredConstructor();
                constructor.setAccessible(true);  // handlers are package-private
                found.put(kind, (StepHandler) constructor.newInstance());
                log.debug("StepHandlerRegistry: registered {} -> {}", kind, cls.getSimpleName());
            } catch (ReflectiveOperationException e) {
                throw new IllegalStateException(
                    "Failed to instantiate handler " + cls.getName() + " for action kind " + kind + ".", e);
            }
        }
        return found;
    }

    private static EnumMap<ActionKind, StepHandler> requireComplete(EnumMap<ActionKind, StepHandler> table) {
        Set<ActionKind> missing = EnumSet.allOf(ActionKind.class);
        missing.removeAll(table.keySet());
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No step handler registered for action kind(s) " + missing);
        }
        return table;
    }
}
