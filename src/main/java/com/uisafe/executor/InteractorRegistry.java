package com.uisafe.executor;

import com.uisafe.core.UiSafeConfig;
import com.uisafe.util.TypeHierarchy;
import org.reflections.Reflections;
import org.reflections.scanners.Scanners;
import org.reflections.util.ConfigurationBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps interaction context types to the {@link Interactor} that governs them.
 *
 * At construction time the registry:
 *   1. Uses the Reflections library to scan {@code com.uisafe.executor.interactors}
 *   2. Finds every class annotated with {@link InteractsWith}
 *   3. Instantiates each one, passing the {@link UiSafeConfig} when the class declares
 *      a constructor for it, otherwise through its no-arg constructor
 *   4. Registers it under the context type declared in the annotation
 *
 * Interactors can also be registered explicitly with {@link #register}, which replaces
 * any interactor already held for the same type.
 *
 * Misconfigured interactors (not implementing {@link Interactor}, duplicate context types,
 * failing constructors) cause an {@link IllegalStateException} at startup so the error is never silent.
 */
public class InteractorRegistry {

    private static final Logger log = LoggerFactory.getLogger(InteractorRegistry.class);
    static final String INTERACTORS_PACKAGE = "com.uisafe.executor.interactors";

    private final Map<Class<?>, Interactor<?>> registry = new ConcurrentHashMap<>();

    public InteractorRegistry(UiSafeConfig config) {
        discoverAndRegister(Objects.requireNonNull(config, "config"));
        log.info("InteractorRegistry: {} interactor(s) registered for {}", registry.size(), registry.keySet());
    }

    private InteractorRegistry() {}

    /** A registry with nothing discovered; populate it through {@link #register}. */
    public static InteractorRegistry empty() {
        return new InteractorRegistry();
    }

    // ── Registration ──────────────────────────────────────────────────────────

    public <C> InteractorRegistry register(Class<C> contextType, Interactor<? super C> interactor) {
        Objects.requireNonNull(contextType, "contextType");
        Objects.requireNonNull(interactor, "interactor");
        Interactor<?> previous = registry.put(contextType, interactor);
        if (previous != null) {
            log.info("InteractorRegistry: {} replaced {} with {}", contextType.getSimpleName(),
                previous.getClass().getSimpleName(), interactor.getClass().getSimpleName());
        }
        return this;
    }

    // ── Lookup ────────────────────────────────────────────────────────────────

    /**
     * Returns the interactor registered for exactly {@code contextType}, or empty.
     */
    public Optional<Interactor<?>> find(Class<?> contextType) {
        return Optional.ofNullable(registry.get(contextType));
    }

    /**
     * Returns the interactor for {@code contextType} or, failing that, for its nearest
     * registered supertype (see {@link TypeHierarchy#linearize}).
     */
    public Optional<Interactor<?>> resolve(Class<?> contextType) {
        for (Class<?> type : TypeHierarchy.linearize(contextType)) {
            Interactor<?> interactor = registry.get(type);
            if (interactor != null) {
                if (type != contextType) {
                    log.debug("InteractorRegistry: {} resolved via {} -> {}", contextType.getSimpleName(),
                        type.getSimpleName(), interactor.getClass().getSimpleName());
                }
                return Optional.of(interactor);
            }
        }
        return Optional.empty();
    }

    /**
     * {@link #resolve} typed for dispatch over untyped contexts. Callers must only pass the
     * returned interactor contexts that are instances of {@code contextType}.
     */
    public Optional<Interactor<Object>> resolveForContext(Class<?> contextType) {
        return resolve(contextType).map(InteractorRegistry::forContexts);
    }

    public boolean hasInteractor(Class<?> contextType) {
        return registry.containsKey(contextType);
    }

    public int size() {
        return registry.size();
    }

    // register() only stores an Interactor<? super C> under Class<C>, so every context of the
    // resolved type is one the interactor accepts.
    private static Interactor<Object> forContexts(Interactor<?> interactor) {
        return (Interactor<Object>) interactor;
    }

    // ── Discovery ─────────────────────────────────────────────────────────────

    private void discoverAndRegister(UiSafeConfig config) {
        Reflections reflections = new Reflections(
            new ConfigurationBuilder()
                .forPackage(INTERACTORS_PACKAGE)
                .setScanners(Scanners.TypesAnnotated)
        );

        Set<Class<?>> annotated = reflections.getTypesAnnotatedWith(InteractsWith.class);

        for (Class<?> cls : annotated) {
            Class<?> contextType = cls.getAnnotation(InteractsWith.class).value();

            if (!Interactor.class.isAssignableFrom(cls)) {
                throw new IllegalStateException(
                    "Class " + cls.getName() + " is annotated @InteractsWith(" + contextType.getSimpleName() +
                    ".class) but does not implement Interactor");
            }

            if (registry.containsKey(contextType)) {
                throw new IllegalStateException(
                    "Duplicate interactor for context type '" + contextType.getName() +
                    "': " + registry.get(contextType).getClass().getName() +
                    " and " + cls.getName());
            }

            registry.put(contextType, instantiate(cls, contextType, config));
            log.debug("InteractorRegistry: registered {} -> {}", contextType.getSimpleName(), cls.getSimpleName());
        }
    }

    private static Interactor<?> instantiate(Class<?> cls, Class<?> contextType, UiSafeConfig config) {
        try {
            Constructor<?> constructor;
            Object instance;
            try {
                constructor = cls.getDeclaredConstructor(UiSafeConfig.class);
                constructor.setAccessible(true);  // support package-private interactors
                instance = constructor.newInstance(config);
            } catch (NoSuchMethodException noConfigConstructor) {
                constructor = cls.getDeclaredConstructor();
                constructor.setAccessible(true);
                instance = constructor.newInstance();
            }
            return (Interactor<?>) instance;
        } catch (Exception e) {
            throw new IllegalStateException(
                "Failed to instantiate interactor " + cls.getName() +
                " for context type '" + contextType.getName() + "'.", e);
        }
    }
}
