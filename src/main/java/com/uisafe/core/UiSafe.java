package com.uisafe.core;

import com.uisafe.executor.Action;
import com.uisafe.executor.DirectInteractor;
import com.uisafe.executor.Interactor;
import com.uisafe.executor.InteractorChain;
import com.uisafe.executor.InteractorRegistry;
import com.uisafe.executor.LoggingInteractor;
import com.uisafe.interceptor.UiSafeProxyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Main entry point for UiSafe.
 *
 * Resolves the {@link Interactor} for an interaction context from the {@link InteractorRegistry}
 * and wraps UI objects in proxies that route every call through it, with no changes at call sites.
 *
 * ## Usage
 *
 * <pre>
 *   UiSafe uiSafe = new UiSafe(UiSafeConfig.fromEnvironment());
 *
 *   WebDriver driver = uiSafe.getUiSafeProxy(WebDriver.class, new ChromeDriver());
 *   WebElement button = uiSafe.getUiSafeProxy(WebElement.class, driver.findElement(By.id("submit")));
 *   button.click();   // scrolled into view and retried once if not interactable
 *
 *   String title = uiSafe.interact(driver, driver::getTitle);
 * </pre>
 *
 * Context types without a registered interactor run their actions directly.
 * Thread-safe: the registry is read-only once configured and interactors keep no per-call state.
 */
public class UiSafe {

    private static final Logger log = LoggerFactory.getLogger(UiSafe.class);

    private final UiSafeConfig       config;
    private final InteractorRegistry registry;

    public UiSafe(UiSafeConfig config) {
        this(config, new InteractorRegistry(config));
    }

    public UiSafe(UiSafeConfig config, InteractorRegistry registry) {
        this.config   = Objects.requireNonNull(config, "config");
        this.registry = Objects.requireNonNull(registry, "registry");
        log.info("UiSafe: Initialized — {}", config);
    }

    public static UiSafe fromEnvironment() {
        return new UiSafe(UiSafeConfig.fromEnvironment());
    }

    // ── Primary API ───────────────────────────────────────────────────────────

    /**
     * Returns the interactor governing {@code contextType}, wrapped in interaction logging
     * when {@link UiSafeConfig#isLogInteractions()} is set.
     */
    public Interactor<Object> interactorFor(Class<?> contextType) {
        Interactor<Object> policy = registry.resolveForContext(contextType)
            .orElseGet(() -> {
                log.debug("UiSafe: No interactor for {} — actions run directly", contextType.getName());
                return new DirectInteractor<Object>();
            });
        return config.isLogInteractions()
            ? InteractorChain.of(new LoggingInteractor<Object>(), policy)
            : policy;
    }

    /** Executes {@code action} against {@code context} under the context type's interactor. */
    public <R> R interact(Object context, Action<R> action) {
        Objects.requireNonNull(context, "context");
        return interactorFor(context.getClass()).interact(context, action);
    }

    /**
     * Returns a proxy over {@code view} presenting {@code capability}; the view is its own
     * interaction context. {@code capability} must be an interface.
     */
    public <I> I getUiSafeProxy(Class<I> capability, I view) {
        Objects.requireNonNull(view, "view");
        return getUiSafeProxy(capability, view, view);
    }

    /**
     * Returns a proxy over {@code target} presenting {@code capability} whose calls are
     * governed by the interactor for {@code context}'s type.
     */
    public <I> I getUiSafeProxy(Class<I> capability, I target, Object context) {
        Objects.requireNonNull(context, "context");
        return UiSafeProxyFactory.forCapability(capability, target, interactorFor(context.getClass()), context);
    }

    /**
     * Returns a proxy over every interface {@code view}'s class implements; the view is
     * its own interaction context.
     */
    public Object getUiSafeProxyFromImplementation(Object view) {
        Objects.requireNonNull(view, "view");
        return UiSafeProxyFactory.forImplementation(view, interactorFor(view.getClass()), view);
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public UiSafeConfig getConfig()         { return config; }
    public InteractorRegistry getRegistry() { return registry; }
}
