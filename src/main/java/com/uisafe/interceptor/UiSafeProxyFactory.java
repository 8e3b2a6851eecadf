package com.uisafe.interceptor;

import com.uisafe.executor.Interactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Proxy;
import java.util.Collection;
import java.util.Objects;

/**
 * Builds dynamic proxies that present a target's capability interfaces while routing
 * every call through an {@link Interactor}.
 *
 * <pre>
 *   WebElement button = driver.findElement(By.id("submit"));
 *   WebElement safe = UiSafeProxyFactory.forCapability(
 *       WebElement.class, button, new AutoscrollWebInteractor(config), button);
 *   safe.click();   // scrolled into view and retried once if not interactable
 * </pre>
 *
 * Callers holding the proxy through one of its interfaces cannot tell it from the target.
 */
public final class UiSafeProxyFactory {

    private static final Logger log = LoggerFactory.getLogger(UiSafeProxyFactory.class);

    private UiSafeProxyFactory() {}

    /**
     * Returns a proxy over {@code target} implementing {@code capability} and its super-interfaces.
     *
     * @throws InvalidCapabilityException if {@code capability} is not an interface
     */
    public static <I, C> I forCapability(Class<I> capability, I target,
                                         Interactor<? super C> interactor, C context) {
        Objects.requireNonNull(target, "target");
        CapabilitySet capabilities = CapabilitySet.ofCapability(capability);
        return capability.cast(newProxy(target, capabilities, interactor, context));
    }

    /**
     * Returns a proxy over every interface {@code target}'s class implements.
     *
     * @throws EmptyCapabilitySetException if the class implements no interfaces
     */
    public static <C> Object forImplementation(Object target, Interactor<? super C> interactor, C context) {
        Objects.requireNonNull(target, "target");
        CapabilitySet capabilities = CapabilitySet.discover(target.getClass());
        return newProxy(target, capabilities, interactor, context);
    }

    /**
     * Returns a proxy over an explicit list of interfaces, each implemented by {@code target}.
     */
    public static <C> Object forCapabilities(Object target, Collection<Class<?>> capabilities,
                                             Interactor<? super C> interactor, C context) {
        return newProxy(target, CapabilitySet.of(target, capabilities), interactor, context);
    }

    /** True if {@code candidate} was produced by this factory. */
    public static boolean isUiSafeProxy(Object candidate) {
        return candidate != null
            && Proxy.isProxyClass(candidate.getClass())
            && Proxy.getInvocationHandler(candidate) instanceof UiInvocationHandler;
    }

    /** Returns the target behind a UiSafe proxy, or {@code candidate} itself if it is not one. */
    public static Object unwrap(Object candidate) {
        return isUiSafeProxy(candidate)
            ? ((UiInvocationHandler<?>) Proxy.getInvocationHandler(candidate)).getTarget()
            : candidate;
    }

    // ── Private helpers ───────────────────────────────────────────────────────

    private static <C> Object newProxy(Object target, CapabilitySet capabilities,
                                       Interactor<? super C> interactor, C context) {
        Objects.requireNonNull(interactor, "interactor");
        UiInvocationHandler<C> handler = new UiInvocationHandler<>(target, capabilities, interactor, context);
        try {
            Object proxy = Proxy.newProxyInstance(classLoaderFor(target, capabilities), capabilities.toArray(), handler);
            log.debug("UiSafeProxyFactory: Proxied {} as {} via {}", target.getClass().getSimpleName(),
                capabilities, interactor.getClass().getSimpleName());
            return proxy;
        } catch (IllegalArgumentException e) {
            throw new InvalidCapabilityException(null,
                "the JDK cannot proxy " + capabilities + ": " + e.getMessage(), e);
        }
    }

    // The first capability's own loader can see it; a target's loader may be a mocking or agent loader.
    private static ClassLoader classLoaderFor(Object target, CapabilitySet capabilities) {
        for (Class<?> iface : capabilities.getInterfaces()) {
            if (iface.getClassLoader() != null) return iface.getClassLoader();
        }
        ClassLoader loader = target.getClass().getClassLoader();
        return loader != null ? loader : ClassLoader.getSystemClassLoader();
    }
}
