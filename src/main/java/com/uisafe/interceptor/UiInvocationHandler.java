package com.uisafe.interceptor;

import com.uisafe.executor.Interactor;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.UndeclaredThrowableException;

/**
 * Routes every capability call made on a UiSafe proxy through an {@link Interactor}.
 *
 * Each call becomes an {@link com.uisafe.executor.Action} that invokes the same method
 * with the same arguments on the target. The interactor's result, or the failure it lets
 * through, is what the caller sees.
 *
 * <h3>Failures</h3>
 * Reflection wrappers are peeled off so the caller receives the target's own exception object.
 * Checked exceptions travel through the interactor inside an {@link UndeclaredThrowableException}
 * and are unwrapped again here when the method declares them.
 *
 * <h3>Object methods</h3>
 * {@code toString}, {@code hashCode} and {@code equals} go straight to the target, so a proxy
 * equals whatever its target equals. A proxy passed as the argument of {@code equals} is
 * unwrapped first. None of them pass through the interactor.
 */
public class UiInvocationHandler<C> implements InvocationHandler {

    private final Object                 target;
    private final CapabilitySet          capabilities;
    private final Interactor<? super C>  interactor;
    private final C                      context;

    public UiInvocationHandler(Object target, CapabilitySet capabilities,
                               Interactor<? super C> interactor, C context) {
        this.target       = target;
        this.capabilities = capabilities;
        this.interactor   = interactor;
        this.context      = context;
    }

    @Override
    public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
        if (method.getDeclaringClass() == Object.class) {
            return invokeObjectMethod(proxy, method, args);
        }
        try {
            return interactor.interact(context, () -> forward(method, args));
        } catch (UndeclaredThrowableException e) {
            throw declaredCauseOrSelf(method, e);
        }
    }

    public Object getTarget()                   { return target; }
    public CapabilitySet getCapabilities()      { return capabilities; }
    public Interactor<? super C> getInteractor() { return interactor; }
    public C getContext()                       { return context; }

    // ── Private helpers ───────────────────────────────────────────────────────

    private Object forward(Method method, Object[] args) {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new UndeclaredThrowableException(cause);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("UiInvocationHandler: Cannot access " + method, e);
        }
    }

    private Object invokeObjectMethod(Object proxy, Method method, Object[] args) {
        switch (method.getName()) {
            case "equals":
                Object other = args[0];
                return other == proxy || target.equals(UiSafeProxyFactory.unwrap(other));
            case "hashCode":
                return target.hashCode();
            case "toString":
                return target.toString();
            default:
                throw new UnsupportedOperationException("Unexpected Object method " + method);
        }
    }

    private static Throwable declaredCauseOrSelf(Method method, UndeclaredThrowableException e) {
        Throwable cause = e.getUndeclaredThrowable();
        if (cause == null) return e;
        for (Class<?> declared : method.getExceptionTypes()) {
            if (declared.isInstance(cause)) return cause;
        }
        return e;
    }
}
