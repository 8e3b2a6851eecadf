package com.uisafe.executor;

/**
 * A deferred, possibly failing unit of UI work: "click the button", "read the text".
 *
 * Created fresh for every call site invocation and handed to exactly one
 * {@link Interactor#interact} call. Interactors that retry invoke it more than once,
 * so actions passed to retrying policies must tolerate repeated invocation.
 */
@FunctionalInterface
public interface Action<R> {
    R invoke();
}
