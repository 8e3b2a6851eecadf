package com.uisafe.executor;

/**
 * Invokes the action exactly once. Used when no policy is registered for a context type.
 */
public class DirectInteractor<C> implements Interactor<C> {

    @Override
    public <R> R interact(C context, Action<R> action) {
        return action.invoke();
    }
}
