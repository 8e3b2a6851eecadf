package com.uisafe.executor;

/**
 * A sub-interaction performed against the same context before a failed action is retried,
 * e.g. scrolling an element into view or dismissing an alert.
 *
 * Any exception thrown here is treated as a failed recovery.
 */
@FunctionalInterface
public interface CorrectiveAction<C> {
    void perform(C context);
}
