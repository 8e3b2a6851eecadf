package com.uisafe.executor;

/**
 * Decides how an {@link Action} against an interaction context is actually executed:
 * directly, with retries, with a corrective action, or through a chain of other interactors.
 *
 * <h3>Contract</h3>
 * <ul>
 *   <li>Return the value of the attempt the policy considers successful</li>
 *   <li>Propagate the failure the policy considers terminal; never wrap it or invent a new one</li>
 *   <li>Limit side effects (corrective sub-interactions) to the supplied {@code context}</li>
 *   <li>Be stateless or config-only: one instance is shared by every interaction it governs,
 *       so all per-call state must live on the stack of {@link #interact}</li>
 * </ul>
 *
 * Implementations are selected per context type by the {@link InteractorRegistry},
 * never by inspecting the action.
 *
 * @param <C> the interaction context type, e.g. {@code WebElement} or {@code WebDriver}
 */
public interface Interactor<C> {

    /**
     * Executes {@code action} against {@code context} under this interactor's policy.
     *
     * @param context the thing being interacted with; passed to corrective actions, never mutated
     * @param action  a function-wrapper of the interaction to perform
     */
    <R> R interact(C context, Action<R> action);
}
