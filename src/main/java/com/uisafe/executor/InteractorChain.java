package com.uisafe.executor;

import java.util.List;

/**
 * Composes interactors into a single policy. The first interactor is outermost:
 * it receives an action that, when invoked, runs the rest of the chain around the
 * caller's action. An empty chain invokes the action directly.
 *
 * <pre>
 *   InteractorChain.of(logging, autoscroll).interact(element, element::click);
 *   // logging sees one interaction; autoscroll may invoke element.click() twice inside it
 * </pre>
 */
public class InteractorChain<C> implements Interactor<C> {

    private final List<Interactor<C>> interactors;

    public InteractorChain(List<? extends Interactor<C>> interactors) {
        this.interactors = List.copyOf(interactors);
    }

    @SafeVarargs
    public static <C> InteractorChain<C> of(Interactor<C>... interactors) {
        return new InteractorChain<>(List.of(interactors));
    }

    @Override
    public <R> R interact(C context, Action<R> action) {
        return interactAt(0, context, action);
    }

    public List<Interactor<C>> getInteractors() {
        return interactors;
    }

    private <R> R interactAt(int index, C context, Action<R> action) {
        if (index == interactors.size()) {
            return action.invoke();
        }
        return interactors.get(index).interact(context, () -> interactAt(index + 1, context, action));
    }
}
