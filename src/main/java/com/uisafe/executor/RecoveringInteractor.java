package com.uisafe.executor;

import com.uisafe.model.RecoveryState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Retry-with-corrective-action policy.
 *
 * ## Execution model
 *
 *   ATTEMPTING  the action is invoked once.
 *               success                          → DONE, value returned as-is
 *               failure, not recoverable         → DONE, failure rethrown immediately
 *               failure, recoverable             → RECOVERING, failure captured
 *   RECOVERING  the corrective action runs, then the action is invoked a second time.
 *               both complete                    → DONE, second value returned
 *               either one throws anything       → DONE, the CAPTURED failure is rethrown
 *
 * Exactly one recovery is attempted. Secondary failures raised while recovering are
 * dropped (logged at DEBUG) so the caller always sees the first failure that occurred.
 *
 * The policy holds only configuration; the captured failure lives on the stack of
 * each {@link #interact} call, so one instance can serve concurrent callers.
 */
public class RecoveringInteractor<C> implements Interactor<C> {

    private static final Logger log = LoggerFactory.getLogger(RecoveringInteractor.class);

    private final FailureClassifier   classifier;
    private final CorrectiveAction<C> correctiveAction;

    public RecoveringInteractor(FailureClassifier classifier, CorrectiveAction<C> correctiveAction) {
        this.classifier       = Objects.requireNonNull(classifier, "classifier");
        this.correctiveAction = Objects.requireNonNull(correctiveAction, "correctiveAction");
    }

    @Override
    public <R> R interact(C context, Action<R> action) {
        RecoveryState state    = RecoveryState.ATTEMPTING;
        Attempt<R>    attempt  = null;
        Throwable     original = null;

        while (state != RecoveryState.DONE) {
            switch (state) {
                case ATTEMPTING -> {
                    attempt = Attempt.run(action);
                    if (attempt.isFailure() && classifier.isRecoverable(attempt.getFailure())) {
                        original = attempt.getFailure();
                        log.debug("{}: {} is recoverable — attempting recovery",
                            getClass().getSimpleName(), original.getClass().getSimpleName());
                        state = RecoveryState.RECOVERING;
                    } else {
                        state = RecoveryState.DONE;
                    }
                }
                case RECOVERING -> {
                    attempt = recover(context, action, original);
                    state   = RecoveryState.DONE;
                }
                default -> throw new IllegalStateException("Unexpected state " + state);
            }
        }

        return attempt.getOrThrow();
    }

    public FailureClassifier getClassifier()         { return classifier; }
    public CorrectiveAction<C> getCorrectiveAction() { return correctiveAction; }

    // ── Private helpers ───────────────────────────────────────────────────────

    private <R> Attempt<R> recover(C context, Action<R> action, Throwable original) {
        Attempt<Void> corrective = Attempt.run(() -> {
            correctiveAction.perform(context);
            return null;
        });
        if (corrective.isFailure()) {
            log.debug("{}: Corrective action failed ({}) — rethrowing original {}",
                getClass().getSimpleName(), corrective.getFailure().toString(),
                original.getClass().getSimpleName());
            return Attempt.failure(original);
        }

        Attempt<R> retry = Attempt.run(action);
        if (retry.isFailure()) {
            log.debug("{}: Retry failed ({}) — rethrowing original {}",
                getClass().getSimpleName(), retry.getFailure().toString(),
                original.getClass().getSimpleName());
            return Attempt.failure(original);
        }

        log.debug("{}: Recovered from {}", getClass().getSimpleName(), original.getClass().getSimpleName());
        return retry;
    }
}
