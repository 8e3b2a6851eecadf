package com.uisafe.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Re-invokes an action a bounded number of times, pausing between attempts,
 * while it keeps failing with a recoverable failure.
 *
 * A failure the classifier rejects ends the interaction at once. When attempts run out,
 * or a later attempt fails unrecoverably, the failure of the FIRST attempt is rethrown.
 * No corrective action is taken between attempts; pair with a {@link RecoveringInteractor}
 * in an {@link InteractorChain} for that.
 */
public class RetryingInteractor<C> implements Interactor<C> {

    private static final Logger log = LoggerFactory.getLogger(RetryingInteractor.class);

    private final FailureClassifier classifier;
    private final int               maxAttempts;
    private final Duration          pause;

    public RetryingInteractor(FailureClassifier classifier, int maxAttempts, Duration pause) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        this.classifier  = Objects.requireNonNull(classifier, "classifier");
        this.maxAttempts = maxAttempts;
        this.pause       = pause == null || pause.isNegative() ? Duration.ZERO : pause;
    }

    @Override
    public <R> R interact(C context, Action<R> action) {
        Attempt<R> attempt = Attempt.run(action);
        if (attempt.isSuccess() || !classifier.isRecoverable(attempt.getFailure())) {
            return attempt.getOrThrow();
        }

        Throwable first = attempt.getFailure();
        int attemptNo = 1;
        while (attemptNo < maxAttempts) {
            if (!sleep()) {
                log.debug("RetryingInteractor: Interrupted after attempt #{} — giving up", attemptNo);
                break;
            }
            attemptNo++;
            attempt = Attempt.run(action);
            if (attempt.isSuccess()) {
                log.debug("RetryingInteractor: Attempt #{} succeeded after {}",
                    attemptNo, first.getClass().getSimpleName());
                return attempt.getValue();
            }
            if (!classifier.isRecoverable(attempt.getFailure())) {
                log.debug("RetryingInteractor: Attempt #{} failed unrecoverably ({}) — stopping",
                    attemptNo, attempt.getFailure().toString());
                break;
            }
        }

        return Attempt.<R>failure(first).getOrThrow();
    }

    public int getMaxAttempts() { return maxAttempts; }
    public Duration getPause()  { return pause; }

    private boolean sleep() {
        if (pause.isZero()) return true;
        try {
            Thread.sleep(pause.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
