package com.uisafe.executor;

import com.uisafe.model.FailureKind;

import java.lang.reflect.UndeclaredThrowableException;

/**
 * Pluggable predicate deciding whether a failed attempt is eligible for recovery.
 *
 * Checked exceptions thrown by a proxied target reach interactors wrapped in an
 * {@link UndeclaredThrowableException}; {@link #ofType} looks through that wrapper.
 */
@FunctionalInterface
public interface FailureClassifier {

    FailureKind classify(Throwable failure);

    default boolean isRecoverable(Throwable failure) {
        return classify(failure) == FailureKind.RECOVERABLE;
    }

    /** Recoverable when the failure is an instance of {@code type}. */
    static FailureClassifier ofType(Class<? extends Throwable> type) {
        return failure -> {
            Throwable actual = failure instanceof UndeclaredThrowableException ute
                && ute.getUndeclaredThrowable() != null
                ? ute.getUndeclaredThrowable()
                : failure;
            return type.isInstance(actual) ? FailureKind.RECOVERABLE : FailureKind.UNRECOVERABLE;
        };
    }

    /** Treats every failure as unrecoverable. Used when a policy is switched off by configuration. */
    static FailureClassifier none() {
        return failure -> FailureKind.UNRECOVERABLE;
    }
}
