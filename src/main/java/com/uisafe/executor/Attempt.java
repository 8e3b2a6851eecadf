package com.uisafe.executor;

import java.util.Objects;

/**
 * The tagged outcome of invoking an {@link Action} once: either a value or the failure it raised.
 *
 * <p>Immutable. Use {@link #run}, {@link #success} or {@link #failure}. Policies pass attempts
 * around as values and only turn a failure back into an exception at the very end through
 * {@link #getOrThrow()}, which rethrows the stored failure object itself.
 *
 * <p>Any {@link Throwable} is captured, including checked exceptions that reach an
 * {@link Action} undeclared (from code compiled without checked exceptions, or rethrown
 * generically). {@code getOrThrow} rethrows those as they are, without wrapping.
 */
public final class Attempt<R> {

    private final R         value;
    private final Throwable failure;  // non-null only for failed attempts

    private Attempt(R value, Throwable failure) {
        this.value   = value;
        this.failure = failure;
    }

    // ── Static factories ──────────────────────────────────────────────────────

    /** Invokes {@code action} once and captures its result or failure. */
    public static <R> Attempt<R> run(Action<R> action) {
        try {
            return success(action.invoke());
        } catch (Throwable t) {
            return failure(t);
        }
    }

    public static <R> Attempt<R> success(R value) {
        return new Attempt<>(value, null);
    }

    public static <R> Attempt<R> failure(Throwable failure) {
        return new Attempt<>(null, Objects.requireNonNull(failure, "failure"));
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public boolean   isSuccess()  { return failure == null; }
    public boolean   isFailure()  { return failure != null; }
    public R         getValue()   { return value; }
    public Throwable getFailure() { return failure; }

    /**
     * Returns the value of a successful attempt, or rethrows the captured failure unchanged.
     */
    public R getOrThrow() {
        if (failure == null) return value;
        throw Attempt.<RuntimeException>rethrow(failure);
    }

    // Checked failures are rethrown unwrapped; the cast is erased, so nothing is checked at runtime.
    private static <T extends Throwable> T rethrow(Throwable failure) throws T {
        throw (T) failure;
    }

    @Override
    public String toString() {
        return failure == null
            ? "Attempt{success, value=" + value + "}"
            : "Attempt{failure=" + failure.getClass().getSimpleName() + ": " + failure.getMessage() + "}";
    }
}
