package com.uisafe.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs every interaction and its failure. Never alters the result or the failure.
 */
public class LoggingInteractor<C> implements Interactor<C> {

    private static final Logger log = LoggerFactory.getLogger(LoggingInteractor.class);

    @Override
    public <R> R interact(C context, Action<R> action) {
        long start = System.nanoTime();
        log.debug("LoggingInteractor: Interacting with {}", describe(context));
        try {
            R result = action.invoke();
            log.debug("LoggingInteractor: Completed in {}ms", elapsedMs(start));
            return result;
        } catch (Throwable e) {
            log.info("LoggingInteractor: {} after {}ms on {}: {}",
                e.getClass().getSimpleName(), elapsedMs(start), describe(context), e.getMessage());
            throw e;
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    private static String describe(Object context) {
        try { return String.valueOf(context); }
        catch (RuntimeException e) { return context.getClass().getSimpleName(); }
    }
}
