package com.uisafe.interceptor;

/**
 * Base class for UiSafe configuration errors. These are raised while a proxy is being
 * built, never while an interaction runs, and are not retried.
 */
public class UiSafeException extends RuntimeException {

    public UiSafeException(String message) {
        super(message);
    }

    public UiSafeException(String message, Throwable cause) {
        super(message, cause);
    }
}
