package com.uisafe.interceptor;

/**
 * A requested capability cannot back a proxy: it is a concrete class rather than an
 * interface, the target does not implement it, or the JDK refused to build a proxy for it.
 */
public class InvalidCapabilityException extends UiSafeException {

    private final Class<?> capability;

    public InvalidCapabilityException(Class<?> capability, String reason) {
        super(message(capability, reason));
        this.capability = capability;
    }

    public InvalidCapabilityException(Class<?> capability, String reason, Throwable cause) {
        super(message(capability, reason), cause);
        this.capability = capability;
    }

    /** The offending type, or {@code null} when the failure concerns the capability set as a whole. */
    public Class<?> getCapability() {
        return capability;
    }

    private static String message(Class<?> capability, String reason) {
        return capability == null
            ? "Invalid capability set: " + reason
            : "Invalid capability " + capability.getName() + ": " + reason;
    }
}
