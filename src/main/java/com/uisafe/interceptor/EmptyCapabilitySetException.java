package com.uisafe.interceptor;

/**
 * Capability discovery found no interfaces, so a proxy would have no callable surface.
 */
public class EmptyCapabilitySetException extends UiSafeException {

    private final Class<?> targetType;

    public EmptyCapabilitySetException(Class<?> targetType) {
        super(targetType == null
            ? "No capability interfaces were supplied"
            : targetType.getName() + " implements no interfaces — nothing to proxy."
                + " Consider upcasting the target to the interface you need");
        this.targetType = targetType;
    }

    public Class<?> getTargetType() {
        return targetType;
    }
}
