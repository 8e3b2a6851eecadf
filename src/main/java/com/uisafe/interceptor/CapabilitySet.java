package com.uisafe.interceptor;

import com.uisafe.util.TypeHierarchy;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The interfaces a dispatch proxy presents. Discovered once, when the proxy is built,
 * and fixed for the proxy's lifetime. Super-interfaces are always included.
 */
public final class CapabilitySet {

    private final List<Class<?>> interfaces;

    private CapabilitySet(Set<Class<?>> interfaces) {
        this.interfaces = List.copyOf(interfaces);
    }

    // ── Static factories ──────────────────────────────────────────────────────

    /**
     * The given interface and all of its super-interfaces.
     *
     * @throws InvalidCapabilityException if {@code capability} is not an interface
     */
    public static CapabilitySet ofCapability(Class<?> capability) {
        requireInterface(capability);
        return new CapabilitySet(TypeHierarchy.allInterfaces(capability));
    }

    /**
     * Every interface {@code implementation} and its superclasses implement, transitively.
     *
     * @throws EmptyCapabilitySetException if there are none
     */
    public static CapabilitySet discover(Class<?> implementation) {
        Objects.requireNonNull(implementation, "implementation");
        Set<Class<?>> found = TypeHierarchy.allInterfaces(implementation);
        if (found.isEmpty()) {
            throw new EmptyCapabilitySetException(implementation);
        }
        return new CapabilitySet(found);
    }

    /**
     * An explicit list of interfaces, each of which {@code target} must implement.
     *
     * @throws EmptyCapabilitySetException if {@code capabilities} is empty
     * @throws InvalidCapabilityException  if an entry is not an interface or not implemented by the target
     */
    public static CapabilitySet of(Object target, Collection<Class<?>> capabilities) {
        Objects.requireNonNull(target, "target");
        if (capabilities == null || capabilities.isEmpty()) {
            throw new EmptyCapabilitySetException(null);
        }
        Set<Class<?>> all = new LinkedHashSet<>();
        for (Class<?> capability : capabilities) {
            requireInterface(capability);
            if (!capability.isInstance(target)) {
                throw new InvalidCapabilityException(capability,
                    target.getClass().getName() + " does not implement it");
            }
            all.addAll(TypeHierarchy.allInterfaces(capability));
        }
        return new CapabilitySet(all);
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public List<Class<?>> getInterfaces()     { return interfaces; }
    public boolean contains(Class<?> type)    { return interfaces.contains(type); }
    public int size()                         { return interfaces.size(); }
    public Class<?>[] toArray()               { return interfaces.toArray(new Class<?>[0]); }

    @Override
    public String toString() {
        return "CapabilitySet" + interfaces.stream().map(Class::getSimpleName).toList();
    }

    private static void requireInterface(Class<?> capability) {
        if (capability == null) {
            throw new InvalidCapabilityException(null, "capability type is null");
        }
        if (!capability.isInterface()) {
            throw new InvalidCapabilityException(capability,
                "not an interface. Consider upcasting the argument to the desired interface");
        }
    }
}
