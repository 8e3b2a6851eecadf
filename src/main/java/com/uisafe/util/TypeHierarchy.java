package com.uisafe.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reflection helpers over the class/interface graph.
 */
public final class TypeHierarchy {

    private TypeHierarchy() {}

    /**
     * Returns every interface {@code type} implements, transitively, in discovery order.
     *
     * If {@code type} is itself an interface it comes first, followed by its super-interfaces.
     * For a class, interfaces declared by the class come before those declared by its superclasses.
     */
    public static Set<Class<?>> allInterfaces(Class<?> type) {
        Set<Class<?>> result = new LinkedHashSet<>();
        if (type.isInterface()) {
            result.add(type);
        }
        for (Class<?> current = type; current != null; current = current.getSuperclass()) {
            collectInterfaces(current, result);
        }
        return Collections.unmodifiableSet(result);
    }

    /**
     * Returns {@code type} followed by all of its supertypes, breadth-first.
     * Superclasses are queued before interfaces at each level; {@code Object} always comes last.
     */
    public static List<Class<?>> linearize(Class<?> type) {
        Set<Class<?>> seen = new LinkedHashSet<>();
        Deque<Class<?>> queue = new ArrayDeque<>();
        queue.add(type);
        while (!queue.isEmpty()) {
            Class<?> current = queue.poll();
            if (current == Object.class || !seen.add(current)) continue;
            if (current.getSuperclass() != null) {
                queue.add(current.getSuperclass());
            }
            Collections.addAll(queue, current.getInterfaces());
        }
        List<Class<?>> ordered = new ArrayList<>(seen);
        ordered.add(Object.class);
        return ordered;
    }

    private static void collectInterfaces(Class<?> type, Set<Class<?>> into) {
        for (Class<?> iface : type.getInterfaces()) {
            if (into.add(iface)) {
                collectInterfaces(iface, into);
            }
        }
    }
}
