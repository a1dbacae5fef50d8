package com.e2eq.schema.core;

import java.util.*;

/**
 * Lookup of resolved schemata by name.
 */
public interface SchemaRegistry {
    Optional<Schema> lookup(String name);
    Map<String, Schema> schemata();

    default Schema require(String name) {
        return lookup(name).orElseThrow(() -> new IllegalArgumentException("Unknown schema: " + name));
    }

    // Closure helpers, excluding the schema itself
    default Set<String> ancestorsOf(String name) {
        Set<String> result = new LinkedHashSet<>(require(name).getNames());
        result.remove(name);
        return result;
    }
    default Set<String> descendantsOf(String name) {
        return require(name).getDescendantNames();
    }
    default boolean isA(String name, String other) {
        return lookup(name).map(s -> s.isA(other)).orElse(false);
    }
}
