package com.e2eq.schema.core;

import com.e2eq.schema.exceptions.SchemaConfigurationException;

import java.util.*;

/**
 * Lookup of {@link PropertyType}s by name.
 *
 * The defaults only reject blank values; applications register stricter types under the same
 * names before building a model.
 */
public final class PropertyTypeRegistry {
    public static final String STRING = "string";
    public static final String ENTITY = "entity";

    private final Map<String, PropertyType> types = new LinkedHashMap<>();

    public static PropertyTypeRegistry defaults() {
        PropertyTypeRegistry registry = new PropertyTypeRegistry();
        registry.register(new BasicType(STRING, false, false));
        registry.register(new BasicType("text", false, false));
        registry.register(new BasicType("name", true, false));
        registry.register(new BasicType("identifier", true, false));
        registry.register(new BasicType("date", false, false));
        registry.register(new BasicType("country", false, false));
        registry.register(new BasicType("url", false, false));
        registry.register(new BasicType("email", true, false));
        registry.register(new BasicType("number", false, false));
        registry.register(new BasicType(ENTITY, true, true));
        return registry;
    }

    public PropertyTypeRegistry register(PropertyType type) {
        Objects.requireNonNull(type, "type");
        types.put(type.name(), type);
        return this;
    }

    public Optional<PropertyType> typeOf(String name) {
        return Optional.ofNullable(types.get(name));
    }

    public PropertyType require(String name) {
        return typeOf(name).orElseThrow(() ->
                new SchemaConfigurationException("Unknown property type '" + name + "'. Expected one of: " + types.keySet()));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(types.keySet());
    }

    record BasicType(String name, boolean matchable, boolean entity) implements PropertyType {
        @Override
        public boolean validate(String value) {
            return value != null && !value.isBlank();
        }
    }
}
