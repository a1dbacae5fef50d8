package com.e2eq.schema.core;

/**
 * Value type of a property. Implementations decide whether a single raw value is acceptable;
 * format checks (dates, URLs, identifiers) live in the implementations registered with a
 * {@link PropertyTypeRegistry}, not in the schema model.
 */
public interface PropertyType {

    String name();

    /**
     * @return true when {@code value} is a valid value of this type
     */
    boolean validate(String value);

    /**
     * Whether values of this type take part in fuzzy matching by default.
     */
    default boolean matchable() { return true; }

    /**
     * Entity-typed properties hold references to other entities and need a range schema.
     */
    default boolean entity() { return false; }
}
