package com.e2eq.schema.core;

import lombok.Builder;

/**
 * Raw definition of one property inside a {@link SchemaSpec}.
 * <p>
 * {@code range} names the schema an entity-typed property points to; {@code reverse}
 * declares the inverse property that is synthesized on the range schema.
 * </p>
 */
@Builder
public record PropertySpec(
        String label,
        String description,
        String type,
        String range,
        ReverseSpec reverse,
        Boolean hidden,
        Boolean matchable,
        Boolean deprecated,
        Integer maxLength,
        String format
) {
    public PropertySpec {
        type = type == null || type.isBlank() ? PropertyTypeRegistry.STRING : type.trim();
        hidden = Boolean.TRUE.equals(hidden);
        deprecated = Boolean.TRUE.equals(deprecated);
        if (maxLength != null && maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be positive, was " + maxLength);
        }
    }

    /**
     * Inverse side of an entity property, created on the range schema.
     * {@code hidden} left null inherits the declaring property's flag.
     */
    public record ReverseSpec(String name, String label, Boolean hidden) {}
}
