package com.e2eq.schema.core;

import com.e2eq.schema.core.PropertySpec.ReverseSpec;
import com.e2eq.schema.exceptions.SchemaConfigurationException;
import com.e2eq.schema.rest.dto.PropertyPayload;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A named, typed attribute declared by one schema. Schemata that inherit the property hold
 * the same instance, so identity comparisons across a hierarchy are meaningful.
 */
public final class Property {
    static final String INVALID_VALUE = "Invalid value";
    static final String READ_ONLY = "Property cannot be written";

    private final String schemaName;
    private final String name;
    private final String qname;
    private final String label;
    private final String description;
    private final PropertyType type;
    private final String range;
    private final ReverseSpec reverseSpec;
    private final boolean hidden;
    private final boolean matchable;
    private final boolean deprecated;
    private final Integer maxLength;
    private final String format;
    private final boolean stub;
    private final TextResolver texts;

    // resolved while the model is built, read-only afterwards
    private Property reverse;
    private boolean generated;

    Property(String schemaName, String name, PropertySpec spec, PropertyType type, boolean stub, TextResolver texts) {
        this.schemaName = Objects.requireNonNull(schemaName, "schemaName");
        this.name = Objects.requireNonNull(name, "name");
        this.qname = schemaName + ":" + name;
        this.label = spec.label() != null ? spec.label() : name;
        this.description = spec.description();
        this.type = type;
        this.range = spec.range();
        this.reverseSpec = spec.reverse();
        this.hidden = spec.hidden();
        this.matchable = spec.matchable() != null ? spec.matchable() : type.matchable();
        this.deprecated = spec.deprecated();
        this.maxLength = spec.maxLength();
        this.format = spec.format();
        this.stub = stub;
        this.texts = texts;
    }

    /**
     * Checks the property's references against the schemata being built. Entity-typed
     * properties must name an existing range schema. Calling it again is a no-op.
     */
    void generate(SchemaModelBuilder builder) {
        if (generated) return;
        if (type.entity()) {
            if (range == null || range.isBlank()) {
                throw new SchemaConfigurationException(schemaName, "Missing range for entity property: " + qname);
            }
            if (builder.node(range).isEmpty()) {
                throw new SchemaConfigurationException(schemaName, "Invalid range for " + qname + ": " + range);
            }
        }
        generated = true;
    }

    void setReverse(Property reverse) {
        this.reverse = reverse;
    }

    /**
     * Validates the raw values of this property.
     *
     * @return the first value-level error, or empty if all values are acceptable
     */
    public Optional<String> validate(List<String> values) {
        for (String value : values) {
            if (stub) {
                return Optional.of(texts.resolve(READ_ONLY));
            }
            if (!type.validate(value)) {
                return Optional.of(texts.resolve(INVALID_VALUE));
            }
        }
        return Optional.empty();
    }

    public String getName() { return name; }

    public String getSchemaName() { return schemaName; }

    public String getQname() { return qname; }

    public String getLabel() { return texts.resolve(label); }

    public String getDescription() { return description == null ? null : texts.resolve(description); }

    public PropertyType getType() { return type; }

    /** Name of the schema an entity-typed property points to. */
    public Optional<String> getRange() { return Optional.ofNullable(range); }

    public Optional<Property> getReverse() { return Optional.ofNullable(reverse); }

    ReverseSpec getReverseSpec() { return reverseSpec; }

    public boolean isHidden() { return hidden; }

    public boolean isMatchable() { return matchable; }

    public boolean isDeprecated() { return deprecated; }

    public Integer getMaxLength() { return maxLength; }

    public String getFormat() { return format; }

    /** Synthesized as the inverse of another schema's property, not declared by an author. */
    public boolean isStub() { return stub; }

    public PropertyPayload toPayload() {
        return new PropertyPayload(
                name,
                qname,
                getLabel(),
                type.name(),
                getDescription(),
                range,
                reverse != null ? reverse.getName() : null,
                maxLength,
                format,
                stub ? Boolean.TRUE : null,
                hidden ? Boolean.TRUE : null,
                matchable ? Boolean.TRUE : null,
                deprecated ? Boolean.TRUE : null
        );
    }

    @Override
    public String toString() {
        return "Property(" + qname + ")";
    }
}
