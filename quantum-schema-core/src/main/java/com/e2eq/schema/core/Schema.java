package com.e2eq.schema.core;

import com.e2eq.schema.exceptions.EntityValidationException;
import com.e2eq.schema.rest.dto.PropertyPayload;
import com.e2eq.schema.rest.dto.SchemaPayload;

import java.util.*;
import java.util.stream.Collectors;

/**
 * A type definition for a class of entities that have certain properties.
 * <p>
 * Schemata form a multi-rooted hierarchy: each schema can have several parents from which it
 * inherits all properties, and descendants which add further properties. Instances are
 * immutable and obtained from a {@link SchemaModel}; related schemata are held by name and
 * resolved through the model. Equality and hashing use the name only.
 * </p>
 */
public final class Schema implements Comparable<Schema> {
    static final String REQUIRED = "Required";
    static final String VALIDATION_FAILED = "Entity validation failed";

    private final SchemaModel model;
    private final String name;
    private final String label;
    private final String plural;
    private final String description;
    private final String uri;

    private final boolean abstractSchema;
    private final boolean hidden;
    private final boolean generated;
    private final boolean matchable;

    private final List<String> featured;
    private final List<String> required;
    private final List<String> caption;

    private final String edgeSource;
    private final String edgeTarget;
    private final List<String> edgeCaption;
    private final String edgeLabel;
    private final boolean edgeDirected;

    private final Set<String> parents;
    private final Set<String> names;
    private final Set<String> descendants;
    private final Set<String> matchableNames;
    private final Map<String, Property> properties;

    Schema(SchemaModel model, SchemaNode node, Set<String> matchableNames, String rdfNamespace) {
        SchemaSpec spec = node.spec();
        this.model = model;
        this.name = node.name();
        this.label = spec.label() != null ? spec.label() : name;
        this.plural = spec.plural() != null ? spec.plural() : label;
        this.description = spec.description();
        this.uri = spec.rdf() != null ? spec.rdf() : rdfNamespace + name;

        this.abstractSchema = spec.abstractSchema();
        this.hidden = node.hidden();
        this.generated = spec.generated();
        this.matchable = spec.matchable();

        this.featured = spec.featured();
        this.required = spec.required();
        this.caption = spec.caption();

        EdgeSpec edge = spec.edge();
        this.edgeSource = edge != null ? edge.source() : null;
        this.edgeTarget = edge != null ? edge.target() : null;
        this.edgeCaption = edge != null ? edge.caption() : List.of();
        this.edgeLabel = edge != null && edge.label() != null ? edge.label() : label;
        this.edgeDirected = edge == null || edge.directed();

        this.parents = Collections.unmodifiableSet(new LinkedHashSet<>(node.parents()));
        this.names = Collections.unmodifiableSet(new LinkedHashSet<>(node.schemata()));
        this.descendants = Collections.unmodifiableSet(new LinkedHashSet<>(node.descendants()));
        this.matchableNames = Collections.unmodifiableSet(new LinkedHashSet<>(matchableNames));
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(node.properties()));
    }

    public String getName() { return name; }

    /** User-facing name of the schema. */
    public String getLabel() { return model.texts().resolve(label); }

    /** Name of the schema to be used in plural constructions. */
    public String getPlural() { return model.texts().resolve(plural); }

    public String getDescription() { return description == null ? null : model.texts().resolve(description); }

    /** RDF identifier of the schema. */
    public String getUri() { return uri; }

    /** Used only for inheritance, never instantiated. */
    public boolean isAbstract() { return abstractSchema; }

    /** Hidden from listings. Always false for abstract schemata. */
    public boolean isHidden() { return hidden; }

    /** Entities of this type are created by the system, not offered to users. */
    public boolean isGenerated() { return generated; }

    public boolean isMatchable() { return matchable; }

    public List<String> getFeatured() { return featured; }

    public List<String> getRequired() { return required; }

    public List<String> getCaption() { return caption; }

    /** True when entities of this schema are drawn as an edge in a property graph. */
    public boolean isEdge() { return edgeSource != null && edgeTarget != null; }

    public Optional<String> getEdgeSource() { return Optional.ofNullable(edgeSource); }

    public Optional<String> getEdgeTarget() { return Optional.ofNullable(edgeTarget); }

    public List<String> getEdgeCaption() { return edgeCaption; }

    public String getEdgeLabel() { return model.texts().resolve(edgeLabel); }

    public boolean isEdgeDirected() { return edgeDirected; }

    public Optional<Property> getSourceProperty() { return get(edgeSource); }

    public Optional<Property> getTargetProperty() { return get(edgeTarget); }

    /** Direct parents, in declaration order. */
    public Set<Schema> getExtends() { return resolve(parents); }

    /** All ancestors including this schema. */
    public Set<Schema> getSchemata() { return resolve(names); }

    /** Names of {@link #getSchemata()}. */
    public Set<String> getNames() { return names; }

    /** All schemata that have this one among their ancestors. */
    public Set<Schema> getDescendants() { return resolve(descendants); }

    public Set<String> getDescendantNames() { return descendants; }

    /**
     * Schemata it makes sense to compare this one with: matchable ancestors and descendants.
     * Empty when this schema is not matchable.
     */
    public Set<Schema> getMatchableSchemata() { return resolve(matchableNames); }

    public boolean canMatch(Schema other) {
        return other != null && matchableNames.contains(other.getName());
    }

    public boolean isA(String other) {
        return other != null && names.contains(other);
    }

    public boolean isA(Schema other) {
        return other != null && isA(other.getName());
    }

    /** Local and inherited properties. */
    public Map<String, Property> getProperties() { return properties; }

    public Optional<Property> get(String propertyName) {
        return propertyName == null ? Optional.empty() : Optional.ofNullable(properties.get(propertyName));
    }

    /**
     * All properties in display order: caption properties first, then featured ones, then
     * alphabetically by label (the name when a label resolves to null).
     */
    public List<Property> getSortedProperties() {
        return properties.values().stream()
                .sorted(Comparator.comparing((Property p) -> !caption.contains(p.getName()))
                        .thenComparing(p -> !featured.contains(p.getName()))
                        .thenComparing(p -> Objects.requireNonNullElse(p.getLabel(), p.getName())))
                .collect(Collectors.toList());
    }

    /**
     * Validates a property bag against all properties of this schema. Every property is
     * checked, including those missing from the input; required properties without values fail
     * with {@code Required}. Keys that are not properties of the schema are ignored.
     *
     * @param data property name to raw values
     * @return {@code data} restricted to the properties of this schema
     * @throws EntityValidationException carrying every failing property and its message
     */
    public Map<String, List<String>> validate(Map<String, List<String>> data) throws EntityValidationException {
        Map<String, List<String>> input = data == null ? Map.of() : data;
        Map<String, String> errors = new LinkedHashMap<>();
        Map<String, List<String>> accepted = new LinkedHashMap<>();
        for (Property prop : properties.values()) {
            List<String> values = input.get(prop.getName());
            if (values == null) values = List.of();
            Optional<String> error = prop.validate(values);
            if (error.isEmpty() && values.isEmpty() && required.contains(prop.getName())) {
                error = Optional.of(model.texts().resolve(REQUIRED));
            }
            error.ifPresent(e -> errors.put(prop.getName(), e));
            if (input.containsKey(prop.getName())) {
                accepted.put(prop.getName(), values);
            }
        }
        if (!errors.isEmpty()) {
            throw new EntityValidationException(model.texts().resolve(VALIDATION_FAILED), name, errors);
        }
        return accepted;
    }

    /**
     * Sparse serialized form: defaults and empty lists are left out, and only the properties
     * declared by this schema are included.
     */
    public SchemaPayload toPayload() {
        SchemaPayload.EdgePayload edge = null;
        String resolvedEdgeLabel = getEdgeLabel();
        if (edgeSource != null && edgeTarget != null && resolvedEdgeLabel != null && !resolvedEdgeLabel.isEmpty()) {
            edge = new SchemaPayload.EdgePayload(edgeSource, edgeTarget, edgeCaption, resolvedEdgeLabel, edgeDirected);
        }
        String resolvedDescription = getDescription();

        Map<String, PropertyPayload> own = new LinkedHashMap<>();
        properties.forEach((propName, prop) -> {
            if (prop.getSchemaName().equals(name)) {
                own.put(propName, prop.toPayload());
            }
        });

        return new SchemaPayload(
                getLabel(),
                getPlural(),
                names.stream().sorted().collect(Collectors.toList()),
                parents.stream().sorted().collect(Collectors.toList()),
                edge,
                featured.isEmpty() ? null : featured,
                required.isEmpty() ? null : required,
                caption.isEmpty() ? null : caption,
                resolvedDescription == null || resolvedDescription.isEmpty() ? null : resolvedDescription,
                abstractSchema ? Boolean.TRUE : null,
                hidden ? Boolean.TRUE : null,
                generated ? Boolean.TRUE : null,
                matchable ? Boolean.TRUE : null,
                Collections.unmodifiableMap(own)
        );
    }

    private Set<Schema> resolve(Set<String> schemaNames) {
        Set<Schema> result = new LinkedHashSet<>();
        for (String n : schemaNames) {
            model.lookup(n).ifPresent(result::add);
        }
        return Collections.unmodifiableSet(result);
    }

    @Override
    public int compareTo(Schema other) {
        return name.compareTo(other.name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Schema)) return false;
        return name.equals(((Schema) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "Schema(" + name + ")";
    }
}
