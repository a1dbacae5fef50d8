package com.e2eq.schema.core;

import com.e2eq.schema.exceptions.SchemaConfigurationException;
import io.quarkus.logging.Log;

import java.util.*;

/**
 * Builds an immutable {@link SchemaModel} from raw schema definitions.
 *
 * <ol>
 *   <li>{@link #add} constructs one node per schema with its local properties.</li>
 *   <li>{@link #build} generates every node (hierarchy and property merge),</li>
 *   <li>synthesizes the reverse stubs of all properties declaring a reverse and makes them
 *   visible on the descendants of the schema that received them,</li>
 *   <li>and freezes the graph, computing the matchable schemata of every schema.</li>
 * </ol>
 *
 * Not thread-safe; a builder produces a single model.
 */
public final class SchemaModelBuilder {
    public static final String DEFAULT_RDF_NAMESPACE = "https://w3id.org/ftm#";

    private final Map<String, SchemaNode> nodes = new LinkedHashMap<>();
    private final PropertyTypeRegistry types;
    private final TextResolver texts;
    private String rdfNamespace = DEFAULT_RDF_NAMESPACE;
    private boolean built;

    public SchemaModelBuilder() {
        this(PropertyTypeRegistry.defaults(), TextResolver.identity());
    }

    public SchemaModelBuilder(PropertyTypeRegistry types, TextResolver texts) {
        this.types = Objects.requireNonNull(types, "types");
        this.texts = Objects.requireNonNull(texts, "texts");
    }

    public SchemaModelBuilder rdfNamespace(String namespace) {
        this.rdfNamespace = Objects.requireNonNull(namespace, "namespace");
        return this;
    }

    public SchemaModelBuilder add(String name, SchemaSpec spec) {
        checkNotBuilt();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Schema name cannot be blank");
        }
        if (nodes.containsKey(name)) {
            throw new IllegalArgumentException("Duplicate schema: " + name);
        }
        nodes.put(name, new SchemaNode(name, spec == null ? SchemaSpec.builder().build() : spec, types, texts));
        return this;
    }

    public SchemaModelBuilder addAll(Map<String, SchemaSpec> specs) {
        specs.forEach(this::add);
        return this;
    }

    public SchemaModel build() {
        checkNotBuilt();
        built = true;

        for (SchemaNode node : nodes.values()) {
            node.generate(this);
        }
        synthesizeReverses();

        Map<String, Set<String>> matchable = new LinkedHashMap<>();
        for (SchemaNode node : nodes.values()) {
            matchable.put(node.name(), matchableSchemata(node));
        }
        SchemaModel model = new SchemaModel(nodes.values(), matchable, texts, rdfNamespace);
        Log.infof("Schema model built with %d schemata and %d properties",
                model.schemata().size(), model.qualifiedProperties().size());
        return model;
    }

    Optional<SchemaNode> node(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(nodes.get(name));
    }

    PropertyTypeRegistry types() { return types; }

    TextResolver texts() { return texts; }

    private void synthesizeReverses() {
        for (SchemaNode node : List.copyOf(nodes.values())) {
            for (Property prop : List.copyOf(node.properties().values())) {
                if (!prop.getSchemaName().equals(node.name()) || prop.getReverseSpec() == null) continue;
                if (!prop.getType().entity()) {
                    throw new SchemaConfigurationException(node.name(),
                            "Invalid reverse: " + prop.getQname() + " has type " + prop.getType().name());
                }
                // generate() has already checked the range of entity properties
                String rangeName = prop.getRange().orElseThrow();
                SchemaNode range = node(rangeName).orElseThrow(() ->
                        new SchemaConfigurationException(node.name(), "Invalid range for " + prop.getQname() + ": " + rangeName));
                Property reverse = range.addReverse(prop.getReverseSpec(), prop, this);
                prop.setReverse(reverse);
                if (reverse.getSchemaName().equals(range.name())) {
                    for (String descendant : range.descendants()) {
                        node(descendant).ifPresent(d -> d.inherit(reverse));
                    }
                }
            }
        }
    }

    private Set<String> matchableSchemata(SchemaNode node) {
        Set<String> result = new LinkedHashSet<>();
        if (!node.matchable()) return result;
        Set<String> candidates = new LinkedHashSet<>(node.schemata());
        candidates.addAll(node.descendants());
        for (String candidate : candidates) {
            if (node(candidate).map(SchemaNode::matchable).orElse(false)) {
                result.add(candidate);
            }
        }
        return result;
    }

    private void checkNotBuilt() {
        if (built) throw new IllegalStateException("Schema model already built");
    }
}
