package com.e2eq.schema.core;

import com.e2eq.schema.core.PropertySpec.ReverseSpec;
import com.e2eq.schema.exceptions.SchemaConfigurationException;
import io.quarkus.logging.Log;

import java.util.*;

/**
 * Construction-time node of the inheritance graph.
 *
 * A node starts out with its locally declared properties only. {@link #generate} resolves the
 * parents, merges their properties and records this node in the descendants of every ancestor.
 * Related nodes are referenced by name and looked up through the {@link SchemaModelBuilder}.
 */
final class SchemaNode {

    enum State { NEW, GENERATING, GENERATED }

    private final String name;
    private final SchemaSpec spec;
    private final boolean hidden;

    private final Set<String> parents = new LinkedHashSet<>();
    private final Set<String> schemata = new LinkedHashSet<>();
    private final Set<String> descendants = new LinkedHashSet<>();
    private final Map<String, Property> properties = new LinkedHashMap<>();

    private State state = State.NEW;

    SchemaNode(String name, SchemaSpec spec, PropertyTypeRegistry types, TextResolver texts) {
        this.name = name;
        this.spec = spec;
        this.hidden = spec.hidden() && !spec.abstractSchema();
        this.schemata.add(name);
        spec.properties().forEach((propName, propSpec) -> {
            if (propSpec == null) {
                throw new SchemaConfigurationException(name, "Empty definition for property: " + name + ":" + propName);
            }
            PropertyType type = types.require(propSpec.type());
            properties.put(propName, new Property(name, propName, propSpec, type, false, texts));
        });
    }

    /**
     * Resolves parents (recursively), merges inherited properties and checks that every
     * featured, caption, required and edge property exists. Parents are merged in declaration
     * order and a name already present is never overwritten, so with two parents declaring the
     * same property the first one wins. Generating a node twice changes nothing.
     */
    void generate(SchemaModelBuilder builder) {
        if (state == State.GENERATED) return;
        if (state == State.GENERATING) {
            throw new SchemaConfigurationException(name, "Cycle detected in extends hierarchy involving '" + name + "'");
        }
        state = State.GENERATING;

        for (String parentName : spec.parents()) {
            SchemaNode parent = builder.node(parentName).orElseThrow(() ->
                    new SchemaConfigurationException(name, "Invalid extends: " + parentName + " (in " + name + ")"));
            parent.generate(builder);

            parent.properties.forEach(properties::putIfAbsent);
            parents.add(parentName);
            for (String ancestor : parent.schemata) {
                schemata.add(ancestor);
                builder.node(ancestor).ifPresent(a -> a.descendants.add(name));
            }
        }

        for (Property prop : List.copyOf(properties.values())) {
            prop.generate(builder);
        }

        requireProperties(spec.featured(), "featured");
        requireProperties(spec.caption(), "caption");
        requireProperties(spec.required(), "required");
        if (isEdge()) {
            if (!properties.containsKey(edgeSpec().source())) {
                throw new SchemaConfigurationException(name, "Missing edge source: " + edgeSpec().source());
            }
            if (!properties.containsKey(edgeSpec().target())) {
                throw new SchemaConfigurationException(name, "Missing edge target: " + edgeSpec().target());
            }
        }

        state = State.GENERATED;
        Log.debugf("Generated schema %s: %d properties, %d ancestors", name, properties.size(), schemata.size() - 1);
    }

    /**
     * Returns the property named by {@code data}, synthesizing an entity-typed stub pointing
     * back at {@code other}'s schema when this node has none yet.
     */
    Property addReverse(ReverseSpec data, Property other, SchemaModelBuilder builder) {
        String reverseName = data.name();
        if (reverseName == null || reverseName.isBlank()) {
            throw new SchemaConfigurationException(name, "Unnamed reverse: " + other.getQname());
        }
        Property prop = properties.get(reverseName);
        if (prop == null) {
            PropertySpec stubSpec = PropertySpec.builder()
                    .label(data.label())
                    .type(PropertyTypeRegistry.ENTITY)
                    .range(other.getSchemaName())
                    .hidden(data.hidden() != null ? data.hidden() : other.isHidden())
                    .build();
            prop = new Property(name, reverseName, stubSpec,
                    builder.types().require(PropertyTypeRegistry.ENTITY), true, builder.texts());
            prop.generate(builder);
            prop.setReverse(other);
            properties.put(reverseName, prop);
            Log.debugf("Added reverse stub %s for %s", prop.getQname(), other.getQname());
        }
        return prop;
    }

    /**
     * Makes {@code prop} visible on this node unless a property of the same name is present.
     */
    void inherit(Property prop) {
        properties.putIfAbsent(prop.getName(), prop);
    }

    private void requireProperties(List<String> names, String kind) {
        for (String n : names) {
            if (!properties.containsKey(n)) {
                throw new SchemaConfigurationException(name, "Missing " + kind + " property: " + n + " (in " + name + ")");
            }
        }
    }

    boolean isEdge() {
        EdgeSpec edge = spec.edge();
        return edge != null && edge.source() != null && edge.target() != null;
    }

    EdgeSpec edgeSpec() { return spec.edge(); }

    String name() { return name; }

    SchemaSpec spec() { return spec; }

    boolean hidden() { return hidden; }

    boolean matchable() { return spec.matchable(); }

    State state() { return state; }

    Set<String> parents() { return parents; }

    Set<String> schemata() { return schemata; }

    Set<String> descendants() { return descendants; }

    Map<String, Property> properties() { return properties; }
}
