package com.e2eq.schema.core;

import com.e2eq.schema.rest.dto.ModelPayload;
import com.e2eq.schema.rest.dto.SchemaPayload;

import java.util.*;

/**
 * Immutable, fully resolved set of schemata produced by {@link SchemaModelBuilder#build()}.
 * Safe for concurrent reads.
 */
public final class SchemaModel implements SchemaRegistry {

    private final Map<String, Schema> schemata;
    private final Map<String, Property> qnames;
    private final TextResolver texts;

    SchemaModel(Collection<SchemaNode> nodes, Map<String, Set<String>> matchable, TextResolver texts, String rdfNamespace) {
        this.texts = texts;
        Map<String, Schema> byName = new LinkedHashMap<>();
        Map<String, Property> byQname = new LinkedHashMap<>();
        for (SchemaNode node : nodes) {
            byName.put(node.name(), new Schema(this, node, matchable.getOrDefault(node.name(), Set.of()), rdfNamespace));
            for (Property prop : node.properties().values()) {
                byQname.putIfAbsent(prop.getQname(), prop);
            }
        }
        this.schemata = Collections.unmodifiableMap(byName);
        this.qnames = Collections.unmodifiableMap(byQname);
    }

    @Override
    public Optional<Schema> lookup(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(schemata.get(name));
    }

    @Override
    public Map<String, Schema> schemata() { return schemata; }

    /** Property lookup by qualified name, e.g. {@code Thing:name}. */
    public Optional<Property> getProperty(String qname) {
        return Optional.ofNullable(qnames.get(qname));
    }

    public Map<String, Property> qualifiedProperties() { return qnames; }

    /**
     * Selects the narrower of two schemata, e.g. {@code Company} for {@code LegalEntity} and
     * {@code Company}.
     *
     * @throws IllegalArgumentException if neither schema is a descendant of the other
     */
    public Schema commonSchema(String left, String right) {
        Schema l = require(left);
        Schema r = require(right);
        if (l.isA(r)) return l;
        if (r.isA(l)) return r;
        throw new IllegalArgumentException("No common schema: " + left + " and " + right);
    }

    public ModelPayload toPayload() {
        Map<String, SchemaPayload> payloads = new TreeMap<>();
        schemata.forEach((name, schema) -> payloads.put(name, schema.toPayload()));
        return new ModelPayload(Collections.unmodifiableMap(payloads));
    }

    TextResolver texts() { return texts; }
}
