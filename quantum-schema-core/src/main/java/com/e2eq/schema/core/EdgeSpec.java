package com.e2eq.schema.core;

import java.util.List;

/**
 * Graph-edge view of a schema: entities of the schema are drawn as an edge between the
 * values of the {@code source} and {@code target} properties.
 */
public record EdgeSpec(String source, String target, List<String> caption, String label, Boolean directed) {
    public EdgeSpec {
        caption = SchemaSpec.names("edge.caption", caption);
        directed = directed == null || directed;
    }
}
