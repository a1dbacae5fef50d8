package com.e2eq.schema.rest.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Sparse serialized form of a schema.
 * <p>
 * Optional members are null (and omitted from JSON) when empty or at their default. Only the
 * properties declared by the schema itself are listed; the full set is reconstructed by
 * following {@code extends}.
 * </p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SchemaPayload(
        String label,
        String plural,
        List<String> schemata,
        @JsonProperty("extends") List<String> parents,
        EdgePayload edge,
        List<String> featured,
        List<String> required,
        List<String> caption,
        String description,
        @JsonProperty("abstract") Boolean abstractSchema,
        Boolean hidden,
        Boolean generated,
        Boolean matchable,
        Map<String, PropertyPayload> properties
) {

    public SchemaPayload {
        schemata = schemata == null ? List.of() : List.copyOf(schemata);
        parents = parents == null ? List.of() : List.copyOf(parents);
        properties = properties == null ? Map.of() : properties;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record EdgePayload(
            String source,
            String target,
            List<String> caption,
            String label,
            boolean directed
    ) {
        public EdgePayload {
            caption = caption == null ? List.of() : List.copyOf(caption);
        }
    }
}
