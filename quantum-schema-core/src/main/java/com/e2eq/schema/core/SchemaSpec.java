package com.e2eq.schema.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw definition of one schema, as bound from the schema files.
 * <p>
 * Absent lists become empty lists, absent flags take their defaults
 * (abstract, hidden and generated false, matchable true). Names inside
 * {@code extends}, {@code featured}, {@code required} and {@code caption} must not be blank;
 * whether they resolve is only known once the hierarchy has been merged.
 * </p>
 */
@Builder
public record SchemaSpec(
        String label,
        String plural,
        String description,
        @JsonProperty("extends") List<String> parents,
        Map<String, PropertySpec> properties,
        List<String> featured,
        List<String> required,
        List<String> caption,
        EdgeSpec edge,
        @JsonProperty("abstract") Boolean abstractSchema,
        Boolean hidden,
        Boolean generated,
        Boolean matchable,
        String rdf
) {
    public SchemaSpec {
        parents = names("extends", parents);
        featured = names("featured", featured);
        required = names("required", required);
        caption = names("caption", caption);
        properties = properties == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        abstractSchema = Boolean.TRUE.equals(abstractSchema);
        hidden = Boolean.TRUE.equals(hidden);
        generated = Boolean.TRUE.equals(generated);
        matchable = matchable == null || matchable;
    }

    static List<String> names(String field, List<String> values) {
        if (values == null) return List.of();
        for (String v : values) {
            if (v == null || v.isBlank()) {
                throw new IllegalArgumentException("Blank name in '" + field + "'");
            }
        }
        return List.copyOf(values);
    }
}
