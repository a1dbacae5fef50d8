package com.e2eq.schema.rest.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * All schemata of a model keyed by name, sorted by name.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ModelPayload(Map<String, SchemaPayload> schemata) {
    public ModelPayload {
        schemata = schemata == null ? Map.of() : schemata;
    }
}
