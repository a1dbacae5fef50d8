package com.e2eq.schema.rest.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Serialized form of a property. Flags are null unless set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PropertyPayload(
        String name,
        String qname,
        String label,
        String type,
        String description,
        String range,
        String reverse,
        Integer maxLength,
        String format,
        Boolean stub,
        Boolean hidden,
        Boolean matchable,
        Boolean deprecated
) {}
