package com.e2eq.schema.exceptions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thrown when a property bag does not validate against a schema.
 * <p>
 * Carries every offending property with its message, not only the first one, so callers can
 * present the whole report to a user or a bulk ingestion pipeline.
 * </p>
 */
public class EntityValidationException extends Exception {
    private static final long serialVersionUID = 1L;

    private final String schemaName;
    private final Map<String, String> errors;

    public EntityValidationException(String message, String schemaName, Map<String, String> errors) {
        super(message);
        this.schemaName = schemaName;
        this.errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public String getSchemaName() {
        return schemaName;
    }

    /**
     * Property name to error message, in property order of the schema.
     */
    public Map<String, String> getErrors() {
        return errors;
    }
}
