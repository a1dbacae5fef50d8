package com.e2eq.schema.exceptions;

/**
 * Thrown while a schema model is being built when a definition is broken: an unknown
 * {@code extends} target, a cycle in the hierarchy, an unnamed reverse, or a featured,
 * caption, required or edge property that does not exist after merging.
 * <p>
 * These errors abort the load of the whole schema set.
 * </p>
 */
public class SchemaConfigurationException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String schemaName;

    public SchemaConfigurationException(String message) {
        super(message);
        this.schemaName = null;
    }

    public SchemaConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.schemaName = null;
    }

    public SchemaConfigurationException(String schemaName, String message) {
        super(message);
        this.schemaName = schemaName;
    }

    /**
     * The schema whose definition failed, when known.
     */
    public String getSchemaName() {
        return schemaName;
    }
}
