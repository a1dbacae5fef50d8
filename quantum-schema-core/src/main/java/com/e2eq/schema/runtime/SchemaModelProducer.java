package com.e2eq.schema.runtime;

import com.e2eq.schema.core.SchemaModel;
import com.e2eq.schema.core.SchemaModelBuilder;
import com.e2eq.schema.core.SchemaRegistry;
import com.e2eq.schema.core.SchemaSpec;
import io.quarkus.logging.Log;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.io.IOException;
import java.util.Map;

/**
 * Loads the schema definitions from the classpath at startup and exposes the resolved
 * {@link SchemaModel} for injection. A broken definition fails the application start.
 */
@ApplicationScoped
public class SchemaModelProducer {

    private final String location;
    private final String rdfNamespace;

    private SchemaModel model;

    @Inject
    public SchemaModelProducer(@ConfigProperty(name = "quantum.schema.location", defaultValue = "schema/model.yaml")
                               String location,
                               @ConfigProperty(name = "quantum.schema.rdf-namespace", defaultValue = SchemaModelBuilder.DEFAULT_RDF_NAMESPACE)
                               String rdfNamespace) {
        this.location = location;
        this.rdfNamespace = rdfNamespace;
    }

    @PostConstruct
    void init() {
        this.model = loadModel();
    }

    @Produces
    public SchemaModel model() {
        return model;
    }

    @Produces
    public SchemaRegistry registry() {
        return model;
    }

    private SchemaModel loadModel() {
        Map<String, SchemaSpec> specs;
        try {
            specs = new SchemaSpecLoader().loadFromClasspath(location);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load schema definitions from " + location, e);
        }
        Log.infof("Loaded %d schema definitions from %s", specs.size(), location);
        return new SchemaModelBuilder()
                .rdfNamespace(rdfNamespace)
                .addAll(specs)
                .build();
    }
}
