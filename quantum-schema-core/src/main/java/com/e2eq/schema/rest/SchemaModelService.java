package com.e2eq.schema.rest;

import com.e2eq.schema.core.Schema;
import com.e2eq.schema.core.SchemaModel;
import com.e2eq.schema.rest.dto.ModelPayload;
import com.e2eq.schema.rest.dto.SchemaPayload;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

@ApplicationScoped
public class SchemaModelService {

    private final SchemaModel model;

    @Inject
    public SchemaModelService(SchemaModel model) {
        this.model = Objects.requireNonNull(model, "model");
    }

    public ModelPayload buildModel() {
        return model.toPayload();
    }

    public Optional<SchemaPayload> buildSchema(String name) {
        return model.lookup(name).map(Schema::toPayload);
    }

    /**
     * Names of the schemata matchable with {@code name}, sorted.
     */
    public List<String> matchableWith(String name) {
        return model.lookup(name)
                .map(s -> s.getMatchableSchemata().stream().map(Schema::getName).sorted().collect(Collectors.toList()))
                .orElse(List.of());
    }
}
