package com.e2eq.schema.rest;

import com.e2eq.schema.rest.dto.ModelPayload;
import com.e2eq.schema.rest.dto.SchemaPayload;
import jakarta.annotation.security.RolesAllowed;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.util.List;

@Path("/schema")
@RolesAllowed({"admin", "user"})
@Tag(name = "schema", description = "Schema metadata for entity editors and API clients")
public class SchemaResource {

    private final SchemaModelService modelService;

    @Inject
    public SchemaResource(SchemaModelService modelService) {
        this.modelService = modelService;
    }

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    public ModelPayload getModel() {
        return modelService.buildModel();
    }

    @GET
    @Path("/{name}")
    @Produces(MediaType.APPLICATION_JSON)
    public SchemaPayload getSchema(@PathParam("name") String name) {
        return modelService.buildSchema(name)
                .orElseThrow(() -> new NotFoundException("Unknown schema: " + name));
    }

    @GET
    @Path("/{name}/matchable")
    @Produces(MediaType.APPLICATION_JSON)
    public List<String> getMatchable(@PathParam("name") String name) {
        modelService.buildSchema(name).orElseThrow(() -> new NotFoundException("Unknown schema: " + name));
        return modelService.matchableWith(name);
    }
}
