package com.e2eq.schema.rest;

import com.e2eq.schema.core.SchemaModel;
import com.e2eq.schema.core.SchemaModelBuilder;
import com.e2eq.schema.rest.dto.ModelPayload;
import com.e2eq.schema.rest.dto.SchemaPayload;
import com.e2eq.schema.runtime.SchemaSpecLoader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SchemaResourceTest {

    private static SchemaModelService service;

    @BeforeAll
    static void setUp() throws Exception {
        SchemaModel model = new SchemaModelBuilder()
                .addAll(new SchemaSpecLoader().loadFromClasspath("schema/model.yaml"))
                .build();
        service = new SchemaModelService(model);
    }

    @Test
    void testModelPayloadIsSortedByName() {
        ModelPayload payload = new SchemaResource(service).getModel();
        List<String> names = List.copyOf(payload.schemata().keySet());
        assertEquals(List.of("Address", "Company", "Interval", "LegalEntity", "Organization", "Ownership", "Person", "Thing"), names);
    }

    @Test
    void testSchemaPayload() {
        SchemaPayload person = new SchemaResource(service).getSchema("Person");
        assertEquals("People", person.plural());
        assertEquals(List.of("LegalEntity"), person.parents());
        assertTrue(service.buildSchema("Vessel").isEmpty());
    }

    @Test
    void testMatchable() {
        assertEquals(List.of("Company", "LegalEntity", "Organization", "Thing"),
                new SchemaResource(service).getMatchable("Company"));
        assertEquals(List.of(), service.matchableWith("Address"));
        assertEquals(List.of(), service.matchableWith("Vessel"));
    }
}
