package com.e2eq.schema.core;

import com.e2eq.schema.exceptions.EntityValidationException;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class SchemaValidationTest {

    private static SchemaModel model;

    @BeforeAll
    static void loadModel() throws Exception {
        model = TestModels.defaultModel();
    }

    @Test
    void testRequiredPropertyMissing() {
        Schema legalEntity = model.require("LegalEntity");
        EntityValidationException ex = assertThrows(EntityValidationException.class, () -> legalEntity.validate(Map.of()));
        assertEquals(Map.of("name", "Required"), ex.getErrors());
        assertEquals("Entity validation failed", ex.getMessage());
    }

    @Test
    void testRequiredPropertyWithEmptyList() {
        Schema legalEntity = model.require("LegalEntity");
        EntityValidationException ex = assertThrows(EntityValidationException.class,
                () -> legalEntity.validate(Map.of("name", List.of())));
        assertTrue(ex.getErrors().containsKey("name"));
    }

    @Test
    void testAllErrorsAreReported() {
        Schema ownership = model.require("Ownership");
        EntityValidationException ex = assertThrows(EntityValidationException.class, () -> ownership.validate(Map.of()));
        assertEquals(2, ex.getErrors().size());
        assertEquals(Set.of("owner", "asset"), ex.getErrors().keySet());
    }

    @Test
    void testInvalidValuesAreAggregated() {
        Schema company = model.require("Company");
        Map<String, List<String>> data = new HashMap<>();
        data.put("name", List.of("ACME Ltd", " "));
        data.put("email", List.of(""));
        data.put("country", List.of("gb"));
        EntityValidationException ex = assertThrows(EntityValidationException.class, () -> company.validate(data));
        assertEquals(Map.of("name", "Invalid value", "email", "Invalid value"), ex.getErrors());
    }

    @Test
    void testValueErrorTakesPrecedenceOverRequired() {
        Schema legalEntity = model.require("LegalEntity");
        Map<String, List<String>> data = new HashMap<>();
        data.put("name", Collections.singletonList(null));
        EntityValidationException ex = assertThrows(EntityValidationException.class, () -> legalEntity.validate(data));
        assertEquals("Invalid value", ex.getErrors().get("name"));
    }

    @Test
    void testUnknownKeysAreDropped() throws Exception {
        Schema legalEntity = model.require("LegalEntity");
        Map<String, List<String>> accepted = legalEntity.validate(Map.of(
                "name", List.of("ACME"),
                "country", List.of("us"),
                "colour", List.of("blue")));
        assertEquals(Map.of("name", List.of("ACME"), "country", List.of("us")), accepted);
    }

    @Test
    void testNullBagIsTreatedAsEmpty() throws Exception {
        assertEquals(Map.of(), model.require("Company").validate(null));
    }

    @Test
    void testMessagesAreLocalized() {
        Map<String, String> german = Map.of("Required", "Pflichtfeld", "Entity validation failed", "Validierung fehlgeschlagen");
        SchemaModel localized = new SchemaModelBuilder(PropertyTypeRegistry.defaults(), key -> german.getOrDefault(key, key))
                .add("Thing", SchemaSpec.builder()
                        .properties(Map.of("name", PropertySpec.builder().type("name").build()))
                        .required(List.of("name"))
                        .build())
                .build();
        EntityValidationException ex = assertThrows(EntityValidationException.class,
                () -> localized.require("Thing").validate(Map.of()));
        assertEquals("Validierung fehlgeschlagen", ex.getMessage());
        assertEquals(Map.of("name", "Pflichtfeld"), ex.getErrors());
    }

    @Test
    void testCustomPropertyType() {
        PropertyTypeRegistry types = PropertyTypeRegistry.defaults().register(new PropertyType() {
            @Override
            public String name() { return "country"; }

            @Override
            public boolean validate(String value) { return value != null && value.matches("[a-z]{2}"); }
        });
        SchemaModel strict = new SchemaModelBuilder(types, TextResolver.identity())
                .add("Place", SchemaSpec.builder()
                        .properties(Map.of("country", PropertySpec.builder().type("country").build()))
                        .build())
                .build();
        EntityValidationException ex = assertThrows(EntityValidationException.class,
                () -> strict.require("Place").validate(Map.of("country", List.of("Germany"))));
        assertEquals(Map.of("country", "Invalid value"), ex.getErrors());
    }
}
