package com.e2eq.schema.core;

import com.e2eq.schema.exceptions.EntityValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ResourceBundle;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TextResolverTest {

    private static SchemaModel vessels(Locale locale) throws Exception {
        TextResolver texts = TextResolver.bundle(ResourceBundle.getBundle("i18n.schema", locale));
        return new SchemaModelBuilder(PropertyTypeRegistry.defaults(), texts)
                .addAll(TestModels.specs("schema/vessel.yaml"))
                .build();
    }

    @Test
    void testSchemaTextsResolveThroughBundle() throws Exception {
        Schema vessel = vessels(Locale.GERMAN).require("Vessel");
        assertEquals("Schiff", vessel.getLabel());
        assertEquals("Schiffe", vessel.getPlural());
        assertEquals("Ein Seeschiff.", vessel.getDescription());
        assertEquals("Schiff", vessel.getEdgeLabel());
    }

    @Test
    void testPropertyLabelsFallBackToParentBundleAndKey() throws Exception {
        Schema vessel = vessels(Locale.GERMAN).require("Vessel");
        assertEquals("IMO-Nummer", vessel.get("imoNumber").orElseThrow().getLabel());
        assertEquals("Name", vessel.get("name").orElseThrow().getLabel());
        assertEquals("flagState.label", vessel.get("flagState").orElseThrow().getLabel());

        Schema root = vessels(Locale.ROOT).require("Vessel");
        assertEquals("Vessel", root.getLabel());
        assertEquals("IMO number", root.get("imoNumber").orElseThrow().getLabel());
        assertEquals("A sea-going ship.", root.getDescription());
    }

    @Test
    void testSortedPropertiesUseResolvedLabels() throws Exception {
        Schema vessel = vessels(Locale.GERMAN).require("Vessel");
        List<String> order = vessel.getSortedProperties().stream().map(Property::getName).collect(Collectors.toList());
        assertEquals(List.of("name", "buildDate", "imoNumber", "flagState"), order);
    }

    @Test
    void testValidationMessagesResolveThroughBundle() throws Exception {
        Schema vessel = vessels(Locale.GERMAN).require("Vessel");
        EntityValidationException ex = assertThrows(EntityValidationException.class,
                () -> vessel.validate(Map.of("name", List.of("Ever Given"))));
        assertEquals("Validierung fehlgeschlagen", ex.getMessage());
        assertEquals(Map.of("imoNumber", "Pflichtfeld"), ex.getErrors());
    }

    @Test
    void testNullKeyResolvesToNull() {
        TextResolver texts = TextResolver.bundle(ResourceBundle.getBundle("i18n.schema", Locale.ROOT));
        assertNull(texts.resolve(null));
        assertEquals("unknown.key", texts.resolve("unknown.key"));
    }
}
