package com.e2eq.schema.core;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class MatchableSchemataTest {

    private static SchemaModel model;

    @BeforeAll
    static void loadModel() throws Exception {
        model = TestModels.defaultModel();
    }

    private static Set<String> matchable(String name) {
        return model.require(name).getMatchableSchemata().stream().map(Schema::getName).collect(Collectors.toSet());
    }

    @Test
    void testAncestorsAndDescendants() {
        assertEquals(Set.of("Thing", "LegalEntity", "Organization", "Company"), matchable("Company"));
        assertEquals(Set.of("Thing", "LegalEntity", "Organization", "Company", "Person"), matchable("LegalEntity"));
        assertEquals(Set.of("Thing", "LegalEntity", "Organization", "Company", "Person"), matchable("Thing"));
    }

    @Test
    void testNotMatchableSchemaHasEmptySet() {
        assertTrue(matchable("Address").isEmpty());
        assertTrue(matchable("Ownership").isEmpty());
        assertFalse(model.require("Address").canMatch(model.require("Thing")));
    }

    @Test
    void testNotMatchableSchemataAreFilteredOut() {
        assertFalse(matchable("Thing").contains("Address"));
        assertFalse(model.require("Thing").canMatch(model.require("Address")));
    }

    @Test
    void testUnrelatedSchemataDoNotMatch() {
        assertFalse(model.require("Company").canMatch(model.require("Person")));
        assertFalse(model.require("Company").canMatch(null));
    }

    @Test
    void testSymmetricWithinMatchableSchemata() {
        for (Schema a : model.schemata().values()) {
            for (Schema b : model.schemata().values()) {
                boolean related = a.getSchemata().contains(b) || a.getDescendants().contains(b);
                if (a.isMatchable() && b.isMatchable() && related) {
                    assertTrue(a.canMatch(b), a + " should match " + b);
                    assertTrue(b.canMatch(a), b + " should match " + a);
                }
            }
        }
    }
}
