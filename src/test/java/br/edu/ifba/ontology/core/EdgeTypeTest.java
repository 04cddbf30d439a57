package br.edu.ifba.ontology.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EdgeTypeTest {

    @ParameterizedTest
    @ValueSource(strings = {"SubclassOf", "subclass_of", "subclass of", "SUBCLASS_OF", " Subclass-Of "})
    @DisplayName("should accept every spelling of SubclassOf")
    void testSubclassAliases(String raw) {
        assertEquals(Optional.of(EdgeType.SUBCLASS_OF), EdgeType.fromString(raw));
    }

    @Test
    @DisplayName("should parse InstanceOf and HasAttribute")
    void testOtherTypes() {
        assertEquals(Optional.of(EdgeType.INSTANCE_OF), EdgeType.fromString("instance_of"));
        assertEquals(Optional.of(EdgeType.HAS_ATTRIBUTE), EdgeType.fromString("HasAttribute"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "PartOf", "subclass", "is-a"})
    @DisplayName("should reject unknown edge types")
    void testUnknown(String raw) {
        assertTrue(EdgeType.fromString(raw).isEmpty());
    }

    @Test
    @DisplayName("should reject null")
    void testNull() {
        assertTrue(EdgeType.fromString(null).isEmpty());
    }

    @Test
    @DisplayName("toString is the canonical label")
    void testLabel() {
        assertEquals("HasAttribute", EdgeType.HAS_ATTRIBUTE.toString());
    }
}
