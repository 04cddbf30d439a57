package br.edu.ifba.ontology.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EntityTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant T1 = Instant.parse("2024-02-01T00:00:00Z");

    @Test
    @DisplayName("merge keeps created_at and lets newer metadata win")
    void testMerge() {
        Entity first = new Entity("dog", "Dog", T0, Map.of("legs", "4", "sound", "woof"));
        Entity second = new Entity("dog", "Domestic dog", T1, Map.of("sound", "bark", "color", "brown"));

        Entity merged = first.mergeWith(second);

        assertEquals("Domestic dog", merged.getName());
        assertEquals(T0, merged.getCreatedAt());
        assertEquals(Map.of("legs", "4", "sound", "bark", "color", "brown"), merged.getMetadata());
    }

    @Test
    @DisplayName("merging twice with the same record is idempotent")
    void testMergeIdempotent() {
        Entity first = new Entity("dog", "Dog", T0, Map.of("legs", "4"));
        Entity update = new Entity("dog", "Dog", T1, Map.of("sound", "woof"));
        assertEquals(first.mergeWith(update), first.mergeWith(update).mergeWith(update));
    }

    @Test
    @DisplayName("merge refuses different ids")
    void testMergeDifferentIds() {
        Entity dog = new Entity("dog", "Dog", T0, null);
        Entity cat = new Entity("cat", "Cat", T0, null);
        assertThrows(IllegalArgumentException.class, () -> dog.mergeWith(cat));
    }

    @Test
    @DisplayName("metadata is immutable and never null")
    void testMetadataImmutable() {
        Entity entity = new Entity("dog", "Dog", T0, null);
        assertTrue(entity.getMetadata().isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> entity.getMetadata().put("k", "v"));
    }

    @Test
    @DisplayName("relationships reject confidence outside [0, 1]")
    void testRelationshipConfidence() {
        assertThrows(IllegalArgumentException.class,
            () -> new Relationship("dog", "animal", EdgeType.SUBCLASS_OF, 1.01));
        assertThrows(IllegalArgumentException.class,
            () -> new Relationship("dog", "animal", EdgeType.SUBCLASS_OF, -0.1));
        assertEquals(new Relationship("dog", "animal", EdgeType.SUBCLASS_OF, 0.5).key(),
            new Relationship("dog", "animal", EdgeType.SUBCLASS_OF, 0.7).key());
    }

    @Test
    @DisplayName("relationships serialize with snake_case field names")
    void testRelationshipJson() throws Exception {
        ObjectMapper mapper = JsonMapper.builder().addModule(new JavaTimeModule()).build();
        String json = mapper.writeValueAsString(new Relationship("Fido", "dog", EdgeType.INSTANCE_OF, 1.0));
        assertTrue(json.contains("\"head_entity\":\"Fido\""), json);
        assertTrue(json.contains("\"tail_entity\":\"dog\""), json);
        assertTrue(json.contains("\"edge_type\""), json);
    }
}
