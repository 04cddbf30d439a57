package br.edu.ifba.ontology.ingestion;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Untyped record as produced by a {@link RecordSource}, before validation.
 *
 * <p>Field names are normalized to lower snake case, so {@code HEAD_ENTITY},
 * {@code Head Entity} and {@code head-entity} all become {@code head_entity}.
 * Values are kept as read; a {@code null} value means the field was present but empty.</p>
 *
 * @param kind entity or relationship
 * @param fields normalized field name to raw value
 * @param source where the record came from (file and line, queue, ...), for diagnostics
 */
public record RawRecord(@NotNull RecordKind kind, @NotNull Map<String, String> fields, @NotNull String source) {

    public static final String ID = "id";
    public static final String NAME = "name";
    public static final String METADATA = "metadata";
    public static final String HEAD_ENTITY = "head_entity";
    public static final String TAIL_ENTITY = "tail_entity";
    public static final String EDGE_TYPE = "edge_type";
    public static final String CONFIDENCE = "confidence";

    public RawRecord {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(fields, "fields must not be null");
        Objects.requireNonNull(source, "source must not be null");
        Map<String, String> normalized = new LinkedHashMap<>();
        fields.forEach((name, value) -> normalized.put(normalizeFieldName(name), value));
        fields = Collections.unmodifiableMap(normalized);
    }

    public static RawRecord entity(@Nullable String id, @Nullable String name, @Nullable String metadata) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(ID, id);
        fields.put(NAME, name);
        fields.put(METADATA, metadata);
        return new RawRecord(RecordKind.ENTITY, fields, "inline");
    }

    public static RawRecord relationship(@Nullable String head, @Nullable String tail,
                                         @Nullable String edgeType, @Nullable String confidence) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(HEAD_ENTITY, head);
        fields.put(TAIL_ENTITY, tail);
        fields.put(EDGE_TYPE, edgeType);
        if (confidence != null) {
            fields.put(CONFIDENCE, confidence);
        }
        return new RawRecord(RecordKind.RELATIONSHIP, fields, "inline");
    }

    /**
     * @return the raw value, or {@code null} when absent or empty
     */
    @Nullable
    public String field(@NotNull String name) {
        return fields.get(name);
    }

    public boolean has(@NotNull String name) {
        return fields.containsKey(name);
    }

    static String normalizeFieldName(String name) {
        return Objects.requireNonNull(name, "field name must not be null")
            .trim()
            .replaceAll("[\\s-]+", "_")
            .toLowerCase(Locale.ROOT);
    }
}
