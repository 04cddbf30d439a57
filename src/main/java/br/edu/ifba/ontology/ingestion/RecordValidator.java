package br.edu.ifba.ontology.ingestion;

import br.edu.ifba.ontology.core.EdgeType;
import br.edu.ifba.ontology.core.Entity;
import br.edu.ifba.ontology.core.Relationship;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns raw records into typed entities and relationships.
 *
 * <p>Rules:</p>
 * <ul>
 *   <li>entity: {@code id} required; {@code name} defaults to the id when blank;
 *       {@code metadata} is {@code key=value} pairs separated by {@code ;}, a pair
 *       without {@code =} or with an empty key is rejected</li>
 *   <li>relationship: {@code head_entity}, {@code tail_entity} and {@code edge_type}
 *       required; the edge type must name one of the known {@link EdgeType}s;
 *       {@code confidence} must parse as a number in [0, 1], and defaults to 1.0
 *       only when the field is missing altogether</li>
 * </ul>
 */
public class RecordValidator {

    private final Clock clock;

    public RecordValidator(@NotNull Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @NotNull
    public Entity toEntity(@NotNull RawRecord record) throws RecordValidationException {
        requireKind(record, RecordKind.ENTITY);
        String id = required(record, RawRecord.ID);
        String name = trimToNull(record.field(RawRecord.NAME));
        Map<String, String> metadata = parseMetadata(record, record.field(RawRecord.METADATA));
        return new Entity(id, name != null ? name : id, clock.instant(), metadata);
    }

    @NotNull
    public Relationship toRelationship(@NotNull RawRecord record) throws RecordValidationException {
        requireKind(record, RecordKind.RELATIONSHIP);
        String head = required(record, RawRecord.HEAD_ENTITY);
        String tail = required(record, RawRecord.TAIL_ENTITY);
        String rawType = required(record, RawRecord.EDGE_TYPE);
        Optional<EdgeType> edgeType = EdgeType.fromString(rawType);
        if (edgeType.isEmpty()) {
            throw new RecordValidationException(record, RawRecord.EDGE_TYPE, "Unknown edge type '" + rawType + "'");
        }
        return new Relationship(head, tail, edgeType.get(), parseConfidence(record));
    }

    private double parseConfidence(RawRecord record) throws RecordValidationException {
        if (!record.has(RawRecord.CONFIDENCE)) {
            return 1.0;
        }
        String raw = trimToNull(record.field(RawRecord.CONFIDENCE));
        if (raw == null) {
            throw new RecordValidationException(record, RawRecord.CONFIDENCE, "Confidence is empty");
        }
        double value;
        try {
            value = Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new RecordValidationException(record, RawRecord.CONFIDENCE, "Confidence '" + raw + "' is not a number");
        }
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new RecordValidationException(record, RawRecord.CONFIDENCE, "Confidence " + raw + " is outside [0, 1]");
        }
        return value;
    }

    private static Map<String, String> parseMetadata(RawRecord record, @Nullable String raw) throws RecordValidationException {
        Map<String, String> metadata = new LinkedHashMap<>();
        String text = trimToNull(raw);
        if (text == null) {
            return metadata;
        }
        for (String pair : text.split(";")) {
            if (pair.isBlank()) {
                continue;
            }
            int eq = pair.indexOf('=');
            if (eq <= 0 || pair.substring(0, eq).isBlank()) {
                throw new RecordValidationException(record, RawRecord.METADATA, "Malformed metadata pair '" + pair.trim() + "'");
            }
            metadata.put(pair.substring(0, eq).trim(), pair.substring(eq + 1).trim());
        }
        return metadata;
    }

    private static String required(RawRecord record, String field) throws RecordValidationException {
        String value = trimToNull(record.field(field));
        if (value == null) {
            throw new RecordValidationException(record, field, "Missing required field");
        }
        return value;
    }

    private static void requireKind(RawRecord record, RecordKind expected) throws RecordValidationException {
        if (record.kind() != expected) {
            throw new RecordValidationException(record, "kind", "Expected " + expected + " record, got " + record.kind());
        }
    }

    @Nullable
    private static String trimToNull(@Nullable String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
