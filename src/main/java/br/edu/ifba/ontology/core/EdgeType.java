package br.edu.ifba.ontology.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;
import java.util.Optional;

/**
 * The three typed edges an ontology graph is made of.
 *
 * <p>Questions are typed by the same enum: a question of type {@link #SUBCLASS_OF}
 * asks whether a SubclassOf chain links its subject to its object.</p>
 */
public enum EdgeType {

    SUBCLASS_OF("SubclassOf"),

    INSTANCE_OF("InstanceOf"),

    HAS_ATTRIBUTE("HasAttribute");

    private final String label;

    EdgeType(String label) {
        this.label = label;
    }

    /**
     * Canonical label used in the CSV encoding, e.g. {@code SubclassOf}.
     */
    @NotNull
    public String label() {
        return label;
    }

    /**
     * Parses an edge type leniently.
     *
     * <p>Case, whitespace, underscores and hyphens are ignored, so {@code SubclassOf},
     * {@code subclass_of}, {@code "subclass of"} and {@code SUBCLASS_OF} all resolve
     * to {@link #SUBCLASS_OF}.</p>
     *
     * @param raw the raw value (may be null)
     * @return the matching type, or empty when the value names no known type
     */
    @NotNull
    public static Optional<EdgeType> fromString(@Nullable String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String squashed = squash(raw);
        if (squashed.isEmpty()) {
            return Optional.empty();
        }
        for (EdgeType type : values()) {
            if (squash(type.label).equals(squashed)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    private static String squash(String value) {
        return value.replaceAll("[\\s_-]+", "").toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return label;
    }
}
