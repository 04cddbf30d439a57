package br.edu.ifba.ontology.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A node of the ontology graph.
 *
 * <p>Entities are immutable. The only supported change is a metadata merge when the
 * same id is ingested again, see {@link #mergeWith(Entity)}.</p>
 */
public final class Entity {

    @JsonProperty("id")
    @NotNull
    private final String id;

    @JsonProperty("name")
    @NotNull
    private final String name;

    @JsonProperty("created_at")
    @NotNull
    private final Instant createdAt;

    @JsonProperty("metadata")
    @NotNull
    private final Map<String, String> metadata;

    /**
     * Constructs a new Entity.
     *
     * @param id unique entity id (required)
     * @param name display name (required)
     * @param createdAt creation timestamp (required)
     * @param metadata free-form string attributes (optional)
     */
    public Entity(
            @NotNull String id,
            @NotNull String name,
            @NotNull Instant createdAt,
            @Nullable Map<String, String> metadata) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
        this.metadata = metadata != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
            : Collections.emptyMap();
    }

    @NotNull
    public String getId() {
        return id;
    }

    @NotNull
    public String getName() {
        return name;
    }

    @NotNull
    public Instant getCreatedAt() {
        return createdAt;
    }

    @NotNull
    public Map<String, String> getMetadata() {
        return metadata;
    }

    /**
     * Merges a newer version of this entity into this one.
     *
     * <p>The creation timestamp of this entity is kept, the newer name wins, and
     * metadata keys are combined with the newer value winning on conflicts.</p>
     *
     * @param newer the entity ingested later under the same id
     * @return merged entity
     * @throws IllegalArgumentException if ids differ
     */
    @NotNull
    public Entity mergeWith(@NotNull Entity newer) {
        Objects.requireNonNull(newer, "newer must not be null");
        if (!id.equals(newer.id)) {
            throw new IllegalArgumentException("Cannot merge entities with different ids: " + id + " vs " + newer.id);
        }
        Map<String, String> merged = new LinkedHashMap<>(metadata);
        merged.putAll(newer.metadata);
        return new Entity(id, newer.name, createdAt, merged);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Entity entity = (Entity) obj;
        return Objects.equals(id, entity.id) &&
               Objects.equals(name, entity.name) &&
               Objects.equals(createdAt, entity.createdAt) &&
               Objects.equals(metadata, entity.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, createdAt, metadata);
    }

    @Override
    public String toString() {
        return "Entity{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", createdAt=" + createdAt +
                ", metadata=" + metadata +
                '}';
    }
}
