package br.edu.ifba.ontology.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A directed, typed and weighted edge between two entities.
 *
 * <p>Parallel edges (same head, tail and type with different confidence) are legal
 * values; storage backends decide whether to collapse them.</p>
 */
public final class Relationship {

    @JsonProperty("head_entity")
    @NotNull
    private final String headEntity;

    @JsonProperty("tail_entity")
    @NotNull
    private final String tailEntity;

    @JsonProperty("edge_type")
    @NotNull
    private final EdgeType edgeType;

    @JsonProperty("confidence")
    private final double confidence;

    /**
     * Constructs a new Relationship.
     *
     * @param headEntity id of the source entity
     * @param tailEntity id of the target entity (or attribute id)
     * @param edgeType the edge type
     * @param confidence evidence strength in [0, 1]
     * @throws IllegalArgumentException if confidence is outside [0, 1] or not a number
     */
    public Relationship(
            @NotNull String headEntity,
            @NotNull String tailEntity,
            @NotNull EdgeType edgeType,
            double confidence) {
        this.headEntity = Objects.requireNonNull(headEntity, "headEntity must not be null");
        this.tailEntity = Objects.requireNonNull(tailEntity, "tailEntity must not be null");
        this.edgeType = Objects.requireNonNull(edgeType, "edgeType must not be null");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0, 1], got " + confidence);
        }
        this.confidence = confidence;
    }

    @NotNull
    public String getHeadEntity() {
        return headEntity;
    }

    @NotNull
    public String getTailEntity() {
        return tailEntity;
    }

    @NotNull
    public EdgeType getEdgeType() {
        return edgeType;
    }

    public double getConfidence() {
        return confidence;
    }

    /**
     * Identity used for deduplication and upserts: head, tail and type, confidence excluded.
     */
    @NotNull
    public Key key() {
        return new Key(headEntity, tailEntity, edgeType);
    }

    /**
     * Deduplication key of a relationship.
     */
    public record Key(@NotNull String headEntity, @NotNull String tailEntity, @NotNull EdgeType edgeType) {
        public Key {
            Objects.requireNonNull(headEntity, "headEntity must not be null");
            Objects.requireNonNull(tailEntity, "tailEntity must not be null");
            Objects.requireNonNull(edgeType, "edgeType must not be null");
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Relationship that = (Relationship) obj;
        return Double.compare(that.confidence, confidence) == 0 &&
               Objects.equals(headEntity, that.headEntity) &&
               Objects.equals(tailEntity, that.tailEntity) &&
               edgeType == that.edgeType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(headEntity, tailEntity, edgeType, confidence);
    }

    @Override
    public String toString() {
        return headEntity + " -" + edgeType.label() + "(" + confidence + ")-> " + tailEntity;
    }
}
