package br.edu.ifba.ontology.query;

import br.edu.ifba.ontology.core.Relationship;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A chain of relationships from the question subject, scored by the product of its
 * edge confidences.
 *
 * @param start id of the entity the path starts from
 * @param edges relationships in traversal order
 * @param confidence product of the edge confidences, 1.0 for the empty path
 */
public record TraversalPath(@NotNull String start, @NotNull List<Relationship> edges, double confidence) {

    public TraversalPath {
        Objects.requireNonNull(start, "start must not be null");
        edges = List.copyOf(edges);
    }

    @NotNull
    public static TraversalPath startingAt(@NotNull String start) {
        return new TraversalPath(start, List.of(), 1.0);
    }

    @NotNull
    public TraversalPath extend(@NotNull Relationship relationship) {
        String end = edges.isEmpty() ? start : edges.get(edges.size() - 1).getTailEntity();
        if (!end.equals(relationship.getHeadEntity())) {
            throw new IllegalArgumentException("Edge " + relationship + " does not continue a path ending at " + end);
        }
        List<Relationship> extended = new ArrayList<>(edges.size() + 1);
        extended.addAll(edges);
        extended.add(relationship);
        return new TraversalPath(start, extended, confidence * relationship.getConfidence());
    }

    /**
     * Entity ids along the path: the start followed by each edge tail.
     */
    @NotNull
    public List<String> entityIds() {
        List<String> ids = new ArrayList<>(edges.size() + 1);
        ids.add(start);
        for (Relationship edge : edges) {
            ids.add(edge.getTailEntity());
        }
        return Collections.unmodifiableList(ids);
    }

    public int length() {
        return edges.size();
    }

    /**
     * Ranking used to pick one winner among competing paths: higher confidence first,
     * then fewer edges, then the lexicographically smaller entity id sequence.
     *
     * @return true when this path ranks strictly ahead of {@code other}
     */
    public boolean isBetterThan(@NotNull TraversalPath other) {
        int byConfidence = Double.compare(confidence, other.confidence);
        if (byConfidence != 0) {
            return byConfidence > 0;
        }
        if (length() != other.length()) {
            return length() < other.length();
        }
        return compareIds(entityIds(), other.entityIds()) < 0;
    }

    private static int compareIds(List<String> left, List<String> right) {
        int shared = Math.min(left.size(), right.size());
        for (int i = 0; i < shared; i++) {
            int cmp = left.get(i).compareTo(right.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(left.size(), right.size());
    }
}
