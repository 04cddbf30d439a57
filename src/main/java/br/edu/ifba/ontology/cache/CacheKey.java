package br.edu.ifba.ontology.cache;

import br.edu.ifba.ontology.core.EdgeType;
import br.edu.ifba.ontology.core.Question;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * (type, subject, object) triple identifying a cached answer.
 *
 * <p>Keys are built from {@link Question#normalized()}, the same form the traversal
 * runs on, so two questions share an entry only when they reach the same ids.
 * Ids are case sensitive: {@code "Dog"} and {@code "dog"} are different keys.</p>
 */
public record CacheKey(@NotNull EdgeType type, @NotNull String subject, @NotNull String object) {

    public CacheKey {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(subject, "subject must not be null");
        Objects.requireNonNull(object, "object must not be null");
    }

    @NotNull
    public static CacheKey of(@NotNull Question question) {
        Question normalized = question.normalized();
        return new CacheKey(normalized.type(), normalized.subject(), normalized.object());
    }
}
