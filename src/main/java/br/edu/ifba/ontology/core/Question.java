package br.edu.ifba.ontology.core;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A question already resolved to a typed triple.
 *
 * @param type what is asked: SubclassOf, InstanceOf or HasAttribute
 * @param subject entity id the question starts from
 * @param object entity id (or attribute id) the question asks about
 */
public record Question(
        @NotNull EdgeType type,
        @NotNull String subject,
        @NotNull String object
) {
    public Question {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(subject, "subject must not be null");
        Objects.requireNonNull(object, "object must not be null");
    }

    public static Question subclassOf(@NotNull String subject, @NotNull String object) {
        return new Question(EdgeType.SUBCLASS_OF, subject, object);
    }

    public static Question instanceOf(@NotNull String subject, @NotNull String object) {
        return new Question(EdgeType.INSTANCE_OF, subject, object);
    }

    public static Question hasAttribute(@NotNull String subject, @NotNull String attribute) {
        return new Question(EdgeType.HAS_ATTRIBUTE, subject, attribute);
    }

    /**
     * Trims subject and object the way ingested ids are trimmed. Ids are otherwise
     * case and whitespace sensitive, so nothing else is folded.
     *
     * @return this question when already trimmed, else a trimmed copy
     */
    @NotNull
    public Question normalized() {
        String s = subject.trim();
        String o = object.trim();
        if (s.equals(subject) && o.equals(object)) {
            return this;
        }
        return new Question(type, s, o);
    }

    @Override
    public String toString() {
        return type.label() + "(" + subject + ", " + object + ")";
    }
}
