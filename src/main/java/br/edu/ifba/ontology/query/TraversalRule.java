package br.edu.ifba.ontology.query;

import br.edu.ifba.ontology.core.EdgeType;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Which edges a question type follows and which edge proves it, per BFS level.
 *
 * <ul>
 *   <li>SubclassOf: follow SubclassOf, goal is a SubclassOf edge into the object.</li>
 *   <li>InstanceOf: level 0 follows InstanceOf only (the goal may be that edge
 *       itself), deeper levels behave as SubclassOf.</li>
 *   <li>HasAttribute: follow SubclassOf, goal is a HasAttribute edge into the
 *       attribute on any entity reached, the subject included.</li>
 * </ul>
 */
enum TraversalRule {

    SUBCLASS_OF {
        @Override
        EdgeType stepType(int depth) {
            return EdgeType.SUBCLASS_OF;
        }

        @Override
        EdgeType goalType(int depth) {
            return EdgeType.SUBCLASS_OF;
        }
    },

    INSTANCE_OF {
        @Override
        EdgeType stepType(int depth) {
            return depth == 0 ? EdgeType.INSTANCE_OF : EdgeType.SUBCLASS_OF;
        }

        @Override
        EdgeType goalType(int depth) {
            return depth == 0 ? EdgeType.INSTANCE_OF : EdgeType.SUBCLASS_OF;
        }
    },

    HAS_ATTRIBUTE {
        @Override
        EdgeType stepType(int depth) {
            return EdgeType.SUBCLASS_OF;
        }

        @Override
        EdgeType goalType(int depth) {
            return EdgeType.HAS_ATTRIBUTE;
        }
    };

    /**
     * Edge type that extends the frontier from level {@code depth}.
     */
    abstract EdgeType stepType(int depth);

    /**
     * Edge type whose tail is checked against the question object at level {@code depth}.
     */
    abstract EdgeType goalType(int depth);

    /**
     * Type filter for the storage lookup: a single type when step and goal agree,
     * otherwise {@code null} (all outgoing edges).
     */
    @Nullable
    EdgeType fetchType(int depth) {
        EdgeType step = stepType(depth);
        return step == goalType(depth) ? step : null;
    }

    @NotNull
    static TraversalRule forQuestion(@NotNull EdgeType questionType) {
        return switch (questionType) {
            case SUBCLASS_OF -> SUBCLASS_OF;
            case INSTANCE_OF -> INSTANCE_OF;
            case HAS_ATTRIBUTE -> HAS_ATTRIBUTE;
        };
    }
}
