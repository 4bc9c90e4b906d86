package dev.cookbook.model;

import java.util.Objects;

/**
 * Result of finalizing a {@link RecipeBuilder}.
 */
public sealed interface BuildResult {

    record Success(Recipe recipe) implements BuildResult {
        public Success {
            Objects.requireNonNull(recipe, "recipe");
        }
    }

    /** The first mandatory field, in check order, that was never set. */
    record Failure(MissingField missingField) implements BuildResult {
        public Failure {
            Objects.requireNonNull(missingField, "missingField");
        }

        public String message() {
            return messageFor(missingField);
        }

        static String messageFor(MissingField field) {
            return "cannot build recipe without %s set".formatted(field.fieldName());
        }
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * Return the built recipe.
     *
     * @throws MissingFieldException if the build failed
     */
    default Recipe orElseThrow() {
        if (this instanceof Success success) {
            return success.recipe();
        }
        throw new MissingFieldException(((Failure) this).missingField());
    }
}
