package dev.cookbook.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Accumulates the fields of a {@link Recipe} and validates them once, in {@link #build()}.
 *
 * <p>Setters may be called in any order and any number of times; the last write wins.
 * A builder is single-use: after {@code build()} every further call throws
 * {@link IllegalStateException}. Not thread-safe.
 */
public final class RecipeBuilder {
    private UUID id;
    private String name;
    private Difficulty difficulty;
    private Integer duration;
    private String description;
    private String directions;
    private byte[] img;
    private final Map<UUID, Ingredient> ingredients = new LinkedHashMap<>();
    private final Set<RecipeTag> tags = new LinkedHashSet<>();
    private boolean consumed;

    RecipeBuilder() {}

    public RecipeBuilder withId(UUID id) {
        checkNotConsumed();
        this.id = Objects.requireNonNull(id, "id");
        return this;
    }

    public RecipeBuilder withName(String name) {
        checkNotConsumed();
        this.name = Objects.requireNonNull(name, "name");
        return this;
    }

    public RecipeBuilder withDifficulty(Difficulty difficulty) {
        checkNotConsumed();
        this.difficulty = Objects.requireNonNull(difficulty, "difficulty");
        return this;
    }

    /**
     * Set the estimated duration in minutes.
     *
     * @throws IllegalArgumentException if minutes is outside 0 to {@link Recipe#MAX_DURATION}
     */
    public RecipeBuilder withDuration(int minutes) {
        checkNotConsumed();
        if (minutes < 0 || minutes > Recipe.MAX_DURATION) {
            throw new IllegalArgumentException(
                "Duration must be between 0 and %d minutes, got %d".formatted(Recipe.MAX_DURATION, minutes));
        }
        this.duration = minutes;
        return this;
    }

    public RecipeBuilder withDescription(String description) {
        checkNotConsumed();
        this.description = Objects.requireNonNull(description, "description");
        return this;
    }

    public RecipeBuilder withDirections(String directions) {
        checkNotConsumed();
        this.directions = Objects.requireNonNull(directions, "directions");
        return this;
    }

    /** Set the picture bytes. The array is copied. */
    public RecipeBuilder withImage(byte[] img) {
        checkNotConsumed();
        this.img = Objects.requireNonNull(img, "img").clone();
        return this;
    }

    /** Add an ingredient, replacing any earlier ingredient with the same id. */
    public RecipeBuilder addIngredient(Ingredient ingredient) {
        checkNotConsumed();
        Objects.requireNonNull(ingredient, "ingredient");
        ingredients.put(ingredient.id(), ingredient);
        return this;
    }

    public RecipeBuilder addTag(RecipeTag tag) {
        checkNotConsumed();
        tags.add(Objects.requireNonNull(tag, "tag"));
        return this;
    }

    public RecipeBuilder addTag(String tag) {
        return addTag(new RecipeTag(tag));
    }

    /**
     * Validate the accumulated fields and consume this builder.
     *
     * <p>Mandatory fields are checked in {@link MissingField} declaration order and the first
     * unset one is reported. Ingredients and tags default to empty sets, the image to no bytes.
     */
    public BuildResult build() {
        checkNotConsumed();
        consumed = true;

        MissingField missing = firstMissingField();
        if (missing != null) {
            return new BuildResult.Failure(missing);
        }

        Recipe recipe = new Recipe(
            id, name, difficulty, duration, description,
            Collections.unmodifiableSet(new LinkedHashSet<>(ingredients.values())),
            directions,
            Collections.unmodifiableSet(new LinkedHashSet<>(tags)),
            img != null ? img : new byte[0]
        );
        return new BuildResult.Success(recipe);
    }

    private MissingField firstMissingField() {
        if (id == null) return MissingField.ID;
        if (name == null) return MissingField.NAME;
        if (difficulty == null) return MissingField.DIFFICULTY;
        if (duration == null) return MissingField.DURATION;
        if (description == null) return MissingField.DESCRIPTION;
        if (directions == null) return MissingField.DIRECTIONS;
        return null;
    }

    private void checkNotConsumed() {
        if (consumed) {
            throw new IllegalStateException("RecipeBuilder has already been built; start a new builder");
        }
    }
}
