package dev.cookbook.model;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * A single recipe one would find in a cookbook.
 *
 * <p>Instances are immutable and can only be obtained from {@link RecipeBuilder#build()},
 * so every {@code Recipe} has all of its mandatory fields set.
 */
public final class Recipe {

    /** Largest duration in minutes; durations are unsigned 16-bit values. */
    public static final int MAX_DURATION = 0xFFFF;

    private final UUID id;
    private final String name;
    private final Difficulty difficulty;
    private final int duration;
    private final String description;
    private final Set<Ingredient> ingredients;
    private final String directions;
    private final Set<RecipeTag> tags;
    private final byte[] img;

    // Collections arrive as unmodifiable copies and img is already owned by this instance.
    Recipe(UUID id, String name, Difficulty difficulty, int duration, String description,
           Set<Ingredient> ingredients, String directions, Set<RecipeTag> tags, byte[] img) {
        this.id = id;
        this.name = name;
        this.difficulty = difficulty;
        this.duration = duration;
        this.description = description;
        this.ingredients = ingredients;
        this.directions = directions;
        this.tags = tags;
        this.img = img;
    }

    public static RecipeBuilder builder() {
        return new RecipeBuilder();
    }

    public UUID id() { return id; }
    public String name() { return name; }
    public Difficulty difficulty() { return difficulty; }

    /** Estimated duration in minutes, 0 to {@link #MAX_DURATION}. */
    public int duration() { return duration; }

    public String description() { return description; }

    /** Unmodifiable view of the ingredients. */
    public Set<Ingredient> ingredients() { return ingredients; }

    public String directions() { return directions; }

    /** Unmodifiable view of the tags. */
    public Set<RecipeTag> tags() { return tags; }

    /** Copy of the picture bytes; empty when no picture was supplied. */
    public byte[] img() { return img.clone(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Recipe other)) {
            return false;
        }
        return duration == other.duration
            && id.equals(other.id)
            && name.equals(other.name)
            && difficulty == other.difficulty
            && description.equals(other.description)
            && sameIngredients(ingredients, other.ingredients)
            && directions.equals(other.directions)
            && tags.equals(other.tags)
            && Arrays.equals(img, other.img);
    }

    // Ingredient equality is keyed on id, so compare the other attributes per id here.
    private static boolean sameIngredients(Set<Ingredient> a, Set<Ingredient> b) {
        if (a.size() != b.size()) {
            return false;
        }
        Map<UUID, Ingredient> byId = new HashMap<>();
        for (Ingredient ingredient : b) {
            byId.put(ingredient.id(), ingredient);
        }
        for (Ingredient mine : a) {
            Ingredient theirs = byId.get(mine.id());
            if (theirs == null
                || !mine.name().equals(theirs.name())
                || !mine.unit().equals(theirs.unit())
                || !mine.measurement().equals(theirs.measurement())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(id, name, difficulty, duration, description,
            ingredients, directions, tags);
        return 31 * result + Arrays.hashCode(img);
    }

    @Override
    public String toString() {
        return "Recipe[id=%s, name=%s, difficulty=%s, duration=%d, ingredients=%d, tags=%s, img=%d bytes]"
            .formatted(id, name, difficulty, duration, ingredients.size(), tags, img.length);
    }
}
