package dev.cookbook.model;

import java.util.Objects;

/**
 * Optional free-text tag describing a recipe. Equal when the text is equal.
 */
public record RecipeTag(String tag) {

    public RecipeTag {
        Objects.requireNonNull(tag, "tag");
    }

    public static RecipeTag of(String tag) {
        return new RecipeTag(tag);
    }
}
