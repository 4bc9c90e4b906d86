package dev.cookbook.model;

/**
 * Mandatory recipe fields, declared in the order {@link RecipeBuilder#build()} checks them.
 */
public enum MissingField {
    ID("id"),
    NAME("name"),
    DIFFICULTY("difficulty"),
    DURATION("duration"),
    DESCRIPTION("description"),
    DIRECTIONS("directions");

    private final String fieldName;

    MissingField(String fieldName) {
        this.fieldName = fieldName;
    }

    public String fieldName() {
        return fieldName;
    }
}
