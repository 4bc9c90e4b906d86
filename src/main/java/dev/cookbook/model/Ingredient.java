package dev.cookbook.model;

import java.util.Objects;
import java.util.UUID;

/**
 * An ingredient for a recipe.
 * Equality is keyed on {@link #id()} alone: two ingredients with the same id are the same
 * set member even when name, unit or measurement differ.
 */
public final class Ingredient {
    private final UUID id;
    private final String name;
    private final String unit;
    private final String measurement;

    public Ingredient(UUID id, String name, String unit, String measurement) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.unit = Objects.requireNonNull(unit, "unit");
        this.measurement = Objects.requireNonNull(measurement, "measurement");
    }

    public UUID id() { return id; }
    public String name() { return name; }
    public String unit() { return unit; }
    public String measurement() { return measurement; }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Ingredient other && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Ingredient[id=%s, name=%s, unit=%s, measurement=%s]"
            .formatted(id, name, unit, measurement);
    }
}
