package dev.cookbook.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * How hard a recipe is to make, on a scale of 1 to 4.
 * Declaration order is the ordering: {@code EASY} is the easiest, {@code EXPERT} the hardest.
 */
public enum Difficulty {
    EASY,
    MEDIUM,
    HARD,
    EXPERT;

    /** Rating on the 1-4 scale. */
    public int level() {
        return ordinal() + 1;
    }

    /**
     * Parse a difficulty by name, ignoring case.
     *
     * @throws IllegalArgumentException if the name matches no difficulty
     */
    public static Difficulty fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toUpperCase(Locale.ROOT);
            for (Difficulty d : values()) {
                if (d.name().equals(normalized)) {
                    return d;
                }
            }
        }
        String valid = Arrays.stream(values())
            .map(d -> d.name().toLowerCase(Locale.ROOT))
            .collect(Collectors.joining(", "));
        throw new IllegalArgumentException(
            "Unknown difficulty '%s'. Valid difficulties: %s".formatted(name, valid));
    }
}
