package dev.cookbook.model;

/**
 * Thrown by {@link BuildResult#orElseThrow()} when a recipe could not be built.
 */
public class MissingFieldException extends IllegalStateException {

    private final MissingField field;

    public MissingFieldException(MissingField field) {
        super(BuildResult.Failure.messageFor(field));
        this.field = field;
    }

    public MissingField field() {
        return field;
    }
}
