package dev.cookbook.json;

/**
 * Options controlling how strictly {@link RecipeLoader} reads recipe documents.
 */
public record LoaderSettings(
    boolean rejectUnknownFields,
    int maxImageBytes
) {
    public static final boolean DEFAULT_REJECT_UNKNOWN_FIELDS = false;
    public static final int DEFAULT_MAX_IMAGE_BYTES = 5 * 1024 * 1024;

    public LoaderSettings {
        if (maxImageBytes < 0) {
            throw new IllegalArgumentException("maxImageBytes must not be negative: " + maxImageBytes);
        }
    }

    public static LoaderSettings defaults() {
        return new LoaderSettings(DEFAULT_REJECT_UNKNOWN_FIELDS, DEFAULT_MAX_IMAGE_BYTES);
    }

    public LoaderSettings withRejectUnknownFields(boolean reject) {
        return new LoaderSettings(reject, maxImageBytes);
    }

    public LoaderSettings withMaxImageBytes(int max) {
        return new LoaderSettings(rejectUnknownFields, max);
    }
}
