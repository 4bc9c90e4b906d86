package dev.cookbook.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.cookbook.model.BuildResult;
import dev.cookbook.model.Difficulty;
import dev.cookbook.model.Ingredient;
import dev.cookbook.model.Recipe;
import dev.cookbook.model.RecipeBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Reads recipe documents from JSON and finalizes them through a {@link RecipeBuilder}.
 *
 * <p>Absent keys are left unset on the builder, so a document lacking a mandatory field
 * yields a {@link BuildResult.Failure} naming that field. Malformed JSON raises
 * {@link IOException}; a present value of the wrong shape raises
 * {@link IllegalArgumentException} naming the key.
 */
public final class RecipeLoader {

    private static final Logger log = LoggerFactory.getLogger(RecipeLoader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final Set<String> KNOWN_FIELDS = Set.of(
        "id", "name", "difficulty", "duration", "description",
        "ingredients", "directions", "tags", "img");

    private RecipeLoader() {}

    public static BuildResult loadFromString(String json) throws IOException {
        return loadFromString(json, LoaderSettings.defaults());
    }

    public static BuildResult loadFromString(String json, LoaderSettings settings) throws IOException {
        return parseRecipe(MAPPER.readTree(json), settings);
    }

    public static BuildResult loadFromFile(Path path) throws IOException {
        return loadFromFile(path, LoaderSettings.defaults());
    }

    public static BuildResult loadFromFile(Path path, LoaderSettings settings) throws IOException {
        JsonNode root = MAPPER.readTree(path.toFile());
        BuildResult result = parseRecipe(root, settings);
        log.debug("Loaded {}: {}", path, result);
        return result;
    }

    public static Map<Path, BuildResult> loadFromDirectory(Path dir) throws IOException {
        return loadFromDirectory(dir, LoaderSettings.defaults());
    }

    /**
     * Load every {@code *.json} file in a directory, in file name order.
     */
    public static Map<Path, BuildResult> loadFromDirectory(Path dir, LoaderSettings settings) throws IOException {
        var results = new LinkedHashMap<Path, BuildResult>();
        for (Path file : listRecipeFiles(dir)) {
            results.put(file, loadFromFile(file, settings));
        }
        return results;
    }

    /**
     * The {@code *.json} files directly inside a directory, sorted by path.
     */
    public static List<Path> listRecipeFiles(Path dir) throws IOException {
        try (Stream<Path> listing = Files.list(dir)) {
            return listing.filter(p -> p.toString().endsWith(".json"))
                .filter(Files::isRegularFile)
                .sorted()
                .toList();
        }
    }

    private static BuildResult parseRecipe(JsonNode root, LoaderSettings settings) throws IOException {
        if (root == null || root.isMissingNode()) {
            throw new IOException("Recipe document is empty");
        }
        if (!root.isObject()) {
            throw new IllegalArgumentException("Recipe document must be a JSON object");
        }
        checkUnknownFields(root, settings);

        RecipeBuilder builder = Recipe.builder();

        JsonNode id = field(root, "id");
        if (id != null) {
            builder.withId(parseUuid(id, "id"));
        }
        JsonNode name = field(root, "name");
        if (name != null) {
            builder.withName(text(name, "name"));
        }
        JsonNode difficulty = field(root, "difficulty");
        if (difficulty != null) {
            builder.withDifficulty(Difficulty.fromName(text(difficulty, "difficulty")));
        }
        JsonNode duration = field(root, "duration");
        if (duration != null) {
            builder.withDuration(parseDuration(duration));
        }
        JsonNode description = field(root, "description");
        if (description != null) {
            builder.withDescription(text(description, "description"));
        }
        JsonNode directions = field(root, "directions");
        if (directions != null) {
            builder.withDirections(text(directions, "directions"));
        }
        JsonNode ingredients = field(root, "ingredients");
        if (ingredients != null) {
            for (JsonNode node : array(ingredients, "ingredients")) {
                builder.addIngredient(parseIngredient(node));
            }
        }
        JsonNode tags = field(root, "tags");
        if (tags != null) {
            for (JsonNode node : array(tags, "tags")) {
                builder.addTag(text(node, "tags"));
            }
        }
        JsonNode img = field(root, "img");
        if (img != null) {
            builder.withImage(parseImage(img, settings.maxImageBytes()));
        }

        return builder.build();
    }

    private static void checkUnknownFields(JsonNode root, LoaderSettings settings) {
        var unknown = new ArrayList<String>();
        for (Iterator<String> names = root.fieldNames(); names.hasNext(); ) {
            String key = names.next();
            if (!KNOWN_FIELDS.contains(key)) {
                unknown.add(key);
            }
        }
        if (unknown.isEmpty()) {
            return;
        }
        if (settings.rejectUnknownFields()) {
            throw new IllegalArgumentException("Unknown fields in recipe document: " + unknown);
        }
        log.warn("Ignoring unknown fields in recipe document: {}", unknown);
    }

    private static Ingredient parseIngredient(JsonNode node) {
        if (!node.isObject()) {
            throw new IllegalArgumentException("Each entry of 'ingredients' must be an object");
        }
        JsonNode id = field(node, "id");
        if (id == null) {
            throw new IllegalArgumentException("Ingredient is missing 'id': " + node);
        }
        return new Ingredient(
            parseUuid(id, "ingredients.id"),
            optionalText(node, "name"),
            optionalText(node, "unit"),
            optionalText(node, "measurement"));
    }

    private static int parseDuration(JsonNode node) {
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new IllegalArgumentException("Field 'duration' must be a whole number of minutes: " + node);
        }
        int minutes = node.intValue();
        if (minutes < 0 || minutes > Recipe.MAX_DURATION) {
            throw new IllegalArgumentException("Field 'duration' must be between 0 and %d, got %d"
                .formatted(Recipe.MAX_DURATION, minutes));
        }
        return minutes;
    }

    private static byte[] parseImage(JsonNode node, int maxImageBytes) {
        if (!node.isTextual()) {
            throw new IllegalArgumentException("Field 'img' must be a base64 string");
        }
        // Every 4 base64 characters decode to at most 3 bytes.
        long upperBound = (long) node.textValue().length() / 4 * 3;
        if (upperBound > (long) maxImageBytes + 2) {
            throw new IllegalArgumentException("Field 'img' encodes about %d bytes, larger than the limit of %d"
                .formatted(upperBound, maxImageBytes));
        }
        byte[] bytes;
        try {
            bytes = node.binaryValue();
        } catch (IOException e) {
            throw new IllegalArgumentException("Field 'img' is not valid base64: " + e.getMessage(), e);
        }
        if (bytes.length > maxImageBytes) {
            throw new IllegalArgumentException("Field 'img' is %d bytes, larger than the limit of %d"
                .formatted(bytes.length, maxImageBytes));
        }
        return bytes;
    }

    private static UUID parseUuid(JsonNode node, String key) {
        String value = text(node, key);
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Field '%s' is not a UUID: %s".formatted(key, value), e);
        }
    }

    private static String text(JsonNode node, String key) {
        if (!node.isTextual()) {
            throw new IllegalArgumentException("Field '%s' must be a string: %s".formatted(key, node));
        }
        return node.asText();
    }

    private static String optionalText(JsonNode parent, String key) {
        JsonNode node = field(parent, key);
        return node == null ? "" : text(node, key);
    }

    private static Iterable<JsonNode> array(JsonNode node, String key) {
        if (!node.isArray()) {
            throw new IllegalArgumentException("Field '%s' must be an array".formatted(key));
        }
        return node;
    }

    /** The value under key, or null when the key is absent or explicitly null. */
    private static JsonNode field(JsonNode parent, String key) {
        JsonNode node = parent.get(key);
        return node == null || node.isNull() ? null : node;
    }
}
