package dev.cookbook.cli;

import ch.qos.logback.classic.Level;
import dev.cookbook.json.LoaderSettings;
import dev.cookbook.json.RecipeLoader;
import dev.cookbook.model.BuildResult;
import dev.cookbook.model.Recipe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Checks that recipe documents build into complete recipes.
 * Exits 0 when every file builds, 1 when any file is incomplete or unreadable.
 */
@Command(
    name = "recipe-check",
    mixinStandardHelpOptions = true,
    version = "recipe-check 0.1.0",
    description = "Check that JSON recipe documents contain every required field."
)
public class RecipeCheckCli implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RecipeCheckCli.class);

    @Spec
    private CommandSpec spec;

    @Parameters(arity = "1..*", paramLabel = "PATH",
        description = "Recipe JSON files, or directories of them")
    private List<Path> paths;

    @Option(names = "--strict", description = "Reject documents containing unknown fields")
    private boolean strict;

    @Option(names = "--max-image-bytes", paramLabel = "BYTES",
        description = "Largest accepted decoded image (default: ${DEFAULT-VALUE})")
    private int maxImageBytes = LoaderSettings.DEFAULT_MAX_IMAGE_BYTES;

    @Option(names = "--verbose", description = "Log each loaded recipe")
    private boolean verbose;

    @Override
    public Integer call() {
        if (verbose) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger("dev.cookbook")).setLevel(Level.DEBUG);
        }
        if (maxImageBytes < 0) {
            throw new ParameterException(spec.commandLine(),
                "--max-image-bytes must not be negative: " + maxImageBytes);
        }
        PrintWriter out = spec.commandLine().getOut();
        LoaderSettings settings = LoaderSettings.defaults()
            .withRejectUnknownFields(strict)
            .withMaxImageBytes(maxImageBytes);

        int failures = 0;
        for (Path path : paths) {
            List<Path> files;
            if (Files.isDirectory(path)) {
                try {
                    files = RecipeLoader.listRecipeFiles(path);
                } catch (IOException e) {
                    out.printf("ERROR %s: cannot list directory: %s%n", path, e.getMessage());
                    failures++;
                    continue;
                }
            } else {
                files = List.of(path);
            }
            for (Path file : files) {
                if (!check(file, settings, out)) {
                    failures++;
                }
            }
        }
        if (failures > 0) {
            log.debug("{} recipe file(s) failed", failures);
            return 1;
        }
        return 0;
    }

    private boolean check(Path file, LoaderSettings settings, PrintWriter out) {
        try {
            BuildResult result = RecipeLoader.loadFromFile(file, settings);
            if (result instanceof BuildResult.Success success) {
                Recipe recipe = success.recipe();
                out.printf("OK   %s: %s (%s)%n", file, recipe.name(), recipe.id());
                return true;
            }
            out.printf("MISSING %s: %s%n", file, ((BuildResult.Failure) result).message());
        } catch (IOException | IllegalArgumentException e) {
            log.debug("Failed to load {}", file, e);
            out.printf("ERROR %s: %s%n", file, e.getMessage());
        }
        return false;
    }
}
