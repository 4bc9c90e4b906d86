package dev.cookbook.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class RecipeCheckCliTest {

    private static final String COMPLETE = """
        {
          "id": "3f1c2a6e-8b4d-4e7a-9c1f-2d5e6a7b8c90",
          "name": "Pancakes",
          "difficulty": "easy",
          "duration": 15,
          "description": "Fluffy pancakes",
          "directions": "Mix and fry."
        }
        """;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private Level configuredLevel;

    @BeforeEach
    void rememberLogLevel() {
        configuredLevel = appLogger().getLevel();
    }

    @AfterEach
    void restoreLogLevel() {
        appLogger().setLevel(configuredLevel);
    }

    private static Logger appLogger() {
        return (Logger) LoggerFactory.getLogger("dev.cookbook");
    }

    private int run(String... args) {
        CommandLine cmd = new CommandLine(new RecipeCheckCli());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    @Test
    void completeRecipeExitsZero(@TempDir Path dir) throws Exception {
        Path file = Files.writeString(dir.resolve("pancakes.json"), COMPLETE);

        int exitCode = run(file.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("OK   " + file + ": Pancakes (3f1c2a6e-8b4d-4e7a-9c1f-2d5e6a7b8c90)");
    }

    @Test
    void missingFieldIsReportedAndExitsOne(@TempDir Path dir) throws Exception {
        Path file = Files.writeString(dir.resolve("partial.json"),
            COMPLETE.replace("\"duration\": 15,", ""));

        int exitCode = run(file.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString())
            .contains("MISSING " + file + ": cannot build recipe without duration set");
    }

    @Test
    void checksEveryFileInDirectoryDespiteErrors(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("a-broken.json"), "{ not json");
        Files.writeString(dir.resolve("b-bad-difficulty.json"), "{ \"difficulty\": \"legendary\" }");
        Files.writeString(dir.resolve("c-good.json"), COMPLETE);

        int exitCode = run(dir.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString())
            .contains("ERROR " + dir.resolve("a-broken.json"))
            .contains("ERROR " + dir.resolve("b-bad-difficulty.json") + ": Unknown difficulty 'legendary'")
            .contains("OK   " + dir.resolve("c-good.json"));
    }

    @Test
    void strictRejectsUnknownFields(@TempDir Path dir) throws Exception {
        Path file = Files.writeString(dir.resolve("extra.json"),
            COMPLETE.replace("\"name\"", "\"servings\": 4, \"name\""));

        assertThat(run(file.toString())).isZero();
        assertThat(run("--strict", file.toString())).isEqualTo(1);
        assertThat(out.toString()).contains("Unknown fields in recipe document: [servings]");
    }

    @Test
    void missingFileIsReportedAsError(@TempDir Path dir) {
        Path file = dir.resolve("absent.json");

        assertThat(run(file.toString())).isEqualTo(1);
        assertThat(out.toString()).contains("ERROR " + file);
    }

    @Test
    void noArgumentsIsUsageError() {
        assertThat(run()).isEqualTo(2);
        assertThat(err.toString()).contains("Missing required parameter");
    }

    @Test
    void negativeImageLimitIsUsageError(@TempDir Path dir) throws Exception {
        Path file = Files.writeString(dir.resolve("pancakes.json"), COMPLETE);

        assertThat(run("--max-image-bytes=-1", file.toString())).isEqualTo(2);
        assertThat(err.toString()).contains("--max-image-bytes must not be negative");
    }

    @Test
    void verboseRaisesLogLevelAndReportsResults(@TempDir Path dir) throws Exception {
        Path file = Files.writeString(dir.resolve("pancakes.json"), COMPLETE);

        assertThat(run("--verbose", file.toString())).isZero();
        assertThat(out.toString()).contains("OK   " + file);
        assertThat(appLogger().getLevel()).isEqualTo(Level.DEBUG);
    }
}
