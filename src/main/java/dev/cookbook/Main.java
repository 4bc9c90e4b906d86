package dev.cookbook;

import dev.cookbook.cli.RecipeCheckCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new RecipeCheckCli()).execute(args);
        System.exit(exitCode);
    }
}
