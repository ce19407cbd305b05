package io.kern.cli;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "kern",
    description = "Lexer and parser for the KERN rule language",
    version = "0.1.0",
    mixinStandardHelpOptions = true,
    exitCodeOnInvalidInput = Main.EXIT_USAGE,
    subcommands = {TokensCommand.class, ParseCommand.class, CheckCommand.class})
public final class Main implements Callable<Integer> {

  static final int EXIT_OK = 0;
  static final int EXIT_DIAGNOSTICS = 1;
  static final int EXIT_USAGE = 2;

  @CommandLine.Spec CommandLine.Model.CommandSpec spec;

  public static void main(String[] args) {
    System.exit(run(args));
  }

  /**
   * Runs one command line. {@code --verbose} is applied before the command tree is built, so the
   * command loggers are created at debug level too.
   */
  static int run(String... args) {
    if (CommonOptions.isVerbose(args)) {
      CommonOptions.enableDebugLogging();
    }
    return commandLine().execute(args);
  }

  /** The configured command tree; tests execute it without exiting the JVM. */
  static CommandLine commandLine() {
    return new CommandLine(new Main()).setCaseInsensitiveEnumValuesAllowed(true);
  }

  @Override
  public Integer call() {
    // a bare "kern" is a usage error
    spec.commandLine().usage(System.err);
    return EXIT_USAGE;
  }

  static String describe(Exception e) {
    if (e instanceof NoSuchFileException) {
      return "File not found: " + e.getMessage();
    }
    if (e instanceof AccessDeniedException) {
      return "Permission denied: " + e.getMessage();
    }
    if (e instanceof IOException) {
      return "Cannot read " + e.getMessage();
    }
    return e.getMessage();
  }
}
