package io.kern.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.regex.Pattern;
import picocli.CommandLine;

/** Options shared by every subcommand. */
public final class CommonOptions {

  static final String LOG_LEVEL_PROPERTY = "org.slf4j.simpleLogger.log.io.kern";

  // -v alone or clustered with other short flags, e.g. -qv
  private static final Pattern SHORT_VERBOSE = Pattern.compile("-[a-zA-Z]*v[a-zA-Z]*");

  @CommandLine.Option(
      names = {"-v", "--verbose"},
      description = "Log lexer and parser decisions to stderr")
  boolean verbose;

  @CommandLine.Option(
      names = {"--config"},
      paramLabel = "FILE",
      description = "Configuration file (default: ~/.kern/kern.properties)")
  Path config;

  @CommandLine.Option(
      names = {"--color"},
      negatable = true,
      description = "Highlight diagnostics with ANSI colors")
  Boolean color;

  /**
   * Applies {@code --verbose} and loads the configuration, honouring {@code --config} and {@code
   * --[no-]color}.
   */
  KernConfig resolve() throws IOException {
    if (verbose) {
      enableDebugLogging();
    }
    KernConfig loaded = config != null ? KernConfig.load(config) : KernConfig.load();
    return color != null ? loaded.withColor(color) : loaded;
  }

  /** Whether the raw arguments ask for {@code --verbose}; scanning stops at {@code --}. */
  static boolean isVerbose(String... args) {
    for (String arg : args) {
      if (arg.equals("--")) {
        return false;
      }
      if (arg.equals("--verbose") || SHORT_VERBOSE.matcher(arg).matches()) {
        return true;
      }
    }
    return false;
  }

  /** slf4j-simple fixes a logger's level when it is created, so only later loggers see this. */
  static void enableDebugLogging() {
    System.setProperty(LOG_LEVEL_PROPERTY, "debug");
  }
}
