package io.kern.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;

/**
 * Settings for the {@code kern} command. Loads from {@code ~/.kern/kern.properties} by default;
 * command line options override the loaded values.
 *
 * @param recovery skip malformed definitions and keep parsing
 * @param maxDiagnostics how many diagnostics to print per file; {@code 0} prints all of them
 * @param format how {@code kern parse} renders the AST
 * @param color whether diagnostics are highlighted with ANSI escapes
 */
public record KernConfig(boolean recovery, int maxDiagnostics, OutputFormat format, boolean color) {

  /** AST output formats of {@code kern parse}. */
  public enum OutputFormat {
    /** Indented outline, one node per line. */
    TEXT,
    /** Gson rendered tree, one object per node. */
    JSON,
    /** Canonical KERN source. */
    SOURCE
  }

  public KernConfig {
    if (maxDiagnostics < 0) {
      throw new IllegalArgumentException("maxDiagnostics must be >= 0, got " + maxDiagnostics);
    }
    if (format == null) {
      throw new IllegalArgumentException("format must not be null");
    }
  }

  /**
   * Creates the default configuration.
   *
   * @return default configuration
   */
  public static KernConfig defaults() {
    return new KernConfig(true, 50, OutputFormat.TEXT, false);
  }

  /**
   * Loads configuration from the default location: {@code ~/.kern/kern.properties}.
   *
   * @return loaded configuration, or defaults if the file doesn't exist
   * @throws IOException if the file exists but cannot be read
   */
  public static KernConfig load() throws IOException {
    return load(defaultPath());
  }

  /**
   * Loads configuration from {@code path}.
   *
   * @return loaded configuration, or defaults if the file doesn't exist
   * @throws IOException if the file exists but cannot be read
   * @throws IllegalArgumentException if a value cannot be interpreted
   */
  public static KernConfig load(Path path) throws IOException {
    if (!Files.exists(path)) {
      return defaults();
    }

    Properties props = new Properties();
    try (var reader = Files.newBufferedReader(path)) {
      props.load(reader);
    }

    return fromProperties(props);
  }

  public static Path defaultPath() {
    String home = System.getProperty("user.home");
    return Path.of(home, ".kern", "kern.properties");
  }

  public KernConfig withRecovery(boolean recovery) {
    return new KernConfig(recovery, maxDiagnostics, format, color);
  }

  public KernConfig withMaxDiagnostics(int maxDiagnostics) {
    return new KernConfig(recovery, maxDiagnostics, format, color);
  }

  public KernConfig withFormat(OutputFormat format) {
    return new KernConfig(recovery, maxDiagnostics, format, color);
  }

  public KernConfig withColor(boolean color) {
    return new KernConfig(recovery, maxDiagnostics, format, color);
  }

  private static KernConfig fromProperties(Properties props) {
    KernConfig defaults = defaults();
    boolean recovery =
        Boolean.parseBoolean(props.getProperty("recovery", String.valueOf(defaults.recovery)));
    int maxDiagnostics;
    String max = props.getProperty("maxDiagnostics", String.valueOf(defaults.maxDiagnostics));
    try {
      maxDiagnostics = Integer.parseInt(max.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("maxDiagnostics is not a number: " + max, e);
    }
    OutputFormat format =
        OutputFormat.valueOf(
            props.getProperty("format", defaults.format.name()).trim().toUpperCase(Locale.ROOT));
    boolean color =
        Boolean.parseBoolean(props.getProperty("color", String.valueOf(defaults.color)));

    return new KernConfig(recovery, maxDiagnostics, format, color);
  }
}
