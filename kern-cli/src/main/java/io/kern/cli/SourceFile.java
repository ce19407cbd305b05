package io.kern.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A KERN source buffer and the name it is reported under.
 *
 * @param name file name as given on the command line, or {@code <stdin>}
 * @param text the whole file, decoded as UTF-8
 */
record SourceFile(String name, String text) {

  static final String STDIN = "-";

  SourceFile {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(text, "text");
  }

  /**
   * Reads {@code argument}; {@code -} reads standard input to the end.
   *
   * @throws IOException if the file does not exist or cannot be read
   */
  static SourceFile read(String argument) throws IOException {
    if (STDIN.equals(argument)) {
      byte[] bytes = System.in.readAllBytes();
      return new SourceFile("<stdin>", new String(bytes, StandardCharsets.UTF_8));
    }
    Path path = Path.of(argument);
    return new SourceFile(argument, Files.readString(path, StandardCharsets.UTF_8));
  }
}
