package io.kern.parser;

/**
 * Parser settings.
 *
 * @param recoveryEnabled when {@code true} a malformed definition is skipped and parsing resumes
 *     at the next definition keyword; when {@code false} parsing stops at the first error
 */
public record ParserOptions(boolean recoveryEnabled) {

  /**
   * Creates the default options (recovery on).
   *
   * @return default options
   */
  public static ParserOptions defaults() {
    return new ParserOptions(true);
  }

  public ParserOptions withRecovery(boolean enabled) {
    return new ParserOptions(enabled);
  }
}
