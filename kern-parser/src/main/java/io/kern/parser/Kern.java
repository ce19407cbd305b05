package io.kern.parser;

import io.kern.lexer.Lexer;
import io.kern.lexer.Token;
import java.util.List;

/** Static entry points for one-shot lexing and parsing. */
public final class Kern {

  private Kern() {}

  /**
   * Parses KERN source with default options.
   *
   * @param source program text
   * @return program and diagnostics
   */
  public static ParseResult parse(String source) {
    return new Parser(source).parseProgram();
  }

  public static ParseResult parse(String source, ParserOptions options) {
    return new Parser(source, options).parseProgram();
  }

  /** Tokenizes {@code source}; the list ends with exactly one {@code EOF}. */
  public static List<Token> tokenize(String source) {
    return Lexer.tokenize(source);
  }
}
