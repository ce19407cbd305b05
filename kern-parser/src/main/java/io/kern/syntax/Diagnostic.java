package io.kern.syntax;

import java.util.Objects;

/**
 * A recorded, non-fatal problem found while lexing or parsing KERN source.
 *
 * <p>Diagnostics never abort processing. A parse that produced any diagnostic yields a best-effort
 * AST and the caller decides whether to proceed, warn or reject.
 *
 * @param kind what went wrong
 * @param message human readable description
 * @param position where the offending token starts
 */
public record Diagnostic(Kind kind, String message, SourcePosition position) {

  /** Diagnostic categories. */
  public enum Kind {
    /** A token of the wrong kind was found where the grammar expected something else. */
    UNEXPECTED_TOKEN,
    /** Input ended while a construct was still open. */
    UNEXPECTED_EOF,
    /** A character outside the KERN alphabet (reported by the lexer). */
    ILLEGAL_CHARACTER,
    /** An integer literal that does not fit in a signed 64-bit value. */
    NUMBER_OUT_OF_RANGE,
    /** {@code if} and {@code loop} blocks nested past the parser's limit. */
    NESTING_TOO_DEEP
  }

  public Diagnostic {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(position, "position");
  }

  public int line() {
    return position.line();
  }

  public int column() {
    return position.column();
  }

  public int offset() {
    return position.offset();
  }

  @Override
  public String toString() {
    return position + ": " + message;
  }
}
