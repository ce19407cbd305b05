package io.kern.parser;

import io.kern.lexer.TokenKind;
import io.kern.syntax.Diagnostic;
import io.kern.syntax.SourcePosition;
import java.util.Objects;

/** Why a grammar rule could not match at the current token. */
public sealed interface SyntaxError
    permits SyntaxError.UnexpectedToken, SyntaxError.UnexpectedEof, SyntaxError.NestingTooDeep {

  /** What the rule was looking for, e.g. {@code IDENTIFIER} or {@code term}. */
  String expected();

  SourcePosition position();

  String message();

  default Diagnostic toDiagnostic() {
    Diagnostic.Kind kind;
    if (this instanceof UnexpectedEof) {
      kind = Diagnostic.Kind.UNEXPECTED_EOF;
    } else if (this instanceof NestingTooDeep) {
      kind = Diagnostic.Kind.NESTING_TOO_DEEP;
    } else {
      kind = Diagnostic.Kind.UNEXPECTED_TOKEN;
    }
    return new Diagnostic(kind, message(), position());
  }

  /** A token of the wrong kind; {@link TokenKind#ILLEGAL} tokens end up here too. */
  record UnexpectedToken(String expected, TokenKind actual, SourcePosition position)
      implements SyntaxError {
    public UnexpectedToken {
      Objects.requireNonNull(expected, "expected");
      Objects.requireNonNull(actual, "actual");
      Objects.requireNonNull(position, "position");
    }

    @Override
    public String message() {
      return "expected " + expected + ", got " + actual;
    }
  }

  /** Input ended before the rule was complete. */
  record UnexpectedEof(String expected, SourcePosition position) implements SyntaxError {
    public UnexpectedEof {
      Objects.requireNonNull(expected, "expected");
      Objects.requireNonNull(position, "position");
    }

    @Override
    public String message() {
      return "expected " + expected + ", got " + TokenKind.EOF;
    }
  }

  /** An {@code if} or {@code loop} block opened past the nesting limit. */
  record NestingTooDeep(int limit, SourcePosition position) implements SyntaxError {
    public NestingTooDeep {
      Objects.requireNonNull(position, "position");
    }

    @Override
    public String expected() {
      return "at most " + limit + " nested blocks";
    }

    @Override
    public String message() {
      return "blocks nested deeper than " + limit + " levels";
    }
  }
}
