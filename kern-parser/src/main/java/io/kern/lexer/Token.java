package io.kern.lexer;

import io.kern.syntax.SourcePosition;
import java.util.Objects;

/**
 * A single lexical unit of KERN source.
 *
 * <p>The payload is tied to the kind: identifiers, keywords and illegal characters carry text,
 * numbers carry an integer, symbols and {@code EOF} carry nothing. The canonical constructor
 * rejects any other combination, so a consumer never observes a kind/payload mismatch.
 *
 * @param kind the token kind
 * @param payload the value carried by the token
 * @param position where the token starts
 * @param length number of source characters the token spans ({@code 0} for {@code EOF})
 */
public record Token(TokenKind kind, Payload payload, SourcePosition position, int length) {

  /** Value carried by a token. */
  public sealed interface Payload permits NoValue, Text, IntValue {}

  /** Payload of symbol, operator and {@code EOF} tokens. */
  public enum NoValue implements Payload {
    INSTANCE
  }

  /** Payload of identifier, keyword and illegal-character tokens. */
  public record Text(String value) implements Payload {
    public Text {
      Objects.requireNonNull(value, "value");
    }
  }

  /** Payload of number tokens. */
  public record IntValue(long value) implements Payload {}

  public Token {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(position, "position");
    if (length < 0) {
      throw new IllegalArgumentException("Negative token length: " + length);
    }
    boolean matches =
        switch (kind.payloadType()) {
          case NONE -> payload instanceof NoValue;
          case TEXT -> payload instanceof Text;
          case INTEGER -> payload instanceof IntValue;
        };
    if (!matches) {
      throw new IllegalArgumentException(
          "Token kind " + kind + " cannot carry payload " + payload);
    }
  }

  /** Creates a symbol, operator or {@code EOF} token. */
  public static Token symbol(TokenKind kind, SourcePosition position, int length) {
    return new Token(kind, NoValue.INSTANCE, position, length);
  }

  /** Creates an identifier or keyword token; the length is taken from the text. */
  public static Token text(TokenKind kind, String text, SourcePosition position) {
    return new Token(kind, new Text(text), position, text.length());
  }

  public static Token number(long value, SourcePosition position, int length) {
    return new Token(TokenKind.NUMBER, new IntValue(value), position, length);
  }

  /** Creates an illegal-character token; a supplementary character spans two chars. */
  public static Token illegal(String character, SourcePosition position) {
    return new Token(TokenKind.ILLEGAL, new Text(character), position, character.length());
  }

  public static Token eof(SourcePosition position) {
    return new Token(TokenKind.EOF, NoValue.INSTANCE, position, 0);
  }

  /**
   * Returns the text of an identifier, keyword or illegal-character token.
   *
   * @throws IllegalStateException if this kind carries no text
   */
  public String text() {
    if (payload instanceof Text t) {
      return t.value();
    }
    throw new IllegalStateException(kind + " token carries no text");
  }

  /**
   * Returns the value of a number token.
   *
   * @throws IllegalStateException if this is not a number token
   */
  public long number() {
    if (payload instanceof IntValue n) {
      return n.value();
    }
    throw new IllegalStateException(kind + " token carries no integer");
  }

  public boolean is(TokenKind k) {
    return kind == k;
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
    String shown =
        switch (kind.payloadType()) {
          case NONE -> "";
          case TEXT -> "('" + text() + "')";
          case INTEGER -> "(" + number() + ")";
        };
    return kind + shown + "@" + position;
  }
}
