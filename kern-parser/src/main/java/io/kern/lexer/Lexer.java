package io.kern.lexer;

import io.kern.syntax.Diagnostic;
import io.kern.syntax.SourcePosition;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pull-based scanner for KERN source.
 *
 * <p>Each call to {@link #nextToken()} skips whitespace and returns exactly one token, consuming at
 * least one source character unless the input is exhausted. Characters outside the language are
 * returned as {@link TokenKind#ILLEGAL} tokens instead of failing, so scanning always reaches
 * {@link TokenKind#EOF}.
 *
 * <p>A lexer is single-pass: it cannot be rewound. Re-lexing needs a new instance over the same
 * text. Instances are not thread-safe; separate instances share nothing but the {@link Keywords}
 * table.
 */
public final class Lexer implements Iterator<Token> {

  private static final Logger log = LoggerFactory.getLogger(Lexer.class);

  private final String input;
  private int pos = 0;
  private int line = 1;
  private int column = 1;
  private boolean eofReturned = false;
  private final List<Diagnostic> diagnostics = new ArrayList<>();

  public Lexer(String input) {
    this.input = Objects.requireNonNull(input, "input");
  }

  /**
   * Scans the whole input.
   *
   * @param input KERN source text
   * @return all tokens in order; the last and only the last one is {@code EOF}
   */
  public static List<Token> tokenize(String input) {
    Lexer lexer = new Lexer(input);
    List<Token> tokens = new ArrayList<>();
    while (lexer.hasNext()) {
      tokens.add(lexer.next());
    }
    return tokens;
  }

  @Override
  public boolean hasNext() {
    return !eofReturned;
  }

  /**
   * Iterator view of {@link #nextToken()}.
   *
   * @throws NoSuchElementException once {@code EOF} has been returned
   */
  @Override
  public Token next() {
    if (eofReturned) {
      throw new NoSuchElementException("Token stream already ended");
    }
    return nextToken();
  }

  /**
   * Scans the next token. Once the input is exhausted every call returns {@code EOF} at the end
   * position; callers should stop at the first one.
   */
  public Token nextToken() {
    skipWhitespace();
    Token token = scan();
    if (token.is(TokenKind.EOF)) {
      eofReturned = true;
    }
    if (log.isTraceEnabled()) {
      log.trace("token {}", token);
    }
    return token;
  }

  /** Lexer-level notes (illegal characters, out-of-range integers) in source order. */
  public List<Diagnostic> diagnostics() {
    return Collections.unmodifiableList(diagnostics);
  }

  private Token scan() {
    SourcePosition start = position();
    if (isAtEnd()) {
      return Token.eof(start);
    }
    char c = advance();
    switch (c) {
      case '=':
        return match('=')
            ? Token.symbol(TokenKind.EQUAL, start, 2)
            : Token.symbol(TokenKind.ASSIGNMENT, start, 1);
      case '!':
        if (match('=')) {
          return Token.symbol(TokenKind.NOT_EQUAL, start, 2);
        }
        return illegal("!", start, "unexpected character '!' (did you mean '!='?)");
      case '>':
        return match('=')
            ? Token.symbol(TokenKind.GREATER_EQUAL, start, 2)
            : Token.symbol(TokenKind.GREATER, start, 1);
      case '<':
        return match('=')
            ? Token.symbol(TokenKind.LESS_EQUAL, start, 2)
            : Token.symbol(TokenKind.LESS, start, 1);
      case '{':
        return Token.symbol(TokenKind.LEFT_BRACE, start, 1);
      case '}':
        return Token.symbol(TokenKind.RIGHT_BRACE, start, 1);
      case '(':
        return Token.symbol(TokenKind.LEFT_PAREN, start, 1);
      case ')':
        return Token.symbol(TokenKind.RIGHT_PAREN, start, 1);
      case ',':
        return Token.symbol(TokenKind.COMMA, start, 1);
      case '.':
        return Token.symbol(TokenKind.DOT, start, 1);
      case ':':
        return Token.symbol(TokenKind.COLON, start, 1);
      case '"':
      case '\'':
        // no string literal syntax; the quote alone is rejected
        return illegal(
            String.valueOf(c), start, "string literals are not supported in KERN: " + c);
      default:
        break;
    }
    if (isIdentifierStart(c)) {
      return identifierOrKeyword(start);
    }
    if (isDigit(c)) {
      return number(start);
    }
    String character = String.valueOf(c);
    if (Character.isHighSurrogate(c) && !isAtEnd() && Character.isLowSurrogate(peek())) {
      // the low half shares the column of the high half
      character = input.substring(start.offset(), ++pos);
    }
    return illegal(character, start, "unrecognized character '" + character + "'");
  }

  private Token identifierOrKeyword(SourcePosition start) {
    while (!isAtEnd() && isIdentifierPart(peek())) {
      advance();
    }
    String word = input.substring(start.offset(), pos);
    TokenKind kind = Keywords.lookup(word).orElse(TokenKind.IDENTIFIER);
    return Token.text(kind, word, start);
  }

  private Token number(SourcePosition start) {
    while (!isAtEnd() && isDigit(peek())) {
      advance();
    }
    String digits = input.substring(start.offset(), pos);
    long value;
    try {
      value = Long.parseLong(digits);
    } catch (NumberFormatException e) {
      diagnostics.add(
          new Diagnostic(
              Diagnostic.Kind.NUMBER_OUT_OF_RANGE,
              "integer literal out of range: " + digits,
              start));
      log.debug("Integer literal out of range at {}: {}", start, digits);
      value = 0L;
    }
    return Token.number(value, start, digits.length());
  }

  private Token illegal(String character, SourcePosition start, String message) {
    diagnostics.add(new Diagnostic(Diagnostic.Kind.ILLEGAL_CHARACTER, message, start));
    return Token.illegal(character, start);
  }

  private void skipWhitespace() {
    while (!isAtEnd() && Character.isWhitespace(peek())) {
      advance();
    }
  }

  private SourcePosition position() {
    return new SourcePosition(line, column, pos);
  }

  private boolean isAtEnd() {
    return pos >= input.length();
  }

  private char peek() {
    return input.charAt(pos);
  }

  private char advance() {
    char c = input.charAt(pos++);
    if (c == '\n') {
      line++;
      column = 1;
    } else {
      column++;
    }
    return c;
  }

  private boolean match(char expected) {
    if (isAtEnd() || peek() != expected) {
      return false;
    }
    advance();
    return true;
  }

  private static boolean isIdentifierStart(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
  }

  private static boolean isIdentifierPart(char c) {
    return isIdentifierStart(c) || isDigit(c);
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }
}
