package io.kern.lexer;

import java.util.Map;
import java.util.Optional;

/** The reserved words of KERN. Built once; shared read-only by every {@link Lexer}. */
public final class Keywords {

  private static final Map<String, TokenKind> TABLE =
      Map.ofEntries(
          Map.entry("entity", TokenKind.ENTITY),
          Map.entry("rule", TokenKind.RULE),
          Map.entry("flow", TokenKind.FLOW),
          Map.entry("constraint", TokenKind.CONSTRAINT),
          Map.entry("if", TokenKind.IF),
          Map.entry("then", TokenKind.THEN),
          Map.entry("else", TokenKind.ELSE),
          Map.entry("loop", TokenKind.LOOP),
          Map.entry("break", TokenKind.BREAK),
          Map.entry("halt", TokenKind.HALT),
          Map.entry("and", TokenKind.AND),
          Map.entry("or", TokenKind.OR));

  private Keywords() {}

  /** Keyword kind for {@code word}, empty for a plain identifier. Matching is case-sensitive. */
  public static Optional<TokenKind> lookup(String word) {
    return Optional.ofNullable(TABLE.get(word));
  }

  public static boolean isKeyword(String word) {
    return TABLE.containsKey(word);
  }

  /** Unmodifiable view of the whole table. */
  public static Map<String, TokenKind> table() {
    return TABLE;
  }
}
