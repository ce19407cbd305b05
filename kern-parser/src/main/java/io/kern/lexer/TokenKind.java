package io.kern.lexer;

/**
 * Token kinds of the KERN surface syntax.
 *
 * <p>Each kind fixes the payload its tokens carry, see {@link PayloadType}.
 */
public enum TokenKind {
  // Keywords
  /** entity */
  ENTITY(PayloadType.TEXT),
  /** rule */
  RULE(PayloadType.TEXT),
  /** flow */
  FLOW(PayloadType.TEXT),
  /** constraint */
  CONSTRAINT(PayloadType.TEXT),
  /** if */
  IF(PayloadType.TEXT),
  /** then */
  THEN(PayloadType.TEXT),
  /** else */
  ELSE(PayloadType.TEXT),
  /** loop */
  LOOP(PayloadType.TEXT),
  /** break */
  BREAK(PayloadType.TEXT),
  /** halt */
  HALT(PayloadType.TEXT),
  /** and */
  AND(PayloadType.TEXT),
  /** or */
  OR(PayloadType.TEXT),

  // Content
  /** Letter or underscore followed by letters, digits and underscores. */
  IDENTIFIER(PayloadType.TEXT),

  /** Unsigned decimal integer. */
  NUMBER(PayloadType.INTEGER),

  // Symbols
  /** : */
  COLON(PayloadType.NONE),
  /** , */
  COMMA(PayloadType.NONE),
  /** . */
  DOT(PayloadType.NONE),
  /** { */
  LEFT_BRACE(PayloadType.NONE),
  /** } */
  RIGHT_BRACE(PayloadType.NONE),
  /** ( */
  LEFT_PAREN(PayloadType.NONE),
  /** ) */
  RIGHT_PAREN(PayloadType.NONE),

  // Operators
  /** == */
  EQUAL(PayloadType.NONE),
  /** != */
  NOT_EQUAL(PayloadType.NONE),
  /** &gt; */
  GREATER(PayloadType.NONE),
  /** &lt; */
  LESS(PayloadType.NONE),
  /** &gt;= */
  GREATER_EQUAL(PayloadType.NONE),
  /** &lt;= */
  LESS_EQUAL(PayloadType.NONE),
  /** = */
  ASSIGNMENT(PayloadType.NONE),

  // Special
  /** A character that is not part of the language; carries the character as text. */
  ILLEGAL(PayloadType.TEXT),

  /** End of input */
  EOF(PayloadType.NONE);

  /** Shape of the value a token of a given kind carries. */
  public enum PayloadType {
    NONE,
    TEXT,
    INTEGER
  }

  private final PayloadType payloadType;

  TokenKind(PayloadType payloadType) {
    this.payloadType = payloadType;
  }

  public PayloadType payloadType() {
    return payloadType;
  }

  public boolean isKeyword() {
    return ordinal() <= OR.ordinal();
  }

  /** True for the relational operators usable in a comparison. */
  public boolean isComparison() {
    return switch (this) {
      case EQUAL, NOT_EQUAL, GREATER, LESS, GREATER_EQUAL, LESS_EQUAL -> true;
      default -> false;
    };
  }

  public boolean isDelimiter() {
    return ordinal() >= COLON.ordinal() && ordinal() <= RIGHT_PAREN.ordinal();
  }

  /** Keywords that open a top-level definition; these are the parser's recovery anchors. */
  public boolean isDefinitionStart() {
    return this == ENTITY || this == RULE || this == FLOW || this == CONSTRAINT;
  }
}
