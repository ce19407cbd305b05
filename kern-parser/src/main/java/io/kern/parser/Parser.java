package io.kern.parser;

import io.kern.ast.KernAst.Action;
import io.kern.ast.KernAst.Assignment;
import io.kern.ast.KernAst.Break;
import io.kern.ast.KernAst.Comparator;
import io.kern.ast.KernAst.Comparison;
import io.kern.ast.KernAst.Condition;
import io.kern.ast.KernAst.Conditional;
import io.kern.ast.KernAst.ConstraintDef;
import io.kern.ast.KernAst.Definition;
import io.kern.ast.KernAst.EntityDef;
import io.kern.ast.KernAst.FieldDef;
import io.kern.ast.KernAst.FlowDef;
import io.kern.ast.KernAst.Halt;
import io.kern.ast.KernAst.Identifier;
import io.kern.ast.KernAst.LogicalExpr;
import io.kern.ast.KernAst.LogicalOp;
import io.kern.ast.KernAst.Loop;
import io.kern.ast.KernAst.NumberLiteral;
import io.kern.ast.KernAst.PredicateCall;
import io.kern.ast.KernAst.PredicateCondition;
import io.kern.ast.KernAst.Program;
import io.kern.ast.KernAst.QualifiedRef;
import io.kern.ast.KernAst.RuleDef;
import io.kern.ast.KernAst.Term;
import io.kern.lexer.Lexer;
import io.kern.lexer.Token;
import io.kern.lexer.TokenKind;
import io.kern.syntax.Diagnostic;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive descent parser for KERN with one token of lookahead.
 *
 * <p>Grammar:
 *
 * <pre>
 * program       := definition*
 * definition    := entityDef | ruleDef | flowDef | constraintDef
 * entityDef     := 'entity' IDENT '{' IDENT* '}'
 * ruleDef       := 'rule' IDENT ':' 'if' condition 'then' actionList
 * flowDef       := 'flow' IDENT '{' actionList '}'
 * constraintDef := 'constraint' IDENT ':' condition
 * actionList    := action (',' action)*
 * action        := IDENT '(' args? ')' | IDENT '=' term
 *                | 'if' condition 'then' actionList ('else' actionList)?
 *                | 'loop' '{' actionList '}' | 'break' | 'halt'
 * condition     := andExpr ('or' andExpr)*
 * andExpr       := comparison ('and' comparison)*
 * comparison    := term ('==' | '!=' | '&gt;' | '&lt;' | '&gt;=' | '&lt;=') term
 *                | IDENT '(' args? ')'
 * args          := term (',' term)*
 * term          := IDENT ('.' IDENT)? | NUMBER
 * </pre>
 *
 * <p>Errors use panic-mode recovery: the first unmet expectation inside a definition becomes one
 * diagnostic, the partial definition is dropped, and tokens are skipped up to the next {@code
 * entity}, {@code rule}, {@code flow} or {@code constraint} keyword. Out-of-range integer notes
 * from the lexer are only kept for definitions that parse. A parser is single use.
 */
public final class Parser {

  private static final Logger log = LoggerFactory.getLogger(Parser.class);

  /** Deepest allowed nesting of {@code if} and {@code loop} blocks. */
  public static final int MAX_NESTING = 256;

  private final Lexer lexer;
  private final ParserOptions options;
  private final List<Diagnostic> diagnostics = new ArrayList<>();
  private final List<Diagnostic> pendingNotes = new ArrayList<>();
  private Token current;
  private int lexerNotesSeen = 0;
  private long consumed = 0;
  private int nesting = 0;
  private boolean used = false;

  public Parser(String source) {
    this(source, ParserOptions.defaults());
  }

  public Parser(String source, ParserOptions options) {
    this.lexer = new Lexer(Objects.requireNonNull(source, "source"));
    this.options = Objects.requireNonNull(options, "options");
    this.current = lexer.nextToken();
    collectLexerNotes();
  }

  /**
   * Parses the whole buffer.
   *
   * <p>Always returns a program. Definitions that failed to parse are absent from it and each is
   * represented by exactly one diagnostic.
   *
   * @return the program and the diagnostics, in the order they were encountered
   * @throws IllegalStateException if called more than once
   */
  public ParseResult parseProgram() {
    if (used) {
      throw new IllegalStateException("Parser instances are single use");
    }
    used = true;

    List<Definition> definitions = new ArrayList<>();
    while (!current.is(TokenKind.EOF)) {
      long before = consumed;
      Parsed<Definition> definition = parseDefinition();
      if (!definition.isFailure()) {
        definitions.add(definition.value());
        commitNotesBefore(current.offset());
        continue;
      }
      SyntaxError error = definition.error();
      diagnostics.add(error.toDiagnostic());
      log.debug("Syntax error at {}: {}", error.position(), error.message());
      if (!options.recoveryEnabled()) {
        log.debug("Recovery disabled, stopping after first error");
        pendingNotes.clear();
        break;
      }
      synchronize(before);
    }
    return new ParseResult(new Program(definitions), diagnostics);
  }

  /** Diagnostics recorded so far. */
  public List<Diagnostic> diagnostics() {
    return Collections.unmodifiableList(diagnostics);
  }

  // === Recovery ===

  private void synchronize(long consumedAtStart) {
    if (consumed == consumedAtStart && !current.is(TokenKind.EOF)) {
      advance();
    }
    int skipped = 0;
    while (!current.is(TokenKind.EOF) && !current.kind().isDefinitionStart()) {
      advance();
      skipped++;
    }
    if (!pendingNotes.isEmpty()) {
      log.debug("Dropping {} lexer note(s) inside the failed definition", pendingNotes.size());
      pendingNotes.clear();
    }
    log.debug("Skipped {} token(s), resuming at {}", skipped, current);
  }

  // The lookahead may already belong to the next definition, so its notes wait for that one.
  private void commitNotesBefore(int offset) {
    while (!pendingNotes.isEmpty() && pendingNotes.get(0).offset() < offset) {
      diagnostics.add(pendingNotes.remove(0));
    }
  }

  // === Definitions ===

  private Parsed<Definition> parseDefinition() {
    return switch (current.kind()) {
      case ENTITY -> parseEntity();
      case RULE -> parseRule();
      case FLOW -> parseFlow();
      case CONSTRAINT -> parseConstraint();
      default -> Parsed.failure(unexpected("definition"));
    };
  }

  private Parsed<Definition> parseEntity() {
    Token keyword = advance();
    Parsed<Token> name = expect(TokenKind.IDENTIFIER);
    if (name.isFailure()) return name.propagate();
    Parsed<Token> open = expect(TokenKind.LEFT_BRACE);
    if (open.isFailure()) return open.propagate();

    List<FieldDef> fields = new ArrayList<>();
    while (current.is(TokenKind.IDENTIFIER)) {
      fields.add(new FieldDef(advance().text()));
    }

    Parsed<Token> close = expect(TokenKind.RIGHT_BRACE);
    if (close.isFailure()) return close.propagate();
    return Parsed.success(new EntityDef(name.value().text(), fields, keyword.position()));
  }

  private Parsed<Definition> parseRule() {
    Token keyword = advance();
    Parsed<Token> name = expect(TokenKind.IDENTIFIER);
    if (name.isFailure()) return name.propagate();
    Parsed<Token> colon = expect(TokenKind.COLON);
    if (colon.isFailure()) return colon.propagate();
    Parsed<Token> ifKw = expect(TokenKind.IF);
    if (ifKw.isFailure()) return ifKw.propagate();
    Parsed<Condition> condition = parseCondition();
    if (condition.isFailure()) return condition.propagate();
    Parsed<Token> then = expect(TokenKind.THEN);
    if (then.isFailure()) return then.propagate();
    Parsed<List<Action>> actions = parseActionList();
    if (actions.isFailure()) return actions.propagate();
    return Parsed.success(
        new RuleDef(
            name.value().text(), condition.value(), actions.value(), keyword.position()));
  }

  private Parsed<Definition> parseFlow() {
    Token keyword = advance();
    Parsed<Token> name = expect(TokenKind.IDENTIFIER);
    if (name.isFailure()) return name.propagate();
    Parsed<Token> open = expect(TokenKind.LEFT_BRACE);
    if (open.isFailure()) return open.propagate();
    Parsed<List<Action>> actions = parseActionList();
    if (actions.isFailure()) return actions.propagate();
    Parsed<Token> close = expect(TokenKind.RIGHT_BRACE);
    if (close.isFailure()) return close.propagate();
    return Parsed.success(new FlowDef(name.value().text(), actions.value(), keyword.position()));
  }

  private Parsed<Definition> parseConstraint() {
    Token keyword = advance();
    Parsed<Token> name = expect(TokenKind.IDENTIFIER);
    if (name.isFailure()) return name.propagate();
    Parsed<Token> colon = expect(TokenKind.COLON);
    if (colon.isFailure()) return colon.propagate();
    Parsed<Condition> condition = parseCondition();
    if (condition.isFailure()) return condition.propagate();
    return Parsed.success(
        new ConstraintDef(name.value().text(), condition.value(), keyword.position()));
  }

  // === Actions ===

  private Parsed<List<Action>> parseActionList() {
    List<Action> actions = new ArrayList<>();
    Parsed<Action> first = parseAction();
    if (first.isFailure()) return first.propagate();
    actions.add(first.value());
    while (current.is(TokenKind.COMMA)) {
      advance(); // ,
      Parsed<Action> next = parseAction();
      if (next.isFailure()) return next.propagate();
      actions.add(next.value());
    }
    return Parsed.success(actions);
  }

  private Parsed<Action> parseAction() {
    switch (current.kind()) {
      case IF:
      case LOOP:
        return parseBlock();
      case BREAK:
        advance();
        return Parsed.success(new Break());
      case HALT:
        advance();
        return Parsed.success(new Halt());
      case IDENTIFIER:
        break;
      default:
        return Parsed.failure(unexpected("action"));
    }
    String name = advance().text();
    // the token after the name decides between assignment and call
    if (current.is(TokenKind.ASSIGNMENT)) {
      advance(); // =
      return parseTerm().map(value -> new Assignment(name, value));
    }
    return parseCallArguments(name).map(args -> new PredicateCall(name, args));
  }

  private Parsed<Action> parseBlock() {
    if (nesting == MAX_NESTING) {
      return Parsed.failure(new SyntaxError.NestingTooDeep(MAX_NESTING, current.position()));
    }
    nesting++;
    try {
      return current.is(TokenKind.IF) ? parseConditional() : parseLoop();
    } finally {
      nesting--;
    }
  }

  private Parsed<Action> parseConditional() {
    advance(); // if
    Parsed<Condition> condition = parseCondition();
    if (condition.isFailure()) return condition.propagate();
    Parsed<Token> then = expect(TokenKind.THEN);
    if (then.isFailure()) return then.propagate();
    Parsed<List<Action>> thenActions = parseActionList();
    if (thenActions.isFailure()) return thenActions.propagate();

    List<Action> elseActions = null;
    if (current.is(TokenKind.ELSE)) {
      advance(); // else
      Parsed<List<Action>> parsedElse = parseActionList();
      if (parsedElse.isFailure()) return parsedElse.propagate();
      elseActions = parsedElse.value();
    }
    return Parsed.success(new Conditional(condition.value(), thenActions.value(), elseActions));
  }

  private Parsed<Action> parseLoop() {
    advance(); // loop
    Parsed<Token> open = expect(TokenKind.LEFT_BRACE);
    if (open.isFailure()) return open.propagate();
    Parsed<List<Action>> body = parseActionList();
    if (body.isFailure()) return body.propagate();
    Parsed<Token> close = expect(TokenKind.RIGHT_BRACE);
    if (close.isFailure()) return close.propagate();
    return Parsed.success(new Loop(body.value()));
  }

  /** Parses {@code '(' (term (',' term)*)? ')'} after a predicate name. */
  private Parsed<List<Term>> parseCallArguments(String name) {
    Parsed<Token> open = expect(TokenKind.LEFT_PAREN);
    if (open.isFailure()) return open.propagate();
    List<Term> args = new ArrayList<>();
    if (!current.is(TokenKind.RIGHT_PAREN)) {
      Parsed<Term> first = parseTerm();
      if (first.isFailure()) return first.propagate();
      args.add(first.value());
      while (current.is(TokenKind.COMMA)) {
        advance(); // ,
        Parsed<Term> next = parseTerm();
        if (next.isFailure()) return next.propagate();
        args.add(next.value());
      }
    }
    Parsed<Token> close = expect(TokenKind.RIGHT_PAREN);
    if (close.isFailure()) return close.propagate();
    log.trace("call {} with {} argument(s)", name, args.size());
    return Parsed.success(args);
  }

  // === Conditions ===

  private Parsed<Condition> parseCondition() {
    return parseOr();
  }

  // orExpr := andExpr ('or' andExpr)*
  private Parsed<Condition> parseOr() {
    Parsed<Condition> left = parseAnd();
    if (left.isFailure()) return left;
    Condition result = left.value();
    while (current.is(TokenKind.OR)) {
      advance(); // or
      Parsed<Condition> right = parseAnd();
      if (right.isFailure()) return right;
      result = new LogicalExpr(result, LogicalOp.OR, right.value());
    }
    return Parsed.success(result);
  }

  // andExpr := comparison ('and' comparison)*
  private Parsed<Condition> parseAnd() {
    Parsed<Condition> left = parseComparison();
    if (left.isFailure()) return left;
    Condition result = left.value();
    while (current.is(TokenKind.AND)) {
      advance(); // and
      Parsed<Condition> right = parseComparison();
      if (right.isFailure()) return right;
      result = new LogicalExpr(result, LogicalOp.AND, right.value());
    }
    return Parsed.success(result);
  }

  private Parsed<Condition> parseComparison() {
    Parsed<Term> left = parseTerm();
    if (left.isFailure()) return left.propagate();

    if (left.value() instanceof Identifier id && current.is(TokenKind.LEFT_PAREN)) {
      return parseCallArguments(id.name())
          .map(args -> new PredicateCondition(new PredicateCall(id.name(), args)));
    }
    if (!current.kind().isComparison()) {
      return Parsed.failure(unexpected("comparison operator"));
    }
    Comparator op = Comparator.fromToken(advance().kind());
    Parsed<Term> right = parseTerm();
    if (right.isFailure()) return right.propagate();
    return Parsed.success(new Comparison(left.value(), op, right.value()));
  }

  // === Terms ===

  private Parsed<Term> parseTerm() {
    if (current.is(TokenKind.NUMBER)) {
      return Parsed.success(new NumberLiteral(advance().number()));
    }
    if (!current.is(TokenKind.IDENTIFIER)) {
      return Parsed.failure(unexpected("term"));
    }
    String name = advance().text();
    if (!current.is(TokenKind.DOT)) {
      return Parsed.success(new Identifier(name));
    }
    advance(); // .
    return expect(TokenKind.IDENTIFIER).map(field -> new QualifiedRef(name, field.text()));
  }

  // === Token plumbing ===

  /**
   * Consumes the current token if it has the given kind. Otherwise nothing is consumed and the
   * failure describes the mismatch at the current position.
   */
  private Parsed<Token> expect(TokenKind kind) {
    if (current.is(kind)) {
      return Parsed.success(advance());
    }
    return Parsed.failure(unexpected(kind.name()));
  }

  private SyntaxError unexpected(String expected) {
    if (current.is(TokenKind.EOF)) {
      return new SyntaxError.UnexpectedEof(expected, current.position());
    }
    return new SyntaxError.UnexpectedToken(expected, current.kind(), current.position());
  }

  /** Returns the current token and pulls the next one. Never reads past {@code EOF}. */
  private Token advance() {
    Token previous = current;
    if (!previous.is(TokenKind.EOF)) {
      current = lexer.nextToken();
      consumed++;
      collectLexerNotes();
    }
    return previous;
  }

  // Out-of-range literals still lex as NUMBER, so the parser would accept them silently.
  private void collectLexerNotes() {
    List<Diagnostic> notes = lexer.diagnostics();
    while (lexerNotesSeen < notes.size()) {
      Diagnostic note = notes.get(lexerNotesSeen++);
      if (note.kind() == Diagnostic.Kind.NUMBER_OUT_OF_RANGE) {
        pendingNotes.add(note);
      }
    }
  }
}
