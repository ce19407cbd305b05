package io.kern.ast;

import io.kern.lexer.TokenKind;
import io.kern.syntax.SourcePosition;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * AST model for KERN programs.
 *
 * <pre>
 * entity Farmer { id location produce }
 * rule Ripe: if crop.age &gt;= 90 and weather == 1 then harvest(crop), ready = 1
 * flow Season { plant(), loop { water(), if dry == 1 then halt else break } }
 * constraint Positive: price &gt; 0
 * </pre>
 *
 * <p>Every node category is a sealed interface with its own visitor, so adding a variant breaks
 * every consumer at compile time. Nodes are immutable; lists are copied on construction.
 */
public final class KernAst {

  private KernAst() {}

  // === Program ===

  /** A parsed compilation unit: definitions in source order. */
  public record Program(List<Definition> definitions) {
    public Program {
      definitions = List.copyOf(definitions);
    }

    public static Program empty() {
      return new Program(List.of());
    }

    public boolean isEmpty() {
      return definitions.isEmpty();
    }
  }

  // === Definitions ===

  /** Top-level definition. */
  public sealed interface Definition permits EntityDef, RuleDef, FlowDef, ConstraintDef {

    String name();

    /** Position of the introducing keyword. */
    SourcePosition position();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
      R visitEntity(EntityDef entity);

      R visitRule(RuleDef rule);

      R visitFlow(FlowDef flow);

      R visitConstraint(ConstraintDef constraint);
    }
  }

  /** {@code entity Name { field* }} */
  public record EntityDef(String name, List<FieldDef> fields, SourcePosition position)
      implements Definition {
    public EntityDef {
      Objects.requireNonNull(name, "name");
      fields = List.copyOf(fields);
    }

    @Override
    public <R> R accept(Definition.Visitor<R> visitor) {
      return visitor.visitEntity(this);
    }
  }

  public record FieldDef(String name) {
    public FieldDef {
      Objects.requireNonNull(name, "name");
    }
  }

  /** {@code rule Name: if condition then actions} */
  public record RuleDef(
      String name, Condition condition, List<Action> actions, SourcePosition position)
      implements Definition {
    public RuleDef {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(condition, "condition");
      actions = List.copyOf(actions);
    }

    @Override
    public <R> R accept(Definition.Visitor<R> visitor) {
      return visitor.visitRule(this);
    }
  }

  /** {@code flow Name { actions }} */
  public record FlowDef(String name, List<Action> actions, SourcePosition position)
      implements Definition {
    public FlowDef {
      Objects.requireNonNull(name, "name");
      actions = List.copyOf(actions);
    }

    @Override
    public <R> R accept(Definition.Visitor<R> visitor) {
      return visitor.visitFlow(this);
    }
  }

  /** {@code constraint Name: condition} */
  public record ConstraintDef(String name, Condition condition, SourcePosition position)
      implements Definition {
    public ConstraintDef {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(condition, "condition");
    }

    @Override
    public <R> R accept(Definition.Visitor<R> visitor) {
      return visitor.visitConstraint(this);
    }
  }

  // === Conditions ===

  /** Relational operators. */
  public enum Comparator {
    EQ("=="),
    NE("!="),
    GT(">"),
    LT("<"),
    GE(">="),
    LE("<=");

    private final String symbol;

    Comparator(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }

    /**
     * Maps a comparison token kind to its operator.
     *
     * @throws IllegalArgumentException if {@code kind} is not a comparison
     */
    public static Comparator fromToken(TokenKind kind) {
      return switch (kind) {
        case EQUAL -> EQ;
        case NOT_EQUAL -> NE;
        case GREATER -> GT;
        case LESS -> LT;
        case GREATER_EQUAL -> GE;
        case LESS_EQUAL -> LE;
        default -> throw new IllegalArgumentException("Not a comparison operator: " + kind);
      };
    }
  }

  /** Logical connectives; {@code or} binds looser than {@code and}. */
  public enum LogicalOp {
    AND,
    OR;

    public String keyword() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  /** Boolean condition of a rule, constraint or conditional action. */
  public sealed interface Condition permits Comparison, LogicalExpr, PredicateCondition {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
      R visitComparison(Comparison comparison);

      R visitLogical(LogicalExpr logical);

      R visitPredicate(PredicateCondition predicate);
    }
  }

  /** {@code term op term} */
  public record Comparison(Term left, Comparator op, Term right) implements Condition {
    public Comparison {
      Objects.requireNonNull(left, "left");
      Objects.requireNonNull(op, "op");
      Objects.requireNonNull(right, "right");
    }

    @Override
    public <R> R accept(Condition.Visitor<R> visitor) {
      return visitor.visitComparison(this);
    }
  }

  /** Left-associative {@code and}/{@code or} combination. */
  public record LogicalExpr(Condition left, LogicalOp op, Condition right) implements Condition {
    public LogicalExpr {
      Objects.requireNonNull(left, "left");
      Objects.requireNonNull(op, "op");
      Objects.requireNonNull(right, "right");
    }

    @Override
    public <R> R accept(Condition.Visitor<R> visitor) {
      return visitor.visitLogical(this);
    }
  }

  /** A predicate call used as a truth value, e.g. {@code if eligible(farmer) then ...}. */
  public record PredicateCondition(PredicateCall call) implements Condition {
    public PredicateCondition {
      Objects.requireNonNull(call, "call");
    }

    @Override
    public <R> R accept(Condition.Visitor<R> visitor) {
      return visitor.visitPredicate(this);
    }
  }

  // === Actions ===

  /** Step of a rule body or flow. */
  public sealed interface Action permits PredicateCall, Assignment, Conditional, Loop, Break, Halt {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
      R visitCall(PredicateCall call);

      R visitAssignment(Assignment assignment);

      R visitConditional(Conditional conditional);

      R visitLoop(Loop loop);

      R visitBreak(Break brk);

      R visitHalt(Halt halt);
    }
  }

  /** {@code name(arg, ...)} */
  public record PredicateCall(String name, List<Term> args) implements Action {
    public PredicateCall {
      Objects.requireNonNull(name, "name");
      args = List.copyOf(args);
    }

    @Override
    public <R> R accept(Action.Visitor<R> visitor) {
      return visitor.visitCall(this);
    }
  }

  /** {@code variable = term} */
  public record Assignment(String variable, Term value) implements Action {
    public Assignment {
      Objects.requireNonNull(variable, "variable");
      Objects.requireNonNull(value, "value");
    }

    @Override
    public <R> R accept(Action.Visitor<R> visitor) {
      return visitor.visitAssignment(this);
    }
  }

  /**
   * {@code if condition then actions (else actions)?}
   *
   * @param elseActions {@code null} when there is no else branch
   */
  public record Conditional(
      Condition condition, List<Action> thenActions, List<Action> elseActions)
      implements Action {
    public Conditional {
      Objects.requireNonNull(condition, "condition");
      thenActions = List.copyOf(thenActions);
      elseActions = elseActions == null ? null : List.copyOf(elseActions);
    }

    public boolean hasElse() {
      return elseActions != null;
    }

    @Override
    public <R> R accept(Action.Visitor<R> visitor) {
      return visitor.visitConditional(this);
    }
  }

  /** {@code loop { actions }} */
  public record Loop(List<Action> actions) implements Action {
    public Loop {
      actions = List.copyOf(actions);
    }

    @Override
    public <R> R accept(Action.Visitor<R> visitor) {
      return visitor.visitLoop(this);
    }
  }

  /** {@code break} leaves the innermost loop. */
  public record Break() implements Action {
    @Override
    public <R> R accept(Action.Visitor<R> visitor) {
      return visitor.visitBreak(this);
    }
  }

  /** {@code halt} stops the enclosing flow. */
  public record Halt() implements Action {
    @Override
    public <R> R accept(Action.Visitor<R> visitor) {
      return visitor.visitHalt(this);
    }
  }

  // === Terms ===

  /** Operand of comparisons, call arguments and assignments. */
  public sealed interface Term permits Identifier, NumberLiteral, QualifiedRef {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
      R visitIdentifier(Identifier identifier);

      R visitNumber(NumberLiteral number);

      R visitQualified(QualifiedRef ref);
    }
  }

  public record Identifier(String name) implements Term {
    public Identifier {
      Objects.requireNonNull(name, "name");
    }

    @Override
    public <R> R accept(Term.Visitor<R> visitor) {
      return visitor.visitIdentifier(this);
    }
  }

  public record NumberLiteral(long value) implements Term {
    @Override
    public <R> R accept(Term.Visitor<R> visitor) {
      return visitor.visitNumber(this);
    }
  }

  /** {@code entity.field} */
  public record QualifiedRef(String entity, String field) implements Term {
    public QualifiedRef {
      Objects.requireNonNull(entity, "entity");
      Objects.requireNonNull(field, "field");
    }

    @Override
    public <R> R accept(Term.Visitor<R> visitor) {
      return visitor.visitQualified(this);
    }
  }
}
