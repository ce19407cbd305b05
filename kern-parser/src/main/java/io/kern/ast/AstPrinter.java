package io.kern.ast;

import io.kern.ast.KernAst.Action;
import io.kern.ast.KernAst.Assignment;
import io.kern.ast.KernAst.Break;
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
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders an AST back to canonical KERN source, one definition per line.
 *
 * <p>The grammar has no grouping parentheses and an action list after {@code then}/{@code else}
 * extends as far as commas allow, so only trees of the shape the parser builds can be printed:
 * left-nested {@code and}/{@code or} chains with {@code and} below {@code or}, and conditionals
 * last in their action list. Other shapes are rejected with {@link IllegalArgumentException}.
 */
public final class AstPrinter
    implements Definition.Visitor<String>,
        Action.Visitor<String>,
        Condition.Visitor<String>,
        Term.Visitor<String> {

  private static final AstPrinter INSTANCE = new AstPrinter();

  private AstPrinter() {}

  public static String print(Program program) {
    return program.definitions().stream()
        .map(d -> d.accept(INSTANCE))
        .collect(Collectors.joining("\n", "", program.isEmpty() ? "" : "\n"));
  }

  public static String print(Definition definition) {
    return definition.accept(INSTANCE);
  }

  public static String print(Condition condition) {
    return condition.accept(INSTANCE);
  }

  public static String print(Action action) {
    return action.accept(INSTANCE);
  }

  public static String print(Term term) {
    return term.accept(INSTANCE);
  }

  // definitions

  @Override
  public String visitEntity(EntityDef entity) {
    if (entity.fields().isEmpty()) {
      return "entity " + entity.name() + " { }";
    }
    String fields =
        entity.fields().stream().map(FieldDef::name).collect(Collectors.joining(" "));
    return "entity " + entity.name() + " { " + fields + " }";
  }

  @Override
  public String visitRule(RuleDef rule) {
    return "rule "
        + rule.name()
        + ": if "
        + rule.condition().accept(this)
        + " then "
        + actions(rule.actions());
  }

  @Override
  public String visitFlow(FlowDef flow) {
    return "flow " + flow.name() + " { " + actions(flow.actions()) + " }";
  }

  @Override
  public String visitConstraint(ConstraintDef constraint) {
    return "constraint " + constraint.name() + ": " + constraint.condition().accept(this);
  }

  // actions

  private String actions(List<Action> actions) {
    if (actions.isEmpty()) {
      throw new IllegalArgumentException("Action list must not be empty");
    }
    for (int i = 0; i < actions.size() - 1; i++) {
      if (actions.get(i) instanceof Conditional) {
        throw new IllegalArgumentException(
            "A conditional must be the last action of its list: " + actions);
      }
    }
    return actions.stream().map(a -> a.accept(this)).collect(Collectors.joining(", "));
  }

  @Override
  public String visitCall(PredicateCall call) {
    return call.name()
        + call.args().stream().map(t -> t.accept(this)).collect(Collectors.joining(", ", "(", ")"));
  }

  @Override
  public String visitAssignment(Assignment assignment) {
    return assignment.variable() + " = " + assignment.value().accept(this);
  }

  @Override
  public String visitConditional(Conditional conditional) {
    if (conditional.hasElse() && endsWithOpenConditional(conditional.thenActions())) {
      // the else would attach to the inner conditional
      throw new IllegalArgumentException("Dangling else cannot be printed: " + conditional);
    }
    StringBuilder sb = new StringBuilder();
    sb.append("if ")
        .append(conditional.condition().accept(this))
        .append(" then ")
        .append(actions(conditional.thenActions()));
    if (conditional.hasElse()) {
      sb.append(" else ").append(actions(conditional.elseActions()));
    }
    return sb.toString();
  }

  private static boolean endsWithOpenConditional(List<Action> actions) {
    if (actions.isEmpty() || !(actions.get(actions.size() - 1) instanceof Conditional last)) {
      return false;
    }
    return !last.hasElse() || endsWithOpenConditional(last.elseActions());
  }

  @Override
  public String visitLoop(Loop loop) {
    return "loop { " + actions(loop.actions()) + " }";
  }

  @Override
  public String visitBreak(Break brk) {
    return "break";
  }

  @Override
  public String visitHalt(Halt halt) {
    return "halt";
  }

  // conditions

  @Override
  public String visitComparison(Comparison comparison) {
    return comparison.left().accept(this)
        + " "
        + comparison.op().symbol()
        + " "
        + comparison.right().accept(this);
  }

  @Override
  public String visitLogical(LogicalExpr logical) {
    boolean printable =
        logical.op() == LogicalOp.OR
            ? !isLogical(logical.right(), LogicalOp.OR)
            : !isLogical(logical.left(), LogicalOp.OR) && !(logical.right() instanceof LogicalExpr);
    if (!printable) {
      throw new IllegalArgumentException("Condition needs grouping: " + logical);
    }
    return logical.left().accept(this)
        + " "
        + logical.op().keyword()
        + " "
        + logical.right().accept(this);
  }

  private static boolean isLogical(Condition condition, LogicalOp op) {
    return condition instanceof LogicalExpr l && l.op() == op;
  }

  @Override
  public String visitPredicate(PredicateCondition predicate) {
    return visitCall(predicate.call());
  }

  // terms

  @Override
  public String visitIdentifier(Identifier identifier) {
    return identifier.name();
  }

  @Override
  public String visitNumber(NumberLiteral number) {
    return Long.toString(number.value());
  }

  @Override
  public String visitQualified(QualifiedRef ref) {
    return ref.entity() + "." + ref.field();
  }
}
