package io.kern.cli;

import io.kern.ast.AstPrinter;
import io.kern.ast.KernAst.Action;
import io.kern.ast.KernAst.Assignment;
import io.kern.ast.KernAst.Break;
import io.kern.ast.KernAst.Conditional;
import io.kern.ast.KernAst.ConstraintDef;
import io.kern.ast.KernAst.Definition;
import io.kern.ast.KernAst.EntityDef;
import io.kern.ast.KernAst.FieldDef;
import io.kern.ast.KernAst.FlowDef;
import io.kern.ast.KernAst.Halt;
import io.kern.ast.KernAst.Loop;
import io.kern.ast.KernAst.PredicateCall;
import io.kern.ast.KernAst.Program;
import io.kern.ast.KernAst.RuleDef;
import java.util.List;

/**
 * Outline view of a program for {@code kern parse --format text}.
 *
 * <pre>
 * EntityDef Farmer @1:1
 *   field id
 * RuleDef Ripe @2:1
 *   if crop.age &gt;= 90
 *   then
 *     call harvest(crop)
 * </pre>
 *
 * <p>Conditions and terms are shown inline as canonical source.
 */
final class AstTreeWriter implements Definition.Visitor<Void>, Action.Visitor<Void> {

  private final StringBuilder out = new StringBuilder();
  private int depth = 0;

  static String write(Program program) {
    AstTreeWriter writer = new AstTreeWriter();
    program.definitions().forEach(d -> d.accept(writer));
    return writer.out.toString();
  }

  private void line(String text) {
    out.append("  ".repeat(depth)).append(text).append(System.lineSeparator());
  }

  private void block(String header, List<Action> actions) {
    line(header);
    depth++;
    actions.forEach(a -> a.accept(this));
    depth--;
  }

  private void definition(Definition d, Runnable body) {
    line(d.getClass().getSimpleName() + " " + d.name() + " @" + d.position());
    depth++;
    body.run();
    depth--;
  }

  @Override
  public Void visitEntity(EntityDef entity) {
    definition(
        entity,
        () -> {
          for (FieldDef field : entity.fields()) {
            line("field " + field.name());
          }
        });
    return null;
  }

  @Override
  public Void visitRule(RuleDef rule) {
    definition(
        rule,
        () -> {
          line("if " + AstPrinter.print(rule.condition()));
          block("then", rule.actions());
        });
    return null;
  }

  @Override
  public Void visitFlow(FlowDef flow) {
    definition(flow, () -> flow.actions().forEach(a -> a.accept(this)));
    return null;
  }

  @Override
  public Void visitConstraint(ConstraintDef constraint) {
    definition(constraint, () -> line("require " + AstPrinter.print(constraint.condition())));
    return null;
  }

  @Override
  public Void visitCall(PredicateCall call) {
    line("call " + AstPrinter.print(call));
    return null;
  }

  @Override
  public Void visitAssignment(Assignment assignment) {
    line("set " + AstPrinter.print(assignment));
    return null;
  }

  @Override
  public Void visitConditional(Conditional conditional) {
    line("if " + AstPrinter.print(conditional.condition()));
    depth++;
    block("then", conditional.thenActions());
    if (conditional.hasElse()) {
      block("else", conditional.elseActions());
    }
    depth--;
    return null;
  }

  @Override
  public Void visitLoop(Loop loop) {
    block("loop", loop.actions());
    return null;
  }

  @Override
  public Void visitBreak(Break brk) {
    line("break");
    return null;
  }

  @Override
  public Void visitHalt(Halt halt) {
    line("halt");
    return null;
  }
}
