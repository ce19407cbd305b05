package io.kern.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
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
import io.kern.ast.KernAst.Loop;
import io.kern.ast.KernAst.NumberLiteral;
import io.kern.ast.KernAst.PredicateCall;
import io.kern.ast.KernAst.PredicateCondition;
import io.kern.ast.KernAst.Program;
import io.kern.ast.KernAst.QualifiedRef;
import io.kern.ast.KernAst.RuleDef;
import io.kern.ast.KernAst.Term;
import io.kern.syntax.Diagnostic;
import io.kern.syntax.SourcePosition;
import java.util.List;

/**
 * Converts a parse result to a Gson tree. Every node is an object whose {@code type} member names
 * its AST class.
 */
final class AstJsonWriter
    implements Definition.Visitor<JsonObject>,
        Action.Visitor<JsonObject>,
        Condition.Visitor<JsonObject>,
        Term.Visitor<JsonObject> {

  private static final Gson GSON =
      new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

  static String toJson(Program program, List<Diagnostic> diagnostics) {
    return GSON.toJson(toTree(program, diagnostics));
  }

  static JsonObject toTree(Program program, List<Diagnostic> diagnostics) {
    AstJsonWriter writer = new AstJsonWriter();
    JsonObject root = node("Program");
    JsonArray definitions = new JsonArray();
    for (Definition definition : program.definitions()) {
      definitions.add(definition.accept(writer));
    }
    root.add("definitions", definitions);

    JsonArray diags = new JsonArray();
    for (Diagnostic d : diagnostics) {
      JsonObject o = new JsonObject();
      o.addProperty("kind", d.kind().name());
      o.addProperty("message", d.message());
      o.add("position", position(d.position()));
      diags.add(o);
    }
    root.add("diagnostics", diags);
    return root;
  }

  private static JsonObject node(String type) {
    JsonObject o = new JsonObject();
    o.addProperty("type", type);
    return o;
  }

  private static JsonObject position(SourcePosition position) {
    JsonObject o = new JsonObject();
    o.addProperty("line", position.line());
    o.addProperty("column", position.column());
    o.addProperty("offset", position.offset());
    return o;
  }

  private JsonArray actions(List<Action> actions) {
    JsonArray array = new JsonArray();
    actions.forEach(a -> array.add(a.accept(this)));
    return array;
  }

  private JsonArray terms(List<Term> terms) {
    JsonArray array = new JsonArray();
    terms.forEach(t -> array.add(t.accept(this)));
    return array;
  }

  // definitions

  @Override
  public JsonObject visitEntity(EntityDef entity) {
    JsonObject o = node("EntityDef");
    o.addProperty("name", entity.name());
    JsonArray fields = new JsonArray();
    for (FieldDef field : entity.fields()) {
      fields.add(field.name());
    }
    o.add("fields", fields);
    o.add("position", position(entity.position()));
    return o;
  }

  @Override
  public JsonObject visitRule(RuleDef rule) {
    JsonObject o = node("RuleDef");
    o.addProperty("name", rule.name());
    o.add("condition", rule.condition().accept(this));
    o.add("actions", actions(rule.actions()));
    o.add("position", position(rule.position()));
    return o;
  }

  @Override
  public JsonObject visitFlow(FlowDef flow) {
    JsonObject o = node("FlowDef");
    o.addProperty("name", flow.name());
    o.add("actions", actions(flow.actions()));
    o.add("position", position(flow.position()));
    return o;
  }

  @Override
  public JsonObject visitConstraint(ConstraintDef constraint) {
    JsonObject o = node("ConstraintDef");
    o.addProperty("name", constraint.name());
    o.add("condition", constraint.condition().accept(this));
    o.add("position", position(constraint.position()));
    return o;
  }

  // actions

  @Override
  public JsonObject visitCall(PredicateCall call) {
    JsonObject o = node("PredicateCall");
    o.addProperty("name", call.name());
    o.add("args", terms(call.args()));
    return o;
  }

  @Override
  public JsonObject visitAssignment(Assignment assignment) {
    JsonObject o = node("Assignment");
    o.addProperty("variable", assignment.variable());
    o.add("value", assignment.value().accept(this));
    return o;
  }

  @Override
  public JsonObject visitConditional(Conditional conditional) {
    JsonObject o = node("Conditional");
    o.add("condition", conditional.condition().accept(this));
    o.add("then", actions(conditional.thenActions()));
    if (conditional.hasElse()) {
      o.add("else", actions(conditional.elseActions()));
    }
    return o;
  }

  @Override
  public JsonObject visitLoop(Loop loop) {
    JsonObject o = node("Loop");
    o.add("actions", actions(loop.actions()));
    return o;
  }

  @Override
  public JsonObject visitBreak(Break brk) {
    return node("Break");
  }

  @Override
  public JsonObject visitHalt(Halt halt) {
    return node("Halt");
  }

  // conditions

  @Override
  public JsonObject visitComparison(Comparison comparison) {
    JsonObject o = node("Comparison");
    o.add("left", comparison.left().accept(this));
    o.addProperty("op", comparison.op().symbol());
    o.add("right", comparison.right().accept(this));
    return o;
  }

  @Override
  public JsonObject visitLogical(LogicalExpr logical) {
    JsonObject o = node("LogicalExpr");
    o.add("left", logical.left().accept(this));
    o.addProperty("op", logical.op().keyword());
    o.add("right", logical.right().accept(this));
    return o;
  }

  @Override
  public JsonObject visitPredicate(PredicateCondition predicate) {
    JsonObject o = node("PredicateCondition");
    o.add("call", visitCall(predicate.call()));
    return o;
  }

  // terms

  @Override
  public JsonObject visitIdentifier(Identifier identifier) {
    JsonObject o = node("Identifier");
    o.addProperty("name", identifier.name());
    return o;
  }

  @Override
  public JsonObject visitNumber(NumberLiteral number) {
    JsonObject o = node("NumberLiteral");
    o.addProperty("value", number.value());
    return o;
  }

  @Override
  public JsonObject visitQualified(QualifiedRef ref) {
    JsonObject o = node("QualifiedRef");
    o.addProperty("entity", ref.entity());
    o.addProperty("field", ref.field());
    return o;
  }
}
