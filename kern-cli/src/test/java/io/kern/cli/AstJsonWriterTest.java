package io.kern.cli;

import static org.junit.jupiter.api.Assertions.*;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.kern.parser.Kern;
import io.kern.parser.ParseResult;
import org.junit.jupiter.api.Test;

class AstJsonWriterTest {

  private static JsonObject tree(String source) {
    ParseResult result = Kern.parse(source);
    return AstJsonWriter.toTree(result.program(), result.diagnostics());
  }

  @Test
  void ruleTree() {
    JsonObject root =
        tree("rule Ripe: if crop.age >= 90 and ready(crop) then harvest(crop, 2), done = 1");

    JsonObject rule = root.getAsJsonArray("definitions").get(0).getAsJsonObject();
    assertEquals("RuleDef", rule.get("type").getAsString());
    assertEquals("Ripe", rule.get("name").getAsString());
    assertEquals(1, rule.getAsJsonObject("position").get("line").getAsInt());

    JsonObject condition = rule.getAsJsonObject("condition");
    assertEquals("LogicalExpr", condition.get("type").getAsString());
    assertEquals("and", condition.get("op").getAsString());
    JsonObject left = condition.getAsJsonObject("left");
    assertEquals(">=", left.get("op").getAsString());
    assertEquals("QualifiedRef", left.getAsJsonObject("left").get("type").getAsString());
    assertEquals(90, left.getAsJsonObject("right").get("value").getAsLong());
    assertEquals(
        "PredicateCondition", condition.getAsJsonObject("right").get("type").getAsString());

    JsonArray actions = rule.getAsJsonArray("actions");
    assertEquals(2, actions.size());
    assertEquals("PredicateCall", actions.get(0).getAsJsonObject().get("type").getAsString());
    assertEquals(2, actions.get(0).getAsJsonObject().getAsJsonArray("args").size());
    assertEquals("Assignment", actions.get(1).getAsJsonObject().get("type").getAsString());
  }

  @Test
  void conditionalOmitsMissingElse() {
    JsonObject root = tree("flow F { loop { if a > 1 then break }, halt }");

    JsonObject flow = root.getAsJsonArray("definitions").get(0).getAsJsonObject();
    JsonObject loop = flow.getAsJsonArray("actions").get(0).getAsJsonObject();
    JsonObject cond = loop.getAsJsonArray("actions").get(0).getAsJsonObject();
    assertEquals("Conditional", cond.get("type").getAsString());
    assertTrue(cond.has("then"));
    assertFalse(cond.has("else"));
    JsonObject halt = flow.getAsJsonArray("actions").get(1).getAsJsonObject();
    assertEquals("Halt", halt.get("type").getAsString());
  }

  @Test
  void diagnosticsAreIncluded() {
    JsonObject root = tree("entity { }");

    JsonArray diagnostics = root.getAsJsonArray("diagnostics");
    assertEquals(1, diagnostics.size());
    JsonObject d = diagnostics.get(0).getAsJsonObject();
    assertEquals("UNEXPECTED_TOKEN", d.get("kind").getAsString());
    assertEquals(8, d.getAsJsonObject("position").get("column").getAsInt());
  }

  @Test
  void jsonTextParsesBack() {
    ParseResult result = Kern.parse("entity Farmer { id }\nconstraint C: a < 1");

    String json = AstJsonWriter.toJson(result.program(), result.diagnostics());

    JsonObject root = JsonParser.parseString(json).getAsJsonObject();
    assertEquals(2, root.getAsJsonArray("definitions").size());
    JsonObject entity = root.getAsJsonArray("definitions").get(0).getAsJsonObject();
    assertEquals("id", entity.getAsJsonArray("fields").get(0).getAsString());
    assertTrue(json.contains("\"op\": \"<\""), json);
  }
}
