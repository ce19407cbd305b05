package io.kern.cli;

import static org.junit.jupiter.api.Assertions.*;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for the {@code kern} command line.
 *
 * <p>Every invocation passes {@code --config} pointing into the temp directory so a real {@code
 * ~/.kern/kern.properties} cannot change the outcome.
 */
class MainTest {

  private static final String FARM =
      "entity Farmer { id location }\n"
          + "rule CheckFarmer: if farmer.id != 0 then validate(farmer)\n"
          + "flow Season { plant(), loop { water(), if dry == 1 then halt else break } }\n"
          + "constraint ValidLocation: farmer.location != 0\n";

  private static final String BROKEN = "rule Bad: if x then foo()\nflow Good { a() }\n";

  @TempDir Path dir;

  private ByteArrayOutputStream outContent;
  private ByteArrayOutputStream errContent;
  private PrintStream originalOut;
  private PrintStream originalErr;
  private InputStream originalIn;

  @BeforeEach
  void setUp() {
    outContent = new ByteArrayOutputStream();
    errContent = new ByteArrayOutputStream();
    originalOut = System.out;
    originalErr = System.err;
    originalIn = System.in;
    System.setOut(new PrintStream(outContent, true, StandardCharsets.UTF_8));
    System.setErr(new PrintStream(errContent, true, StandardCharsets.UTF_8));
  }

  @AfterEach
  void tearDown() {
    System.setOut(originalOut);
    System.setErr(originalErr);
    System.setIn(originalIn);
  }

  private int execute(String... args) {
    String[] withConfig = new String[args.length + 2];
    System.arraycopy(args, 0, withConfig, 0, args.length);
    if (args.length > 0 && !args[0].startsWith("-")) {
      withConfig[args.length] = "--config";
      withConfig[args.length + 1] = dir.resolve("kern.properties").toString();
      return Main.commandLine().execute(withConfig);
    }
    return Main.commandLine().execute(args);
  }

  private String getOutput() {
    return outContent.toString(StandardCharsets.UTF_8);
  }

  private String getError() {
    return errContent.toString(StandardCharsets.UTF_8);
  }

  private Path write(String name, String content) throws IOException {
    Path file = dir.resolve(name);
    Files.writeString(file, content, StandardCharsets.UTF_8);
    return file;
  }

  // ==================== parse ====================

  @Test
  void parsePrintsOutlineForValidFile() throws IOException {
    Path file = write("farm.kern", FARM);

    int exitCode = execute("parse", file.toString());

    assertEquals(0, exitCode, getError());
    String output = getOutput();
    assertTrue(output.contains("EntityDef Farmer @1:1"), output);
    assertTrue(output.contains("  field location"), output);
    assertTrue(output.contains("RuleDef CheckFarmer @2:1"), output);
    assertTrue(output.contains("call validate(farmer)"), output);
    assertTrue(output.contains("ConstraintDef ValidLocation @4:1"), output);
    assertEquals("", getError());
  }

  @Test
  void parseJsonFormat() throws IOException {
    Path file = write("farm.kern", FARM);

    int exitCode = execute("parse", file.toString(), "--format", "json");

    assertEquals(0, exitCode, getError());
    JsonObject root = JsonParser.parseString(getOutput()).getAsJsonObject();
    assertEquals("Program", root.get("type").getAsString());
    assertEquals(4, root.getAsJsonArray("definitions").size());
    JsonObject rule = root.getAsJsonArray("definitions").get(1).getAsJsonObject();
    assertEquals("RuleDef", rule.get("type").getAsString());
    assertEquals("Comparison", rule.getAsJsonObject("condition").get("type").getAsString());
    assertEquals(0, root.getAsJsonArray("diagnostics").size());
  }

  @Test
  void parseSourceFormatIsCanonical() throws IOException {
    Path file = write("messy.kern", "entity   Farmer{id\nlocation}\nconstraint C:a>1");

    int exitCode = execute("parse", file.toString(), "--format", "SOURCE");

    assertEquals(0, exitCode, getError());
    assertEquals(
        "entity Farmer { id location }\nconstraint C: a > 1\n",
        getOutput().replace("\r\n", "\n"));
  }

  @Test
  void parseReportsDiagnosticsAndKeepsGoodDefinitions() throws IOException {
    Path file = write("bad.kern", BROKEN);

    int exitCode = execute("parse", file.toString());

    assertEquals(1, exitCode);
    String error = getError();
    assertTrue(
        error.contains(file + ":1:16: expected comparison operator, got THEN"), error);
    assertTrue(error.contains("rule Bad: if x then foo()"), error);
    assertTrue(error.contains("               ^"), error);
    assertTrue(getOutput().contains("FlowDef Good @2:1"));
  }

  @Test
  void parseWithoutRecoveryStopsAtFirstError() throws IOException {
    Path file = write("bad.kern", BROKEN);

    int exitCode = execute("parse", file.toString(), "--no-recovery");

    assertEquals(1, exitCode);
    assertFalse(getOutput().contains("FlowDef"));
  }

  @Test
  void parseLimitsPrintedDiagnostics() throws IOException {
    Path file = write("worse.kern", "entity { }\nrule B x\nflow C { }\n");

    int exitCode = execute("parse", file.toString(), "--max-diagnostics", "1");

    assertEquals(1, exitCode);
    String error = getError();
    assertTrue(error.contains("expected IDENTIFIER, got LEFT_BRACE"), error);
    assertFalse(error.contains("expected COLON"), error);
    assertTrue(error.contains("... 2 more diagnostic(s) not shown"), error);
  }

  @Test
  void parseReadsStandardInput() {
    System.setIn(new ByteArrayInputStream("entity A { x }".getBytes(StandardCharsets.UTF_8)));

    int exitCode = execute("parse", "-", "--format", "source");

    assertEquals(0, exitCode, getError());
    assertEquals("entity A { x }", getOutput().strip());
  }

  @Test
  void parseNamesStandardInputInDiagnostics() {
    System.setIn(new ByteArrayInputStream("entity { }".getBytes(StandardCharsets.UTF_8)));

    int exitCode = execute("parse", "-");

    assertEquals(1, exitCode);
    assertTrue(getError().contains("<stdin>:1:8: expected IDENTIFIER, got LEFT_BRACE"));
  }

  @Test
  void parseMissingFileIsUsageError() {
    int exitCode = execute("parse", dir.resolve("nope.kern").toString());

    assertEquals(2, exitCode);
    assertTrue(getError().contains("File not found"), getError());
  }

  @Test
  void parseRejectsUnknownFormat() throws IOException {
    Path file = write("farm.kern", FARM);

    int exitCode = execute("parse", file.toString(), "--format", "yaml");

    assertEquals(2, exitCode);
  }

  @Test
  void subcommandRejectsUnknownOption() throws IOException {
    Path file = write("farm.kern", FARM);

    assertEquals(2, execute("check", "--bogus", file.toString()));
    assertEquals(2, execute("tokens"));
  }

  @Test
  void configFileProvidesDefaults() throws IOException {
    Path file = write("worse.kern", "entity { }\nrule B x\nflow C { }\n");
    write("kern.properties", "maxDiagnostics=2\nformat=json\n");

    int exitCode = execute("parse", file.toString());

    assertEquals(1, exitCode);
    assertTrue(getError().contains("... 1 more diagnostic(s) not shown"), getError());
    assertTrue(getOutput().trim().startsWith("{"), getOutput());
  }

  @Test
  void commandLineOverridesConfigFile() throws IOException {
    Path file = write("farm.kern", FARM);
    write("kern.properties", "format=json\n");

    int exitCode = execute("parse", file.toString(), "--format", "text");

    assertEquals(0, exitCode);
    assertTrue(getOutput().startsWith("EntityDef Farmer"), getOutput());
  }

  @Test
  void brokenConfigFileIsUsageError() throws IOException {
    Path file = write("farm.kern", FARM);
    write("kern.properties", "format=xml\n");

    int exitCode = execute("parse", file.toString());

    assertEquals(2, exitCode);
    assertTrue(getError().startsWith("Error:"), getError());
  }

  // ==================== tokens ====================

  @Test
  void tokensPrintsOneLinePerToken() throws IOException {
    Path file = write("one.kern", "entity Farmer { id }");

    int exitCode = execute("tokens", file.toString());

    assertEquals(0, exitCode, getError());
    String[] lines = getOutput().strip().split("\\R");
    assertEquals(6, lines.length);
    assertTrue(lines[0].matches("1:1\\s+ENTITY"), lines[0]);
    assertTrue(lines[1].matches("1:8\\s+IDENTIFIER\\s+Farmer"), lines[1]);
    assertTrue(lines[5].matches("1:21\\s+EOF"), lines[5]);
  }

  @Test
  void tokensReportsIllegalCharacters() throws IOException {
    Path file = write("bang.kern", "entity test ! invalid");

    int exitCode = execute("tokens", file.toString());

    assertEquals(1, exitCode);
    assertTrue(getOutput().contains("ILLEGAL"));
    assertTrue(getError().contains("did you mean '!='?"), getError());
  }

  // ==================== check ====================

  @Test
  void checkSummarizesEachFile() throws IOException {
    Path ok = write("ok.kern", FARM);
    Path bad = write("bad.kern", BROKEN);

    int exitCode = execute("check", ok.toString(), bad.toString());

    assertEquals(1, exitCode);
    String output = getOutput();
    assertTrue(output.contains(ok + ": ok (4 definition(s))"), output);
    assertTrue(output.contains(bad + ": 1 diagnostic(s), 1 definition(s) parsed"), output);
    assertTrue(output.contains("2 file(s) checked, 1 with diagnostics, 0 unreadable"), output);
    assertTrue(getError().contains("expected comparison operator"));
  }

  @Test
  void checkQuietOmitsDiagnostics() throws IOException {
    Path bad = write("bad.kern", BROKEN);

    int exitCode = execute("check", "-q", bad.toString());

    assertEquals(1, exitCode);
    assertEquals("", getError());
  }

  @Test
  void checkSucceedsWhenAllFilesAreClean() throws IOException {
    Path ok = write("ok.kern", FARM);

    assertEquals(0, execute("check", ok.toString()));
  }

  @Test
  void checkWithUnreadableFileIsUsageError() throws IOException {
    Path ok = write("ok.kern", FARM);

    int exitCode = execute("check", ok.toString(), dir.resolve("missing.kern").toString());

    assertEquals(2, exitCode);
    assertTrue(getOutput().contains("missing.kern: error: File not found"), getOutput());
  }

  // ==================== top level ====================

  @Test
  void bareCommandPrintsUsage() {
    int exitCode = execute();

    assertEquals(2, exitCode);
    assertTrue(getError().contains("Usage: kern"), getError());
  }

  @Test
  void versionOption() {
    int exitCode = execute("--version");

    assertEquals(0, exitCode);
    assertTrue(getOutput().contains("0.1.0"));
  }
}
