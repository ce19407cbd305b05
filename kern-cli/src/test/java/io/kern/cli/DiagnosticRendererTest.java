package io.kern.cli;

import static org.junit.jupiter.api.Assertions.*;

import io.kern.parser.Kern;
import io.kern.syntax.Diagnostic;
import io.kern.syntax.SourcePosition;
import java.util.List;
import org.junit.jupiter.api.Test;

class DiagnosticRendererTest {

  private static List<String> lines(String rendered) {
    return List.of(rendered.split("\\R", -1));
  }

  @Test
  void rendersLocationSourceLineAndCaret() {
    SourceFile source = new SourceFile("farm.kern", "entity A { }\nrule B x\n");
    Diagnostic d = Kern.parse(source.text()).diagnostics().get(0);

    List<String> out = lines(new DiagnosticRenderer(source, false).render(d));

    assertEquals(
        List.of("farm.kern:2:8: expected COLON, got IDENTIFIER", "rule B x", "       ^"), out);
  }

  @Test
  void caretKeepsTabs() {
    SourceFile source = new SourceFile("t.kern", "\tentity {");
    Diagnostic d = Kern.parse(source.text()).diagnostics().get(0);

    List<String> out = lines(new DiagnosticRenderer(source, false).render(d));

    assertEquals("\t       ^", out.get(2));
  }

  @Test
  void endOfFileAfterTrailingNewlinePointsAtEmptyLine() {
    SourceFile source = new SourceFile("eof.kern", "entity A {\n");
    Diagnostic d = Kern.parse(source.text()).diagnostics().get(0);

    List<String> out = lines(new DiagnosticRenderer(source, false).render(d));

    assertEquals("eof.kern:2:1: expected RIGHT_BRACE, got EOF", out.get(0));
    assertEquals("", out.get(1));
    assertEquals("^", out.get(2));
  }

  @Test
  void windowsLineEndingsAreNotEchoed() {
    SourceFile source = new SourceFile("w.kern", "entity A { }\r\nrule B x\r\n");
    Diagnostic d = Kern.parse(source.text()).diagnostics().get(0);

    List<String> out = lines(new DiagnosticRenderer(source, false).render(d));

    assertEquals("rule B x", out.get(1));
  }

  @Test
  void colorWrapsLocationInAnsiEscapes() {
    SourceFile source = new SourceFile("c.kern", "x");
    Diagnostic d =
        new Diagnostic(Diagnostic.Kind.UNEXPECTED_TOKEN, "boom", SourcePosition.START);

    String plain = new DiagnosticRenderer(source, false).render(d);
    String colored = new DiagnosticRenderer(source, true).render(d);

    assertFalse(plain.contains("\u001B["));
    assertTrue(colored.contains("\u001B["));
    assertTrue(colored.contains("boom"));
  }

  @Test
  void renderAllTruncates() {
    SourceFile source = new SourceFile("m.kern", "entity { }\nrule B x\nflow C { }\n");
    List<Diagnostic> diagnostics = Kern.parse(source.text()).diagnostics();
    DiagnosticRenderer renderer = new DiagnosticRenderer(source, false);

    String one = renderer.renderAll(diagnostics, 1);
    String all = renderer.renderAll(diagnostics, 0);

    assertTrue(one.contains("m.kern:1:8:"));
    assertFalse(one.contains("m.kern:2:8:"));
    assertTrue(one.contains("... 2 more diagnostic(s) not shown"));
    assertTrue(all.contains("m.kern:3:10:"));
    assertFalse(all.contains("more diagnostic(s)"));
  }
}
