package io.kern.cli;

import io.kern.syntax.Diagnostic;
import java.util.List;
import picocli.CommandLine.Help.Ansi;

/**
 * Formats diagnostics the way compilers do:
 *
 * <pre>
 * farm.kern:2:8: expected COLON, got IDENTIFIER
 * rule B x
 *        ^
 * </pre>
 */
final class DiagnosticRenderer {

  private final String sourceName;
  private final String[] lines;
  private final Ansi ansi;

  DiagnosticRenderer(SourceFile source, boolean color) {
    this.sourceName = source.name();
    this.lines = source.text().split("\r?\n", -1);
    this.ansi = color ? Ansi.ON : Ansi.OFF;
  }

  String render(Diagnostic diagnostic) {
    String location = sourceName + ":" + diagnostic.line() + ":" + diagnostic.column() + ":";
    String line = sourceLine(diagnostic.line());
    StringBuilder sb = new StringBuilder();
    sb.append(ansi.string("@|bold " + location + "|@"))
        .append(' ')
        .append(ansi.string("@|red " + escape(diagnostic.message()) + "|@"))
        .append(System.lineSeparator())
        .append(line)
        .append(System.lineSeparator())
        .append(caretPrefix(line, diagnostic.column()))
        .append(ansi.string("@|green ^|@"));
    return sb.toString();
  }

  /**
   * Renders up to {@code max} diagnostics ({@code 0} for all), followed by a count of the ones left
   * out.
   */
  String renderAll(List<Diagnostic> diagnostics, int max) {
    int shown = max == 0 ? diagnostics.size() : Math.min(max, diagnostics.size());
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < shown; i++) {
      sb.append(render(diagnostics.get(i))).append(System.lineSeparator());
    }
    int hidden = diagnostics.size() - shown;
    if (hidden > 0) {
      sb.append("... ").append(hidden).append(" more diagnostic(s) not shown")
          .append(System.lineSeparator());
    }
    return sb.toString();
  }

  private String sourceLine(int line) {
    // EOF diagnostics after a trailing newline point one past the last line
    return line <= lines.length ? lines[line - 1] : "";
  }

  // keeps tabs so the caret lines up under the offending column
  private static String caretPrefix(String line, int column) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < column - 1; i++) {
      sb.append(i < line.length() && line.charAt(i) == '\t' ? '\t' : ' ');
    }
    return sb.toString();
  }

  // picocli markup would swallow "|@" sequences in messages
  private static String escape(String message) {
    return message.replace("@|", "@ |");
  }
}
