package io.kern.parser;

import io.kern.ast.KernAst.Program;
import io.kern.syntax.Diagnostic;
import java.util.List;
import java.util.Objects;

/**
 * Result of parsing a source buffer: the (possibly partial) program and the diagnostics found.
 *
 * <p>A program is always present. An empty program is not evidence of success; only an empty
 * diagnostics list is.
 */
public record ParseResult(Program program, List<Diagnostic> diagnostics) {

  public ParseResult {
    Objects.requireNonNull(program, "program");
    diagnostics = List.copyOf(diagnostics);
  }

  public boolean hasErrors() {
    return !diagnostics.isEmpty();
  }
}
