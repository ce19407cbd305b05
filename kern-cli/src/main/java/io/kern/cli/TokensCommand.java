package io.kern.cli;

import io.kern.lexer.Lexer;
import io.kern.lexer.Token;
import java.io.IOException;
import java.io.PrintStream;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "tokens",
    description = "Print the token stream of a KERN file",
    mixinStandardHelpOptions = true,
    exitCodeOnInvalidInput = Main.EXIT_USAGE)
public final class TokensCommand implements Callable<Integer> {

  @CommandLine.Mixin CommonOptions common;

  @CommandLine.Parameters(
      index = "0",
      paramLabel = "FILE",
      description = "Source file, or - for stdin")
  String file;

  @Override
  public Integer call() {
    KernConfig config;
    SourceFile source;
    try {
      config = common.resolve();
      source = SourceFile.read(file);
    } catch (IOException | IllegalArgumentException e) {
      System.err.println("Error: " + Main.describe(e));
      return Main.EXIT_USAGE;
    }

    Lexer lexer = new Lexer(source.text());
    PrintStream out = System.out;
    while (lexer.hasNext()) {
      out.println(format(lexer.next()));
    }
    out.flush();

    if (!lexer.diagnostics().isEmpty()) {
      DiagnosticRenderer renderer = new DiagnosticRenderer(source, config.color());
      System.err.print(renderer.renderAll(lexer.diagnostics(), config.maxDiagnostics()));
      System.err.flush();
      return Main.EXIT_DIAGNOSTICS;
    }
    return Main.EXIT_OK;
  }

  /** {@code line:column  KIND  payload}, e.g. {@code 1:8     IDENTIFIER     Farmer}. */
  static String format(Token token) {
    String payload =
        switch (token.kind().payloadType()) {
          case TEXT -> token.kind().isKeyword() ? "" : token.text();
          case INTEGER -> Long.toString(token.number());
          case NONE -> "";
        };
    String line = String.format("%-8s %-14s %s", token.position(), token.kind(), payload);
    return line.stripTrailing();
  }
}
