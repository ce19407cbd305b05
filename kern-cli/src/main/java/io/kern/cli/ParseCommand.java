package io.kern.cli;

import io.kern.ast.AstPrinter;
import io.kern.cli.KernConfig.OutputFormat;
import io.kern.parser.Kern;
import io.kern.parser.ParseResult;
import io.kern.parser.ParserOptions;
import java.io.IOException;
import java.io.PrintStream;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

@CommandLine.Command(
    name = "parse",
    description = "Parse a KERN file and print its AST",
    mixinStandardHelpOptions = true,
    exitCodeOnInvalidInput = Main.EXIT_USAGE)
public final class ParseCommand implements Callable<Integer> {

  private static final Logger log = LoggerFactory.getLogger(ParseCommand.class);

  @CommandLine.Mixin CommonOptions common;

  @CommandLine.Parameters(
      index = "0",
      paramLabel = "FILE",
      description = "Source file, or - for stdin")
  String file;

  @CommandLine.Option(
      names = {"--format"},
      paramLabel = "FORMAT",
      description = "AST output: ${COMPLETION-CANDIDATES} (default: text)")
  OutputFormat format;

  @CommandLine.Option(
      names = {"--no-recovery"},
      description = "Stop at the first malformed definition")
  boolean noRecovery;

  @CommandLine.Option(
      names = {"--max-diagnostics"},
      paramLabel = "N",
      description = "Print at most N diagnostics, 0 for all")
  Integer maxDiagnostics;

  @Override
  public Integer call() {
    KernConfig config;
    SourceFile source;
    try {
      config = applyOverrides(common.resolve());
      source = SourceFile.read(file);
    } catch (IOException | IllegalArgumentException e) {
      System.err.println("Error: " + Main.describe(e));
      return Main.EXIT_USAGE;
    }

    ParseResult result =
        Kern.parse(source.text(), ParserOptions.defaults().withRecovery(config.recovery()));
    log.debug(
        "{}: {} definition(s), {} diagnostic(s)",
        source.name(),
        result.program().definitions().size(),
        result.diagnostics().size());

    PrintStream out = System.out;
    switch (config.format()) {
      case JSON -> out.println(AstJsonWriter.toJson(result.program(), result.diagnostics()));
      case SOURCE -> out.print(AstPrinter.print(result.program()));
      case TEXT -> out.print(AstTreeWriter.write(result.program()));
    }
    out.flush();

    if (result.hasErrors()) {
      DiagnosticRenderer renderer = new DiagnosticRenderer(source, config.color());
      System.err.print(renderer.renderAll(result.diagnostics(), config.maxDiagnostics()));
      System.err.flush();
      return Main.EXIT_DIAGNOSTICS;
    }
    return Main.EXIT_OK;
  }

  private KernConfig applyOverrides(KernConfig config) {
    KernConfig resolved = config;
    if (format != null) {
      resolved = resolved.withFormat(format);
    }
    if (noRecovery) {
      resolved = resolved.withRecovery(false);
    }
    if (maxDiagnostics != null) {
      resolved = resolved.withMaxDiagnostics(maxDiagnostics);
    }
    return resolved;
  }
}
