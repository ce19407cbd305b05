package io.kern.cli;

import io.kern.parser.Kern;
import io.kern.parser.ParseResult;
import io.kern.parser.ParserOptions;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

@CommandLine.Command(
    name = "check",
    description = "Check one or more KERN files and summarize the result",
    mixinStandardHelpOptions = true,
    exitCodeOnInvalidInput = Main.EXIT_USAGE)
public final class CheckCommand implements Callable<Integer> {

  private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

  @CommandLine.Mixin CommonOptions common;

  @CommandLine.Parameters(
      arity = "1..*",
      paramLabel = "FILE",
      description = "Source files, - for stdin")
  List<String> files;

  @CommandLine.Option(
      names = {"-q", "--quiet"},
      description = "Print only the summary lines, not the diagnostics")
  boolean quiet;

  @Override
  public Integer call() {
    KernConfig config;
    try {
      config = common.resolve();
    } catch (IOException | IllegalArgumentException e) {
      System.err.println("Error: " + Main.describe(e));
      return Main.EXIT_USAGE;
    }
    ParserOptions options = ParserOptions.defaults().withRecovery(config.recovery());

    int failed = 0;
    int unreadable = 0;
    for (String file : files) {
      SourceFile source;
      try {
        source = SourceFile.read(file);
      } catch (IOException e) {
        System.out.println(file + ": error: " + Main.describe(e));
        log.debug("Cannot read {}", file, e);
        unreadable++;
        continue;
      }

      ParseResult result = Kern.parse(source.text(), options);
      int definitions = result.program().definitions().size();
      if (!result.hasErrors()) {
        System.out.println(source.name() + ": ok (" + definitions + " definition(s))");
        continue;
      }
      failed++;
      System.out.println(
          source.name()
              + ": "
              + result.diagnostics().size()
              + " diagnostic(s), "
              + definitions
              + " definition(s) parsed");
      if (!quiet) {
        DiagnosticRenderer renderer = new DiagnosticRenderer(source, config.color());
        System.err.print(renderer.renderAll(result.diagnostics(), config.maxDiagnostics()));
      }
    }

    System.out.println(
        files.size() + " file(s) checked, " + failed + " with diagnostics, " + unreadable
            + " unreadable");
    System.out.flush();
    System.err.flush();
    if (unreadable > 0) {
      return Main.EXIT_USAGE;
    }
    return failed > 0 ? Main.EXIT_DIAGNOSTICS : Main.EXIT_OK;
  }
}
