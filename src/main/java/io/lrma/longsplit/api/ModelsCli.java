package io.lrma.longsplit.api;

import io.lrma.longsplit.config.ArrayElementStructureLoader;
import io.lrma.longsplit.config.ArrayModels;
import io.lrma.longsplit.domain.split.ArrayElementStructure;
import io.lrma.longsplit.logging.LoggingConfigurator;
import io.lrma.longsplit.validation.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists the built-in array models, or validates and prints a template file.
 *
 * @since 0.1.0
 */
public final class ModelsCli {
  private static final Logger log = LoggerFactory.getLogger(ModelsCli.class);
  private static final String SUMMARY_USAGE = "usage: models [name=MODEL] [templateFile=PATH]";
  private static final String HELP_TEXT = """
      longsplit models

      Usage:
        models                   List built-in array models
        models name=mas15        Print the elements of one model
        models templateFile=PATH Validate a YAML array layout and print its elements

      Flags:
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private ModelsCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String template = kv.getOrDefault("templateFile", "");
    String name = kv.getOrDefault("name", "");
    if (input.command().isPresent() || (!template.isEmpty() && !name.isEmpty())) {
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try {
      if (!template.isEmpty()) {
        Path path = Paths.validateReadableFile("templateFile", Path.of(template));
        CliPrinter.printLines(describe(path.toString(), ArrayElementStructureLoader.load(path)));
      } else if (!name.isEmpty()) {
        CliPrinter.printLines(describe(name, ArrayModels.get(name)));
      } else {
        for (String model : ArrayModels.names()) {
          ArrayElementStructure structure = ArrayModels.get(model);
          String marker = model.equals(ArrayModels.DEFAULT_MODEL) ? " (default)" : "";
          CliPrinter.println(model + marker + ": " + structure.size() + " elements");
        }
      }
      return ExitCode.SUCCESS;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid array layout: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read template file {}", template, ex);
      return ExitCode.IO_ERROR;
    }
  }

  static String[] describe(String label, ArrayElementStructure structure) {
    List<String> lines = new ArrayList<>();
    lines.add(label + ": " + structure.size() + " elements");
    for (int i = 0; i < structure.size(); i++) {
      lines.add(String.format(" %2d  %s", i, String.join(" ", structure.element(i))));
    }
    return lines.toArray(String[]::new);
  }
}
