package io.lrma.longsplit.api;

import io.lrma.longsplit.application.pipeline.SegmentationSummary;
import io.lrma.longsplit.application.pipeline.SegmentationUseCase;
import io.lrma.longsplit.config.CompositionRoot;
import io.lrma.longsplit.config.ConfigMerger;
import io.lrma.longsplit.config.DefaultsForMode;
import io.lrma.longsplit.config.SegmentConfig;
import io.lrma.longsplit.config.YamlConfigLoader;
import io.lrma.longsplit.domain.segment.SegmentAnnotationException;
import io.lrma.longsplit.domain.split.ArrayElementStructure;
import io.lrma.longsplit.infrastructure.metrics.OpenTelemetryBootstrap;
import io.lrma.longsplit.infrastructure.sam.ProgramInfo;
import io.lrma.longsplit.logging.LoggingConfigurator;
import io.lrma.longsplit.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for splitting annotated array reads into their array elements.
 *
 * @since 0.1.0
 */
public final class SegmentCli {
  private static final Logger log = LoggerFactory.getLogger(SegmentCli.class);
  private static final String MODE = "segment";
  private static final Set<String> OUTPUT_EXTENSIONS = Set.of(".bam", ".sam");
  private static final String SUMMARY_USAGE =
      "usage: segment in=READS.bam out=ELEMENTS.bam [threads=N] [simple=true|false] "
          + "[keepDelimiters=true|false] [model=mas15|mas10] [templateFile=PATH] [segmentsTag=SG] "
          + "[progressInterval=N] [config=PATH] [--simple] [--keep-delimiters] [--dry-run] [--allow-overwrite] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      longsplit segment

      Splits annotated MAS-seq array reads into one unaligned record per array element.

      Usage:
        segment in=annotated.bam out=elements.bam [options]

      Required:
        in=PATH                  SAM/BAM of reads annotated with segment tags
        out=PATH                 SAM/BAM receiving array elements (.bam or .sam)

      Optional:
        threads=N                Worker threads (default: processors - 1; <=0 or too many means all)
        simple=true|false        Split on adjacent delimiter pairs instead of bounded regions (default false)
        keepDelimiters=true|false  Keep delimiter bases in emitted elements (default false)
        --simple                 Same as simple=true
        --keep-delimiters        Same as keepDelimiters=true
        model=NAME               Built-in array model (default mas15; see 'models')
        templateFile=PATH        YAML array layout; overrides model
        segmentsTag=XX           Tag holding segment annotations (default SG)
        progressInterval=N       Reads between progress lines; 0 disables (default 10000)
        config=PATH              YAML file with 'common' and 'segment' sections
        --dry-run                Validate inputs and print the plan without reading records
        --allow-overwrite        Replace an existing output file
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --verbose                Enable DEBUG logging
        --help                   Show this message

      Exit codes:
        0 success, 2 invalid arguments, 3 I/O failure, 4 configuration error,
        5 runtime failure, 6 read missing or carrying a malformed segment tag
      """;

  private SegmentCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the segment command.
   *
   * @param args arguments following the {@code segment} subcommand
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for segment CLI");
    }
    if (input.command().isPresent()) {
      log.error("Unexpected argument: {}", input.command().get());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String configPath = ConfigCliUtils.extractConfigPath(kv);
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, MODE);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    Map<String, String> effective;
    try {
      effective = ConfigMerger.buildEffectiveConfig(
          MODE, yamlConfig, kv, DefaultsForMode.asFlatMap(MODE), log::warn);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid segment arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (!input.verbose() && ConfigCliUtils.parseBoolean(effective, "verbose")) {
      LoggingConfigurator.enableVerboseLogging();
    }
    boolean dryRun = ConfigCliUtils.flagOrKey(input, "--dry-run", effective, "dryRun");
    boolean allowOverwrite = ConfigCliUtils.flagOrKey(input, "--allow-overwrite", effective, "allowOverwrite");

    Map<String, String> configInputs = new LinkedHashMap<>(effective);
    configInputs.put("dryRun", Boolean.toString(dryRun));
    configInputs.put("allowOverwrite", Boolean.toString(allowOverwrite));
    if (input.hasFlag("--simple")) {
      configInputs.put("simple", "true");
    }
    if (input.hasFlag("--keep-delimiters")) {
      configInputs.put("keepDelimiters", "true");
    }

    SegmentConfig config;
    TelemetryConfigurator.TelemetrySettings telemetry;
    try {
      telemetry = TelemetryConfigurator.extract(configInputs);
      config = SegmentConfig.fromMap(configInputs);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid segment arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    ValidatedPaths validated;
    ArrayElementStructure structure;
    try {
      validated = validatePaths(config);
      structure = CompositionRoot.structure(config);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid segment configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read array template {}", config.templateFile().orElse(null), ex);
      return ExitCode.IO_ERROR;
    }

    if (config.dryRun()) {
      printDryRunPlan(config, validated, structure, telemetry);
      return ExitCode.SUCCESS;
    }

    TelemetryConfigurator.configureMetrics(new LinkedHashMap<>(effective));
    ProgramInfo program = new ProgramInfo(
        "longsplit",
        OpenTelemetryBootstrap.detectServiceVersion(),
        MODE,
        "Split array reads into array elements",
        commandLine(args));

    try (CompositionRoot root = new CompositionRoot()) {
      log.info(
          "Configured segment pipeline: input={}, output={}, mode={}, layout={}, workers={}, metricsExporter={}",
          validated.input(),
          validated.output(),
          config.splitMode(),
          config.templateFile().map(Path::toString).orElse(config.model()),
          config.effectiveWorkers(),
          telemetry.exporter().orElse("<environment>"));
      SegmentationUseCase useCase = root.segmentUseCase(config, program);
      SegmentationSummary summary = useCase.run();
      log.info(
          "Segment pipeline completed: {} reads, {} elements, {} reads without boundaries written to {}",
          summary.readsProcessed(),
          summary.elementsWritten(),
          summary.readsWithoutBoundaries(),
          validated.output());
      return ExitCode.SUCCESS;
    } catch (SegmentAnnotationException ex) {
      log.error("Input read {} has unusable segment annotations: {}", ex.readName(), ex.getMessage());
      return ExitCode.INVALID_INPUT;
    } catch (IllegalArgumentException ex) {
      log.error("Segment configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Segment pipeline I/O failure while processing {}", validated.input(), ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Segment pipeline interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in segment pipeline", ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (Exception ex) {
      log.error("Unexpected checked exception in segment pipeline", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static ValidatedPaths validatePaths(SegmentConfig config) {
    Path input = Paths.validateReadableFile("in", config.input());
    Path output = Paths.validateOutputFile("out", config.output(), OUTPUT_EXTENSIONS, config.allowOverwrite());
    config.templateFile().ifPresent(template -> Paths.validateReadableFile("templateFile", template));
    return new ValidatedPaths(input, output);
  }

  private static String commandLine(String[] args) {
    StringBuilder sb = new StringBuilder("longsplit ").append(MODE);
    if (args != null) {
      for (String arg : args) {
        if (arg != null && !arg.isBlank()) {
          sb.append(' ').append(arg.trim());
        }
      }
    }
    return sb.toString();
  }

  private static void printDryRunPlan(
      SegmentConfig config,
      ValidatedPaths paths,
      ArrayElementStructure structure,
      TelemetryConfigurator.TelemetrySettings telemetry) {
    CliPrinter.printLines(
        "Segment dry-run: no records will be read or written.",
        " Input file        : " + paths.input(),
        " Output file       : " + paths.output(),
        " Split mode        : " + config.splitMode(),
        " Array layout      : " + config.templateFile().map(Path::toString).orElse(config.model())
            + " (" + structure.size() + " elements)",
        " Keep delimiters   : " + config.keepDelimiters(),
        " Segments tag      : " + config.segmentsTag(),
        " Worker threads    : " + config.effectiveWorkers(),
        " Progress interval : " + config.progressInterval(),
        " Allow overwrite   : " + config.allowOverwrite(),
        " Metrics exporter  : " + telemetry.exporter().orElse("<environment>"),
        " Re-run without --dry-run to split reads.");
  }

  private record ValidatedPaths(Path input, Path output) {}
}
