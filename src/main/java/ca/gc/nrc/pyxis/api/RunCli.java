package ca.gc.nrc.pyxis.api;

import ca.gc.nrc.pyxis.application.module.PipelineModule;
import ca.gc.nrc.pyxis.application.pipeline.ModuleRunRecord;
import ca.gc.nrc.pyxis.application.pipeline.Pipeline;
import ca.gc.nrc.pyxis.application.pipeline.RunReport;
import ca.gc.nrc.pyxis.application.port.PipelineListener;
import ca.gc.nrc.pyxis.config.CompositionRoot;
import ca.gc.nrc.pyxis.config.ConfigDefaults;
import ca.gc.nrc.pyxis.config.ConfigFileBootstrap;
import ca.gc.nrc.pyxis.config.ConfigMerger;
import ca.gc.nrc.pyxis.config.PipelineConfig;
import ca.gc.nrc.pyxis.config.YamlConfigLoader;
import ca.gc.nrc.pyxis.domain.error.DuplicateNameException;
import ca.gc.nrc.pyxis.domain.error.MissingInputException;
import ca.gc.nrc.pyxis.domain.error.ModuleExecutionException;
import ca.gc.nrc.pyxis.domain.error.ModuleParameterException;
import ca.gc.nrc.pyxis.domain.error.StorageException;
import ca.gc.nrc.pyxis.infrastructure.recipe.ModuleFactory;
import ca.gc.nrc.pyxis.infrastructure.recipe.ModuleSpec;
import ca.gc.nrc.pyxis.infrastructure.recipe.RecipeLoader;
import ca.gc.nrc.pyxis.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code pyxis run}: builds a pipeline from a recipe and runs it against the container of a working directory.
 */
public final class RunCli {
  private static final Logger log = LoggerFactory.getLogger(RunCli.class);
  private static final String COMMAND = "run";
  private static final String SUMMARY_USAGE =
      "usage: pyxis run workDir=DIR recipe=FILE [config=FILE] [chunkFrames=N] [--dry-run] [--verbose]";
  private static final String HELP_TEXT = """
      PYXIS pipeline run

      Usage:
        pyxis run workDir=./reduction recipe=./recipe.yaml [options]

      Required:
        workDir=DIR               Working directory holding pyxis.yaml and the storage container
        recipe=FILE               Recipe YAML listing the modules to run in order

      Optional:
        config=FILE               Configuration file (default: workDir/pyxis.yaml, created when missing)
        inputDir=DIR              Directory reading modules import from (default: workDir)
        outputDir=DIR             Directory writing modules export into (default: workDir)
        storageFile=NAME          Container directory name (default: pyxis_database.n5)
        chunkFrames=N             Frames per chunk; 0 processes all frames at once (default: 1000)
        memoryBudgetMiB=N         Memory budget bounding chunks (default: 512)
        settings.KEY=VALUE        Pipeline-wide setting, e.g. settings.PIXSCALE=0.027
        metricsExporter=otlp|none Metrics export (default: none)
        otelEndpoint=URL          OTLP endpoint when metricsExporter=otlp
        otelResourceAttributes=K=V,...  Extra OpenTelemetry resource attributes
        --dry-run                 Validate configuration and recipe, print the plan, run nothing
        --verbose                 Enable DEBUG logging
        --help                    Show this message

      Exit codes: 0 success, 2 invalid arguments, 3 I/O, 4 configuration, 5 module failure.
      """;

  private RunCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Runs the command without terminating the JVM.
   *
   * @param args command arguments (without the {@code run} token)
   * @return exit code
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    Set<String> unknownFlags = input.unknownFlags(Set.of("--dry-run"));
    if (!unknownFlags.isEmpty()) {
      log.error("Unknown flags: {}", unknownFlags);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> kv;
    Path workDir;
    Path recipePath;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      workDir = ConfigCliUtils.requirePath("workDir", kv.get("workDir")).toAbsolutePath().normalize();
      recipePath = ConfigCliUtils.requirePath("recipe", kv.remove("recipe"));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    kv.put("workDir", workDir.toString());
    if (!Files.isRegularFile(recipePath)) {
      log.error("Recipe file does not exist: {}", recipePath);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String configArg = ConfigCliUtils.extractConfigPath(kv);
    Path configPath;
    Optional<Map<String, String>> yaml;
    try {
      if (configArg == null) {
        configPath = ConfigFileBootstrap.ensureConfigFile(workDir);
      } else {
        configPath = ConfigCliUtils.requirePath("config", configArg);
        if (!Files.exists(configPath)) {
          log.error("Configuration file does not exist: {}", configPath);
          CliPrinter.println(SUMMARY_USAGE);
          return ExitCode.INVALID_ARGS;
        }
      }
      yaml = YamlConfigLoader.load(configPath, COMMAND);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid YAML configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to prepare configuration in {}", workDir, ex);
      return ExitCode.IO_ERROR;
    }

    boolean exportMetrics;
    PipelineConfig config;
    boolean dryRun;
    try {
      Map<String, String> effective = new LinkedHashMap<>(ConfigMerger.buildEffectiveConfig(
          COMMAND, yaml, kv, ConfigDefaults.asFlatMap(COMMAND), log::warn));
      dryRun = input.hasFlag("--dry-run") || ConfigCliUtils.parseBoolean(effective, "dryRun");
      exportMetrics = TelemetryConfigurator.configureMetrics(effective);
      config = PipelineConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    List<PipelineModule> modules;
    try {
      List<ModuleSpec> specs = RecipeLoader.load(recipePath);
      modules = new ModuleFactory().createAll(specs);
    } catch (IllegalArgumentException | ModuleParameterException ex) {
      log.error("Invalid recipe {}: {}", recipePath, ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read recipe {}", recipePath, ex);
      return ExitCode.IO_ERROR;
    }

    log.info("Configured run: workDir={}, storage={}, chunkFrames={}, modules={}, metricsExporter={}",
        config.workDir(), config.storagePath(), config.chunkFrames(), modules.size(),
        exportMetrics ? "otlp" : "none");
    try (CompositionRoot root = new CompositionRoot(config, exportMetrics);
        Pipeline pipeline = root.pipeline(new ProgressPrinter(modules.size()))) {
      for (PipelineModule module : modules) {
        pipeline.addModule(module);
      }
      if (dryRun) {
        pipeline.validate();
        printPlan(config, modules);
        return ExitCode.SUCCESS;
      }
      RunReport report = pipeline.runAll();
      printReport(report);
      return ExitCode.SUCCESS;
    } catch (MissingInputException | DuplicateNameException ex) {
      log.error("Recipe does not validate: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (ModuleExecutionException ex) {
      log.error("Run aborted: {}", ex.getMessage());
      return ExitCode.RUNTIME_FAILURE;
    } catch (StorageException ex) {
      log.error("Storage failure on {}: {}", config.storagePath(), ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid module declaration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void printPlan(PipelineConfig config, List<PipelineModule> modules) {
    CliPrinter.println("Dry run: pipeline validated against " + config.storagePath());
    int position = 1;
    for (PipelineModule module : modules) {
      CliPrinter.printf("  %d. %-20s %-10s in=%s out=%s", position++, module.name(), module.kind(),
          module.inputs().values(), module.outputs().values());
    }
  }

  private static void printReport(RunReport report) {
    CliPrinter.printf("Completed %d modules in %d ms", report.records().size(), report.durationMillis());
    for (ModuleRunRecord record : report.records()) {
      CliPrinter.printf("  %-20s %-10s %8d ms %10d frames %14d bytes", record.name(), record.kind(),
          record.durationMillis(), record.framesWritten(), record.bytesWritten());
    }
  }

  /** Prints one progress line per module. */
  static final class ProgressPrinter implements PipelineListener {
    private final int total;
    private int started;

    ProgressPrinter(int total) {
      this.total = total;
    }

    @Override
    public void moduleStarted(String moduleName) {
      started++;
      CliPrinter.printf("[%d/%d] %s", started, total, moduleName);
    }

    @Override
    public void moduleFailed(String moduleName, Throwable failure) {
      CliPrinter.printf("[%d/%d] %s FAILED: %s", started, total, moduleName, failure.getMessage());
    }
  }
}
