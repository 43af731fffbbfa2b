package ca.gc.nrc.pyxis.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class RunCliTest {
  private static final String SELECTION_RECIPE = String.join("\n",
      "modules:",
      "  - type: synthetic",
      "    name: gen",
      "    output: raw",
      "    frames: 10",
      "    frameShape: 4x4",
      "    step: 1",
      "  - type: select",
      "    name: pick",
      "    input: raw",
      "    output: selected",
      "    indices: [0, 9]",
      "");

  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Level originalLevel;
  private boolean originalAdditive;
  private String previousExporter;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(RunCli.class);
    originalLevel = logger.getLevel();
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    previousExporter = System.getProperty("otel.metrics.exporter");
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    if (logger != null && appender != null) {
      logger.detachAppender(appender);
      appender.stop();
      logger.setAdditive(originalAdditive);
      logger.setLevel(originalLevel);
    }
    CliPrinter.clearTestWriter();
    if (previousExporter == null) {
      System.clearProperty("otel.metrics.exporter");
    } else {
      System.setProperty("otel.metrics.exporter", previousExporter);
    }
  }

  private Path recipe(String text) throws IOException {
    Path recipe = tempDir.resolve("recipe.yaml");
    Files.writeString(recipe, text);
    return recipe;
  }

  private ExitCode run(Path recipe, String... extra) {
    String[] args = new String[extra.length + 2];
    args[0] = "workDir=" + tempDir.resolve("work");
    args[1] = "recipe=" + recipe;
    System.arraycopy(extra, 0, args, 2, extra.length);
    return RunCli.run(args);
  }

  private boolean logged(Level level, String text) {
    return appender.list.stream()
        .anyMatch(event -> event.getLevel() == level && event.getFormattedMessage().contains(text));
  }

  @Test
  void runsRecipeAndReportsProgress() throws IOException {
    ExitCode code = run(recipe(SELECTION_RECIPE), "chunkFrames=3");

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.contains("[1/2] gen"));
    assertTrue(out.contains("[2/2] pick"));
    assertTrue(out.contains("Completed 2 modules in"));
    assertTrue(Files.exists(tempDir.resolve("work").resolve("pyxis.yaml")));
    assertTrue(Files.isDirectory(tempDir.resolve("work").resolve("pyxis_database.n5")));
  }

  @Test
  void dryRunValidatesWithoutRunningModules() throws IOException {
    ExitCode code = run(recipe(SELECTION_RECIPE), "--dry-run");

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.contains("Dry run: pipeline validated against"));
    assertTrue(out.contains("pick"));
    assertFalse(out.contains("[1/2] gen"));
  }

  @Test
  void missingRecipeArgumentIsInvalid() {
    ExitCode code = RunCli.run(new String[] {"workDir=" + tempDir});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: pyxis run"));
    assertTrue(logged(Level.ERROR, "recipe is required"));
  }

  @Test
  void nonexistentRecipeIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, run(tempDir.resolve("absent.yaml")));
  }

  @Test
  void unknownFlagIsInvalid() throws IOException {
    assertEquals(ExitCode.INVALID_ARGS, run(recipe(SELECTION_RECIPE), "--fast"));
    assertTrue(logged(Level.ERROR, "Unknown flags"));
  }

  @Test
  void missingExplicitConfigIsInvalid() throws IOException {
    assertEquals(ExitCode.INVALID_ARGS, run(recipe(SELECTION_RECIPE), "config=" + tempDir.resolve("none.yaml")));
  }

  @Test
  void malformedConfigIsConfigError() throws IOException {
    Path config = tempDir.resolve("bad.yaml");
    Files.writeString(config, "common: [unclosed\n");

    assertEquals(ExitCode.CONFIG_ERROR, run(recipe(SELECTION_RECIPE), "config=" + config));
  }

  @Test
  void unknownModuleTypeIsConfigError() throws IOException {
    ExitCode code = run(recipe("modules:\n  - type: flatField\n    name: ff\n"));

    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertTrue(logged(Level.ERROR, "Unknown module type 'flatField'"));
  }

  @Test
  void unsatisfiedInputIsConfigError() throws IOException {
    ExitCode code = run(recipe(String.join("\n",
        "modules:",
        "  - type: scale",
        "    name: gain",
        "    input: calibrated",
        "    factor: 2",
        "")));

    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertTrue(logged(Level.ERROR, "calibrated"));
  }

  @Test
  void duplicateModuleNameIsConfigError() throws IOException {
    ExitCode code = run(recipe(String.join("\n",
        "modules:",
        "  - {type: synthetic, name: gen, output: a, frames: 1, frameShape: 2}",
        "  - {type: synthetic, name: gen, output: b, frames: 1, frameShape: 2}",
        "")));

    assertEquals(ExitCode.CONFIG_ERROR, code);
  }

  @Test
  void moduleFailureIsRuntimeFailure() throws IOException {
    ExitCode code = run(recipe(String.join("\n",
        "modules:",
        "  - {type: synthetic, name: gen, output: raw, frames: 2, frameShape: 2}",
        "  - {type: select, name: pick, input: raw, output: selected, indices: [5]}",
        "")));

    assertEquals(ExitCode.RUNTIME_FAILURE, code);
    assertTrue(buffer.toString().contains("pick FAILED"));
    assertTrue(logged(Level.ERROR, "Run aborted"));
  }

  @Test
  void invalidMetricsExporterIsConfigError() throws IOException {
    assertEquals(ExitCode.CONFIG_ERROR, run(recipe(SELECTION_RECIPE), "metricsExporter=statsd"));
  }
}
