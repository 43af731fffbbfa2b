package ca.gc.nrc.pyxis.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class ConfigFileBootstrapTest {

  @TempDir Path tempDir;

  private Logger logger;
  private ListAppender<ILoggingEvent> appender;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(ConfigFileBootstrap.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
  }

  @Test
  void createsMissingFileWithDefaultsAndWarns() throws Exception {
    Path workDir = tempDir.resolve("run1");

    Path file = ConfigFileBootstrap.ensureConfigFile(workDir);

    assertEquals(workDir.resolve("pyxis.yaml"), file);
    assertTrue(Files.exists(file));
    Map<String, String> loaded = YamlConfigLoader.load(file, "run").orElseThrow();
    assertEquals("1000", loaded.get("chunkFrames"));
    assertEquals("0.027", loaded.get("settings.PIXSCALE"));
    assertEquals("none", loaded.get("metricsExporter"));
    assertTrue(appender.list.stream().anyMatch(e -> e.getLevel() == Level.WARN
        && e.getFormattedMessage().contains("was missing")));
  }

  @Test
  void leavesExistingFileUntouched() throws Exception {
    Path file = tempDir.resolve("pyxis.yaml");
    Files.writeString(file, "common:\n  chunkFrames: 7\n");

    ConfigFileBootstrap.ensureConfigFile(tempDir);

    assertEquals("common:\n  chunkFrames: 7\n", Files.readString(file));
    assertTrue(appender.list.isEmpty());
  }
}
