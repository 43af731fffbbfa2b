package ca.gc.nrc.pyxis.infrastructure.modules;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.nrc.pyxis.application.pipeline.Pipeline;
import ca.gc.nrc.pyxis.config.PipelineConfig;
import ca.gc.nrc.pyxis.domain.attribute.AttributeValue;
import ca.gc.nrc.pyxis.domain.attribute.StandardAttributes;
import ca.gc.nrc.pyxis.domain.dataset.DataType;
import ca.gc.nrc.pyxis.domain.dataset.Shape;
import ca.gc.nrc.pyxis.domain.error.ModuleExecutionException;
import ca.gc.nrc.pyxis.domain.error.ModuleParameterException;
import ca.gc.nrc.pyxis.infrastructure.storage.N5ContainerStorage;
import ca.gc.nrc.pyxis.testutil.LogCapture;
import ch.qos.logback.classic.Level;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProcessingModulesTest {

  @TempDir Path tempDir;

  private Pipeline pipeline;

  @BeforeEach
  void setUp() {
    PipelineConfig config = PipelineConfig.defaults(tempDir).withChunkFrames(2);
    pipeline = new Pipeline(config, new N5ContainerStorage(config.storagePath()));
  }

  @AfterEach
  void tearDown() {
    pipeline.close();
  }

  private static SyntheticFramesReadingModule ramp(String name, String tag, long frames, double value, double step,
      long... dims) {
    return new SyntheticFramesReadingModule(name, tag, frames, dims, value, step, DataType.FLOAT64, Map.of(), null);
  }

  @Test
  void syntheticFramesFollowValueAndStep() {
    pipeline.addModule(ramp("gen", "raw", 3, 10.0, 0.5, 2));

    pipeline.runAll();

    assertArrayEquals(new double[] {10, 10, 10.5, 10.5, 11, 11}, pipeline.getData("raw").toArray());
    assertTrue(pipeline.getStaticAttribute("raw", "History: gen").isPresent());
  }

  @Test
  void syntheticRejectsInvalidShape() {
    assertThrows(ModuleParameterException.class, () -> new SyntheticFramesReadingModule("gen", "raw", 0, 2));
    assertThrows(ModuleParameterException.class, () -> new SyntheticFramesReadingModule("gen", "raw", 2, 0));
  }

  @Test
  void scaleInPlaceKeepsAttributesAndFrameCount() {
    pipeline.addModule(new SyntheticFramesReadingModule("gen", "raw", 5, new long[] {2}, 2.0, 0.0,
        DataType.FLOAT64, Map.of("PIXSCALE", AttributeValue.real(0.01)), "TIME"));
    pipeline.addModule(new ScaleFramesModule("scale", "raw", "raw", 3.0, 1.0));

    pipeline.runAll();

    assertArrayEquals(new double[] {7, 7, 7, 7, 7, 7, 7, 7, 7, 7}, pipeline.getData("raw").toArray());
    assertEquals(AttributeValue.real(0.01), pipeline.getStaticAttribute("raw", "PIXSCALE").orElseThrow());
    assertEquals(5, pipeline.getNonStaticAttribute("raw", "TIME").orElseThrow().length());
    assertEquals(AttributeValue.integer(5),
        pipeline.getStaticAttribute("raw", StandardAttributes.NFRAMES).orElseThrow());
    assertTrue(pipeline.getStaticAttribute("raw", "History: scale").isPresent());
  }

  @Test
  void scaleRejectsNonFiniteFactor() {
    assertThrows(ModuleParameterException.class,
        () -> new ScaleFramesModule("scale", "raw", "out", Double.NaN, 0.0));
  }

  @Test
  void backgroundSubtractionUsesMeanOfBackgroundDataset() {
    pipeline.addModule(ramp("sci", "science", 3, 10.0, 0.0, 2));
    pipeline.addModule(ramp("bg", "sky", 2, 1.0, 2.0, 2));
    pipeline.addModule(new BackgroundSubtractionModule("sub", "science", "sky", "reduced"));

    pipeline.runAll();

    assertArrayEquals(new double[] {8, 8, 8, 8, 8, 8}, pipeline.getData("reduced").toArray());
    assertEquals(Shape.ofFrames(3, 2), pipeline.getShape("reduced"));
  }

  @Test
  void missingBackgroundFallsBackToInputMeanWithWarning() {
    pipeline.addModule(ramp("sci", "science", 3, 0.0, 1.0, 1));
    pipeline.addModule(new BackgroundSubtractionModule("sub", "science", "dark", "reduced"));

    try (LogCapture logs = LogCapture.attach(BackgroundSubtractionModule.class)) {
      pipeline.runAll();

      assertTrue(logs.contains(Level.WARN, "Background 'dark' not in storage"));
    }
    assertArrayEquals(new double[] {-1, 0, 1}, pipeline.getData("reduced").toArray());
  }

  @Test
  void backgroundFrameShapeMustMatch() {
    pipeline.addModule(ramp("sci", "science", 2, 1.0, 0.0, 2, 2));
    pipeline.addModule(ramp("bg", "sky", 2, 1.0, 0.0, 3));
    pipeline.addModule(new BackgroundSubtractionModule("sub", "science", "sky", "reduced"));

    ModuleExecutionException ex = assertThrows(ModuleExecutionException.class, pipeline::runAll);

    assertEquals("sub", ex.moduleName());
    assertInstanceOf(ModuleParameterException.class, ex.getCause());
  }

  @Test
  void selectionRejectsInvalidIndices() {
    assertThrows(ModuleParameterException.class, () -> new FrameSelectionModule("sel", "raw", "out"));
    assertThrows(ModuleParameterException.class, () -> new FrameSelectionModule("sel", "raw", "out", 1, -2));
  }

  @Test
  void selectionIndexBeyondFrameCountFailsAtRun() {
    pipeline.addModule(ramp("gen", "raw", 3, 0.0, 1.0, 1));
    pipeline.addModule(new FrameSelectionModule("sel", "raw", "out", 0, 3));

    ModuleExecutionException ex = assertThrows(ModuleExecutionException.class, pipeline::runAll);

    assertInstanceOf(ModuleParameterException.class, ex.getCause());
    assertTrue(ex.getMessage().contains("frame index 3 is out of range"));
  }

  @Test
  void selectionKeepsRequestedOrderAcrossChunks() {
    pipeline.addModule(ramp("gen", "raw", 6, 0.0, 1.0, 1));
    pipeline.addModule(new FrameSelectionModule("sel", "raw", "picked", 5, 1, 3));

    pipeline.runAll();

    assertArrayEquals(new double[] {5, 1, 3}, pipeline.getData("picked").toArray());
  }
}
