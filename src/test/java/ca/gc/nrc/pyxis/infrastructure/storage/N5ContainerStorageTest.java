package ca.gc.nrc.pyxis.infrastructure.storage;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.nrc.pyxis.application.module.FrameChunks;
import ca.gc.nrc.pyxis.domain.attribute.AttributeArray;
import ca.gc.nrc.pyxis.domain.attribute.AttributeValue;
import ca.gc.nrc.pyxis.domain.dataset.DataType;
import ca.gc.nrc.pyxis.domain.dataset.FrameRange;
import ca.gc.nrc.pyxis.domain.dataset.NdArray;
import ca.gc.nrc.pyxis.domain.dataset.Shape;
import ca.gc.nrc.pyxis.domain.error.AttributeAlignmentException;
import ca.gc.nrc.pyxis.domain.error.AttributeConflictException;
import ca.gc.nrc.pyxis.domain.error.StorageException;
import ca.gc.nrc.pyxis.testutil.LogCapture;
import ca.gc.nrc.pyxis.testutil.TestArrays;
import ch.qos.logback.classic.Level;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class N5ContainerStorageTest {
  private static final int MULTI_BLOCK_FRAMES = 2600;

  @TempDir Path tempDir;

  private Path file;
  private N5ContainerStorage storage;

  @BeforeEach
  void setUp() {
    file = tempDir.resolve("pyxis_database.n5");
    storage = new N5ContainerStorage(file, 1024L * 1024L, Set.of("INSTRUMENT"));
  }

  @AfterEach
  void tearDown() {
    storage.close();
  }

  @Test
  void createWriteAndReadSlice() {
    storage.createDataset("im_arr", Shape.ofFrames(0, 2, 3), DataType.FLOAT64);
    storage.appendFrames("im_arr", TestArrays.ramp(4, 2, 3));

    NdArray slice = storage.readSlice("im_arr", new FrameRange(1, 3));

    assertEquals(Shape.ofFrames(4, 2, 3), storage.shape("im_arr"));
    assertEquals(Shape.ofFrames(2, 2, 3), slice.shape());
    assertEquals(6.0, slice.get(0, 0));
    assertEquals(17.0, slice.get(1, 5));
  }

  @Test
  void createWithFramesAllocatesZeros() {
    storage.createDataset("dark", Shape.ofFrames(3, 2), DataType.FLOAT32);

    assertArrayEquals(new double[6], storage.readAll("dark").toArray());
    assertEquals(DataType.FLOAT32, storage.dataType("dark"));
  }

  @Test
  void interleavedAppendsReadBackInFrameOrder() {
    storage.createDataset("a", Shape.ofFrames(0, 2), DataType.FLOAT64);
    storage.createDataset("b", Shape.ofFrames(0, 2), DataType.FLOAT64);
    storage.appendFrames("a", NdArray.of(Shape.ofFrames(1, 2), 1, 2));
    storage.appendFrames("b", NdArray.of(Shape.ofFrames(1, 2), 100, 200));
    storage.appendFrames("a", NdArray.of(Shape.ofFrames(2, 2), 3, 4, 5, 6));

    assertArrayEquals(new double[] {1, 2, 3, 4, 5, 6}, storage.readAll("a").toArray());
    assertArrayEquals(new double[] {3, 4, 5, 6}, storage.readSlice("a", new FrameRange(1, 3)).toArray());
    assertArrayEquals(new double[] {100, 200}, storage.readAll("b").toArray());
  }

  @Test
  void writeSliceOverwritesAcrossAppends() {
    storage.createDataset("a", Shape.ofFrames(0, 1), DataType.FLOAT64);
    storage.createDataset("b", Shape.ofFrames(0, 1), DataType.FLOAT64);
    storage.appendFrames("a", NdArray.of(Shape.ofFrames(2, 1), 0, 1));
    storage.appendFrames("b", NdArray.of(Shape.ofFrames(1, 1), 9));
    storage.appendFrames("a", NdArray.of(Shape.ofFrames(2, 1), 2, 3));

    storage.writeSlice("a", new FrameRange(1, 3), NdArray.of(Shape.ofFrames(2, 1), -1, -2));

    assertArrayEquals(new double[] {0, -1, -2, 3}, storage.readAll("a").toArray());
    assertArrayEquals(new double[] {9}, storage.readAll("b").toArray());
  }

  @Test
  void integerTypesRoundOnWrite() {
    storage.createDataset("raw", Shape.ofFrames(0, 3), DataType.INT16);
    storage.appendFrames("raw", NdArray.of(Shape.ofFrames(1, 3), 1.4, 2.6, -0.6));

    assertArrayEquals(new double[] {1, 3, -1}, storage.readAll("raw").toArray());
  }

  @Test
  void persistsAcrossReopen() {
    storage.createDataset("im_arr", Shape.ofFrames(0, 2), DataType.INT32);
    storage.appendFrames("im_arr", NdArray.of(Shape.ofFrames(2, 2), 1, 2, 3, 4));
    storage.setStaticAttribute("im_arr", "PIXSCALE", AttributeValue.real(0.01));
    storage.setStaticAttribute("im_arr", "INSTRUMENT", AttributeValue.text("NACO"));
    storage.setStaticAttribute("im_arr", "NDIT", AttributeValue.integer(7));
    storage.setNonStaticAttribute("im_arr", "TIME", AttributeArray.reals(0.5, 1.5));
    storage.setNonStaticAttribute("im_arr", "INDEX", AttributeArray.integers(0, 1));
    storage.setNonStaticAttribute("im_arr", "FILE", AttributeArray.texts("a.fits", "b.fits"));
    storage.createDataset("gone", Shape.ofFrames(1, 1), DataType.FLOAT64);
    assertTrue(storage.deleteDataset("gone"));
    storage.writeSettings(Map.of("MEMORY", AttributeValue.integer(1000)));
    storage.close();

    try (N5ContainerStorage reopened = new N5ContainerStorage(file)) {
      assertEquals(List.of("im_arr"), reopened.tags());
      assertEquals(DataType.INT32, reopened.dataType("im_arr"));
      assertArrayEquals(new double[] {1, 2, 3, 4}, reopened.readAll("im_arr").toArray());
      assertEquals(AttributeValue.real(0.01), reopened.staticAttribute("im_arr", "PIXSCALE").orElseThrow());
      assertEquals(AttributeValue.text("NACO"), reopened.staticAttribute("im_arr", "INSTRUMENT").orElseThrow());
      assertEquals(AttributeValue.integer(7), reopened.staticAttribute("im_arr", "NDIT").orElseThrow());
      assertEquals(AttributeArray.reals(0.5, 1.5), reopened.nonStaticAttribute("im_arr", "TIME").orElseThrow());
      assertEquals(AttributeArray.integers(0, 1), reopened.nonStaticAttribute("im_arr", "INDEX").orElseThrow());
      assertEquals(AttributeArray.texts("a.fits", "b.fits"),
          reopened.nonStaticAttribute("im_arr", "FILE").orElseThrow());
      assertEquals(Map.of("MEMORY", AttributeValue.integer(1000)), reopened.settings());
      assertFalse(reopened.hasDataset("gone"));
    }
  }

  @Test
  void appendAfterReopenExtendsDataset() {
    storage.createDataset("im_arr", Shape.ofFrames(0, 1), DataType.FLOAT64);
    storage.appendFrames("im_arr", NdArray.of(Shape.ofFrames(2, 1), 1, 2));
    storage.close();

    try (N5ContainerStorage reopened = new N5ContainerStorage(file)) {
      reopened.appendFrames("im_arr", NdArray.of(Shape.ofFrames(1, 1), 3));
    }
    try (N5ContainerStorage again = new N5ContainerStorage(file)) {
      assertArrayEquals(new double[] {1, 2, 3}, again.readAll("im_arr").toArray());
    }
  }

  @Test
  void secondOpenInSameProcessIsRejected() {
    storage.open();
    N5ContainerStorage other = new N5ContainerStorage(file);

    StorageException ex = assertThrows(StorageException.class, other::open);

    assertTrue(ex.getMessage().contains("already open in this process"));
    assertFalse(other.isOpen());
  }

  @Test
  void protectedAttributeRejectsDifferentValue() {
    storage.createDataset("im_arr", Shape.ofFrames(1, 1), DataType.FLOAT64);
    storage.setStaticAttribute("im_arr", "INSTRUMENT", AttributeValue.text("NACO"));

    storage.setStaticAttribute("im_arr", "INSTRUMENT", AttributeValue.text("NACO"));
    AttributeConflictException ex = assertThrows(AttributeConflictException.class,
        () -> storage.setStaticAttribute("im_arr", "INSTRUMENT", AttributeValue.text("SPHERE")));

    assertEquals("INSTRUMENT", ex.key());
    assertEquals(AttributeValue.text("NACO"), storage.staticAttribute("im_arr", "INSTRUMENT").orElseThrow());
  }

  @Test
  void unprotectedAttributeOverwritesSilently() {
    storage.createDataset("im_arr", Shape.ofFrames(1, 1), DataType.FLOAT64);
    storage.setStaticAttribute("im_arr", "PIXSCALE", AttributeValue.real(0.027));
    storage.setStaticAttribute("im_arr", "PIXSCALE", AttributeValue.real(0.01));

    assertEquals(AttributeValue.real(0.01), storage.staticAttribute("im_arr", "PIXSCALE").orElseThrow());
  }

  @Test
  void nonStaticLengthMustMatchFrames() {
    storage.createDataset("im_arr", Shape.ofFrames(3, 1), DataType.FLOAT64);

    AttributeAlignmentException ex = assertThrows(AttributeAlignmentException.class,
        () -> storage.setNonStaticAttribute("im_arr", "TIME", AttributeArray.reals(1, 2)));

    assertEquals(2, ex.attributeLength());
    assertEquals(3, ex.frameCount());
  }

  @Test
  void nonStaticReadFailsAfterFramesAppended() {
    storage.createDataset("im_arr", Shape.ofFrames(2, 1), DataType.FLOAT64);
    storage.setNonStaticAttribute("im_arr", "TIME", AttributeArray.reals(1, 2));
    storage.appendFrames("im_arr", NdArray.of(Shape.ofFrames(1, 1), 5));

    assertThrows(AttributeAlignmentException.class, () -> storage.nonStaticAttribute("im_arr", "TIME"));
  }

  @Test
  void unknownTagAndShapeMismatchRaiseStorageException() {
    storage.createDataset("im_arr", Shape.ofFrames(1, 2, 2), DataType.FLOAT64);

    StorageException unknown = assertThrows(StorageException.class, () -> storage.shape("missing"));
    assertTrue(unknown.getMessage().contains("Unknown dataset 'missing'"));
    assertThrows(StorageException.class,
        () -> storage.appendFrames("im_arr", NdArray.zeros(Shape.ofFrames(1, 3, 3))));
    assertThrows(StorageException.class, () -> storage.readSlice("im_arr", new FrameRange(0, 2)));
    assertThrows(StorageException.class,
        () -> storage.createDataset("im_arr", Shape.ofFrames(0, 2, 2), DataType.FLOAT64));
    assertThrows(StorageException.class,
        () -> storage.createDataset("config", Shape.ofFrames(0, 2, 2), DataType.FLOAT64));
  }

  @Test
  void readAllAboveBudgetWarns() {
    try (N5ContainerStorage small = new N5ContainerStorage(tempDir.resolve("small.n5"), 16, Set.of());
        LogCapture logs = LogCapture.attach(N5ContainerStorage.class)) {
      small.createDataset("im_arr", Shape.ofFrames(1, 4), DataType.FLOAT64);

      small.readAll("im_arr");

      assertTrue(logs.contains(Level.WARN, "Reading all of dataset 'im_arr'"));
    }
  }

  @Test
  void deleteRemovesDatasetAndAttributes() {
    storage.createDataset("im_arr", Shape.ofFrames(1, 1), DataType.FLOAT64);
    storage.setStaticAttribute("im_arr", "PIXSCALE", AttributeValue.real(0.01));

    assertTrue(storage.deleteDataset("im_arr"));
    assertFalse(storage.deleteDataset("im_arr"));
    storage.createDataset("im_arr", Shape.ofFrames(1, 1), DataType.FLOAT64);

    assertTrue(storage.staticAttributeKeys("im_arr").isEmpty());
  }

  @Test
  void regularFileIsNotAContainer() throws Exception {
    Path corrupt = tempDir.resolve("corrupt.n5");
    Files.write(corrupt, "this is not a container at all, really".getBytes(StandardCharsets.US_ASCII));

    try (N5ContainerStorage bad = new N5ContainerStorage(corrupt)) {
      StorageException ex = assertThrows(StorageException.class, bad::open);
      assertTrue(ex.getMessage().contains("is not a PYXIS container"));
    }
  }

  @Test
  void foreignDirectoryIsNotAContainer() throws Exception {
    Path foreign = tempDir.resolve("foreign");
    Files.createDirectories(foreign);
    Files.writeString(foreign.resolve("notes.txt"), "unrelated");

    try (N5ContainerStorage bad = new N5ContainerStorage(foreign)) {
      StorageException ex = assertThrows(StorageException.class, bad::open);
      assertTrue(ex.getMessage().contains("is not a PYXIS container"));
      assertFalse(bad.isOpen());
    }
  }

  @Test
  void containerIsAnN5DirectoryWithOneDatasetPerTag() {
    storage.createDataset("im_arr", Shape.ofFrames(0, 2, 3), DataType.FLOAT32);
    storage.appendFrames("im_arr", TestArrays.ramp(2, 2, 3));
    storage.flush();

    assertTrue(Files.isDirectory(file.resolve("im_arr")));
    assertTrue(Files.isRegularFile(file.resolve("im_arr").resolve("attributes.json")));
    assertTrue(Files.isRegularFile(tempDir.resolve("pyxis_database.n5.lock")));
  }

  @Test
  void slicedReadsMatchFullReadAcrossBlocks() {
    NdArray expected = TestArrays.ramp(MULTI_BLOCK_FRAMES, 2, 2);
    storage.createDataset("raw", Shape.ofFrames(0, 2, 2), DataType.FLOAT32);
    storage.appendFrames("raw", expected);
    assertTrue(Files.exists(file.resolve("raw").resolve("0").resolve("0").resolve("2")),
        "dataset should span three blocks");

    NdArray all = storage.readAll("raw");
    assertArrayEquals(expected.toArray(), all.toArray());
    for (int size : new int[] {1, 7, MULTI_BLOCK_FRAMES}) {
      List<NdArray> parts = new ArrayList<>();
      for (long start = 0; start < MULTI_BLOCK_FRAMES; start += size) {
        long end = Math.min(MULTI_BLOCK_FRAMES, start + size);
        parts.add(storage.readSlice("raw", new FrameRange(start, end)));
      }
      assertArrayEquals(all.toArray(), NdArray.concat(parts).toArray(), "slice size " + size);
    }
    List<NdArray> chunks = new ArrayList<>();
    for (FrameRange range : FrameChunks.plan(MULTI_BLOCK_FRAMES, 333)) {
      chunks.add(storage.readSlice("raw", range));
    }
    assertEquals(all.shape(), NdArray.concat(chunks).shape());
    assertArrayEquals(all.toArray(), NdArray.concat(chunks).toArray());
  }

  @Test
  void sliceBySliceWritesMatchOneAppend() {
    NdArray expected = TestArrays.ramp(MULTI_BLOCK_FRAMES, 2, 2);
    storage.createDataset("whole", Shape.ofFrames(0, 2, 2), DataType.FLOAT32);
    storage.appendFrames("whole", expected);
    storage.createDataset("sliced", Shape.ofFrames(MULTI_BLOCK_FRAMES, 2, 2), DataType.FLOAT32);
    storage.createDataset("appended", Shape.ofFrames(0, 2, 2), DataType.FLOAT32);

    for (FrameRange range : FrameChunks.plan(MULTI_BLOCK_FRAMES, 7)) {
      NdArray part = storage.readSlice("whole", range);
      storage.writeSlice("sliced", range, part);
      storage.appendFrames("appended", part);
    }

    assertArrayEquals(expected.toArray(), storage.readAll("sliced").toArray());
    assertArrayEquals(expected.toArray(), storage.readAll("appended").toArray());
    assertEquals(Shape.ofFrames(MULTI_BLOCK_FRAMES, 2, 2), storage.shape("appended"));
  }

  @Test
  void partialBlockWriteKeepsNeighbouringFrames() {
    storage.createDataset("raw", Shape.ofFrames(0, 2, 2), DataType.INT32);
    storage.appendFrames("raw", TestArrays.ramp(MULTI_BLOCK_FRAMES, 2, 2));

    storage.writeSlice("raw", new FrameRange(1020, 1030), TestArrays.frameIndexed(10, 2, 2));

    NdArray all = storage.readAll("raw");
    assertEquals(1019 * 4 + 3, all.get(1019, 3));
    assertEquals(0.0, all.get(1020, 0));
    assertEquals(3.0, all.get(1023, 2));
    assertEquals(4.0, all.get(1024, 0));
    assertEquals(9.0, all.get(1029, 3));
    assertEquals(1030 * 4, all.get(1030, 0));
  }

  @Test
  void closeIsIdempotentAndBlocksReuse() {
    storage.open();
    storage.close();
    storage.close();

    assertThrows(StorageException.class, storage::open);
  }
}
