package ca.gc.nrc.pyxis.infrastructure.storage;

import ca.gc.nrc.pyxis.application.port.DataStoragePort;
import ca.gc.nrc.pyxis.domain.attribute.AttributeArray;
import ca.gc.nrc.pyxis.domain.attribute.AttributeValue;
import ca.gc.nrc.pyxis.domain.dataset.DataType;
import ca.gc.nrc.pyxis.domain.dataset.DatasetTags;
import ca.gc.nrc.pyxis.domain.dataset.FrameRange;
import ca.gc.nrc.pyxis.domain.dataset.NdArray;
import ca.gc.nrc.pyxis.domain.dataset.Shape;
import ca.gc.nrc.pyxis.domain.error.AttributeAlignmentException;
import ca.gc.nrc.pyxis.domain.error.AttributeConflictException;
import ca.gc.nrc.pyxis.domain.error.StorageException;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;
import org.janelia.saalfeldlab.n5.DataBlock;
import org.janelia.saalfeldlab.n5.DatasetAttributes;
import org.janelia.saalfeldlab.n5.N5Exception;
import org.janelia.saalfeldlab.n5.N5FSWriter;
import org.janelia.saalfeldlab.n5.N5Writer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link DataStoragePort} backed by one N5 container directory.
 * <p><strong>Why:</strong> Keeps every dataset of a pipeline in one lockable container so intermediate results
 * survive between modules and runs without holding frames in memory.</p>
 * <p><strong>Role:</strong> Infrastructure adapter created by the pipeline; opened lazily on first use.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Take an exclusive OS-level lock on a sibling {@code .lock} file so only one pipeline works on a
 *   container.</li>
 *   <li>Store each dataset as an N5 dataset at {@code /<tag>} in its declared element type, chunked along the
 *   frame axis.</li>
 *   <li>Keep static and per-frame attributes and the pipeline settings as N5 attributes.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe.</p>
 * <p><strong>Observability:</strong> DEBUG logs for dataset lifecycle; WARN when a full read exceeds the memory
 * budget.</p>
 *
 * <p>Frame data is written through immediately. Attributes, settings and the ordered tag list live in memory
 * and reach the container on {@link #flush()} and {@link #close()}; a reopened container knows only the
 * datasets listed at the last flush.</p>
 *
 * @since 0.1.0
 */
public final class N5ContainerStorage implements DataStoragePort {
  private static final Logger log = LoggerFactory.getLogger(N5ContainerStorage.class);

  /** Version of the attribute layout written under {@value #FORMAT_KEY}. */
  static final int FORMAT_VERSION = 1;
  static final String FORMAT_KEY = "pyxisFormat";
  static final String TAGS_KEY = "pyxisTags";
  static final String SETTINGS_KEY = "pyxisSettings";
  static final String STATIC_KEY = "pyxisStatic";
  static final String NON_STATIC_KEY = "pyxisNonStatic";
  private static final String ROOT = "/";
  /** Default memory budget for full reads: 512 MiB. */
  public static final long DEFAULT_MEMORY_BUDGET_BYTES = 512L * 1024L * 1024L;

  private final Path path;
  private final Path lockPath;
  private final long memoryBudgetBytes;
  private final Set<String> protectedKeys;
  private final Map<String, DatasetEntry> datasets = new LinkedHashMap<>();
  private final Map<String, AttributeValue> settings = new LinkedHashMap<>();

  private N5Writer n5;
  private FileChannel lockChannel;
  private FileLock lock;
  private boolean dirty;
  private boolean closed;

  /**
   * Creates an adapter with the default memory budget and {@code INSTRUMENT} as protected key.
   *
   * @param path container directory; created on first open when absent
   */
  public N5ContainerStorage(Path path) {
    this(path, DEFAULT_MEMORY_BUDGET_BYTES, Set.of("INSTRUMENT"));
  }

  /**
   * Creates an adapter. Nothing is opened until first use.
   *
   * @param path container directory; created on first open when absent
   * @param memoryBudgetBytes size above which full reads log a warning
   * @param protectedKeys static attribute keys that may not be overwritten with a different value
   */
  public N5ContainerStorage(Path path, long memoryBudgetBytes, Set<String> protectedKeys) {
    this.path = Objects.requireNonNull(path, "path").toAbsolutePath().normalize();
    if (memoryBudgetBytes <= 0) {
      throw new IllegalArgumentException("memoryBudgetBytes must be positive");
    }
    this.lockPath = this.path.resolveSibling(this.path.getFileName() + ".lock");
    this.memoryBudgetBytes = memoryBudgetBytes;
    this.protectedKeys = Set.copyOf(Objects.requireNonNull(protectedKeys, "protectedKeys"));
  }

  @Override
  public Path path() {
    return path;
  }

  @Override
  public boolean isOpen() {
    return n5 != null;
  }

  @Override
  public void open() {
    if (closed) {
      throw new StorageException("Storage " + path + " is closed");
    }
    if (n5 != null) {
      return;
    }
    if (Files.exists(path) && !Files.isDirectory(path)) {
      throw new StorageException("Storage " + path + " is not a PYXIS container (not a directory)");
    }
    FileChannel ch = null;
    try {
      Path parent = path.getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      ch = FileChannel.open(lockPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
      FileLock acquired = tryLock(ch);
      boolean fresh = isEmptyOrAbsent(path);
      N5Writer writer = new N5FSWriter(path.toString(), new GsonBuilder().serializeSpecialFloatingPointValues());
      if (fresh) {
        writer.setAttribute(ROOT, FORMAT_KEY, FORMAT_VERSION);
        log.debug("Created storage container {}", path);
      } else {
        loadExisting(writer);
        log.debug("Opened storage container {} with {} datasets", path, datasets.size());
      }
      n5 = writer;
      lockChannel = ch;
      lock = acquired;
    } catch (IOException | N5Exception ex) {
      datasets.clear();
      settings.clear();
      closeQuietly(ch);
      throw new StorageException("Failed to open storage " + path + ": " + ex.getMessage(), ex);
    } catch (RuntimeException ex) {
      datasets.clear();
      settings.clear();
      closeQuietly(ch);
      throw ex;
    }
  }

  private FileLock tryLock(FileChannel ch) throws IOException {
    FileLock acquired;
    try {
      acquired = ch.tryLock();
    } catch (OverlappingFileLockException ex) {
      throw new StorageException("Storage " + path + " is already open in this process", ex);
    }
    if (acquired == null) {
      throw new StorageException("Storage " + path + " is locked by another process");
    }
    return acquired;
  }

  private static boolean isEmptyOrAbsent(Path dir) throws IOException {
    if (!Files.isDirectory(dir)) {
      return true;
    }
    try (Stream<Path> entries = Files.list(dir)) {
      return entries.findAny().isEmpty();
    }
  }

  private void loadExisting(N5Writer writer) {
    Integer version = writer.getAttribute(ROOT, FORMAT_KEY, Integer.class);
    if (version == null) {
      throw new StorageException("Storage " + path + " is not a PYXIS container (no " + FORMAT_KEY + ")");
    }
    if (version != FORMAT_VERSION) {
      throw new StorageException("Storage " + path + " has unsupported format version " + version);
    }
    datasets.clear();
    settings.clear();
    settings.putAll(AttributeJson.decodeValues(
        writer.getAttribute(ROOT, SETTINGS_KEY, JsonObject.class), "settings"));
    JsonArray tags = writer.getAttribute(ROOT, TAGS_KEY, JsonArray.class);
    if (tags == null) {
      return;
    }
    for (JsonElement element : tags) {
      String tag = element.getAsString();
      DatasetAttributes stored = writer.getDatasetAttributes(ROOT + tag);
      if (stored == null) {
        throw new StorageException("Storage " + path + " lists dataset '" + tag + "' but holds no such dataset");
      }
      DatasetEntry entry = DatasetEntry.fromN5(tag, stored);
      entry.statics.putAll(AttributeJson.decodeValues(
          writer.getAttribute(entry.path, STATIC_KEY, JsonObject.class), "dataset '" + tag + "'"));
      entry.nonStatics.putAll(AttributeJson.decodeArrays(
          writer.getAttribute(entry.path, NON_STATIC_KEY, JsonObject.class), "dataset '" + tag + "'"));
      datasets.put(tag, entry);
    }
  }

  @Override
  public boolean hasDataset(String tag) {
    open();
    return datasets.containsKey(tag);
  }

  @Override
  public List<String> tags() {
    open();
    return List.copyOf(datasets.keySet());
  }

  @Override
  public void createDataset(String tag, Shape shape, DataType type) {
    Objects.requireNonNull(shape, "shape");
    Objects.requireNonNull(type, "type");
    open();
    try {
      DatasetTags.requireValidTag(tag);
    } catch (IllegalArgumentException ex) {
      throw new StorageException("Cannot create dataset: " + ex.getMessage(), ex);
    }
    if (datasets.containsKey(tag)) {
      throw new StorageException("Dataset '" + tag + "' already exists in " + path);
    }
    DatasetEntry entry = DatasetEntry.create(tag, type, shape.frameDims(), shape.frames());
    try {
      if (n5.exists(entry.path)) {
        // Left behind by a run that stopped before flushing.
        n5.remove(entry.path);
      }
      n5.createDataset(entry.path, entry.attributes());
    } catch (N5Exception ex) {
      throw new StorageException("Failed to create dataset '" + tag + "': " + ex.getMessage(), ex);
    }
    datasets.put(tag, entry);
    dirty = true;
    log.debug("Created dataset '{}' shape={} type={} blockFrames={}", tag, shape, type, entry.blockFrames);
  }

  @Override
  public Shape shape(String tag) {
    return entry(tag).shape();
  }

  @Override
  public DataType dataType(String tag) {
    return entry(tag).type;
  }

  @Override
  public NdArray readSlice(String tag, FrameRange range) {
    Objects.requireNonNull(range, "range");
    DatasetEntry entry = entry(tag);
    long frames = entry.frames();
    if (range.end() > frames) {
      throw new StorageException(
          "Slice " + range + " is out of bounds for dataset '" + tag + "' with " + frames + " frames");
    }
    Shape shape = Shape.ofFrames(range.length(), entry.frameDims);
    double[] values = new double[Math.toIntExact(shape.elementCount())];
    if (range.isEmpty()) {
      return NdArray.wrap(shape, values);
    }
    int frameElements = entry.frameElements();
    long firstBlock = range.start() / entry.blockFrames;
    long lastBlock = (range.end() - 1) / entry.blockFrames;
    try {
      for (long b = firstBlock; b <= lastBlock; b++) {
        DataBlock<?> block = n5.readBlock(entry.path, entry.attributes(), entry.gridPosition(b));
        if (block == null) {
          // Never written, reads as zeros.
          continue;
        }
        long blockStart = b * entry.blockFrames;
        long from = Math.max(range.start(), blockStart);
        long to = Math.min(range.end(), blockStart + storedFrames(entry, block));
        if (from >= to) {
          continue;
        }
        ByteBuffer buf = block.toByteBuffer();
        buf.position(Math.toIntExact((from - blockStart) * frameElements * entry.type.byteSize()));
        int base = Math.toIntExact((from - range.start()) * frameElements);
        int n = Math.toIntExact((to - from) * frameElements);
        for (int i = 0; i < n; i++) {
          values[base + i] = entry.type.get(buf);
        }
      }
    } catch (N5Exception ex) {
      throw new StorageException("Failed to read " + range + " of dataset '" + tag + "': " + ex.getMessage(), ex);
    }
    return NdArray.wrap(shape, values);
  }

  @Override
  public NdArray readAll(String tag) {
    DatasetEntry entry = entry(tag);
    long inMemoryBytes = entry.frames() * entry.frameElements() * Double.BYTES;
    if (inMemoryBytes > memoryBudgetBytes) {
      log.warn("Reading all of dataset '{}' needs {} bytes, above the memory budget of {} bytes",
          tag, inMemoryBytes, memoryBudgetBytes);
    }
    return readSlice(tag, FrameRange.all(entry.frames()));
  }

  @Override
  public void writeSlice(String tag, FrameRange range, NdArray array) {
    Objects.requireNonNull(range, "range");
    Objects.requireNonNull(array, "array");
    DatasetEntry entry = entry(tag);
    requireFrameShape(entry, array);
    if (range.length() != array.frames()) {
      throw new StorageException("Slice " + range + " of dataset '" + tag + "' does not match "
          + array.frames() + " supplied frames");
    }
    if (range.end() > entry.frames()) {
      throw new StorageException(
          "Slice " + range + " is out of bounds for dataset '" + tag + "' with " + entry.frames() + " frames");
    }
    try {
      writeFrames(entry, range.start(), array);
    } catch (N5Exception ex) {
      throw new StorageException("Failed to write " + range + " of dataset '" + tag + "': " + ex.getMessage(), ex);
    }
  }

  @Override
  public void appendFrames(String tag, NdArray array) {
    Objects.requireNonNull(array, "array");
    DatasetEntry entry = entry(tag);
    requireFrameShape(entry, array);
    if (array.frames() == 0) {
      return;
    }
    long start = entry.frames();
    try {
      long[] dims = entry.resize(start + array.frames());
      n5.setAttribute(entry.path, DatasetAttributes.DIMENSIONS_KEY, dims);
      writeFrames(entry, start, array);
    } catch (N5Exception ex) {
      throw new StorageException("Failed to append to dataset '" + tag + "': " + ex.getMessage(), ex);
    }
  }

  /**
   * Writes {@code array} at frame {@code start}, one block at a time. Blocks the array covers only in part
   * are read first so frames outside the slice keep their values.
   */
  private void writeFrames(DatasetEntry entry, long start, NdArray array) {
    int frameElements = entry.frameElements();
    int byteSize = entry.type.byteSize();
    long end = start + array.frames();
    long firstBlock = start / entry.blockFrames;
    long lastBlock = (end - 1) / entry.blockFrames;
    for (long b = firstBlock; b <= lastBlock; b++) {
      long blockStart = b * entry.blockFrames;
      int[] size = entry.blockSize(b);
      int blockFrames = size[size.length - 1];
      long from = Math.max(start, blockStart);
      long to = Math.min(end, blockStart + blockFrames);
      int numElements = blockFrames * frameElements;
      ByteBuffer buf = ByteBuffer.allocate(numElements * byteSize);
      if (from > blockStart || to < blockStart + blockFrames) {
        DataBlock<?> existing = n5.readBlock(entry.path, entry.attributes(), entry.gridPosition(b));
        if (existing != null) {
          int keep = Math.min(storedFrames(entry, existing), blockFrames) * frameElements * byteSize;
          ByteBuffer old = existing.toByteBuffer();
          old.limit(Math.min(old.limit(), keep));
          buf.put(old);
        }
      }
      buf.position(Math.toIntExact((from - blockStart) * frameElements * byteSize));
      long local = from - start;
      for (long f = 0; f < to - from; f++) {
        for (int i = 0; i < frameElements; i++) {
          entry.type.put(buf, array.get(local + f, i));
        }
      }
      buf.rewind();
      DataBlock<?> block = entry.attributes().getDataType().createDataBlock(size, entry.gridPosition(b), numElements);
      block.readData(buf);
      n5.writeBlock(entry.path, entry.attributes(), block);
    }
  }

  private static int storedFrames(DatasetEntry entry, DataBlock<?> block) {
    int[] size = block.getSize();
    return size[entry.frameDims.length];
  }

  @Override
  public boolean deleteDataset(String tag) {
    open();
    DatasetEntry removed = datasets.remove(tag);
    if (removed == null) {
      return false;
    }
    try {
      n5.remove(removed.path);
    } catch (N5Exception ex) {
      throw new StorageException("Failed to delete dataset '" + tag + "': " + ex.getMessage(), ex);
    }
    dirty = true;
    log.debug("Deleted dataset '{}'", tag);
    return true;
  }

  @Override
  public Optional<AttributeValue> staticAttribute(String tag, String key) {
    return Optional.ofNullable(entry(tag).statics.get(key));
  }

  @Override
  public void setStaticAttribute(String tag, String key, AttributeValue value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    DatasetEntry entry = entry(tag);
    AttributeValue existing = entry.statics.get(key);
    if (existing != null && protectedKeys.contains(key)) {
      if (existing.equals(value)) {
        return;
      }
      throw new AttributeConflictException(tag, key, existing.raw(), value.raw());
    }
    entry.statics.put(key, value);
    dirty = true;
  }

  @Override
  public Optional<AttributeArray> nonStaticAttribute(String tag, String key) {
    DatasetEntry entry = entry(tag);
    AttributeArray values = entry.nonStatics.get(key);
    if (values == null) {
      return Optional.empty();
    }
    long frames = entry.frames();
    if (values.length() != frames) {
      throw new AttributeAlignmentException(tag, key, values.length(), frames);
    }
    return Optional.of(values);
  }

  @Override
  public void setNonStaticAttribute(String tag, String key, AttributeArray values) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(values, "values");
    DatasetEntry entry = entry(tag);
    long frames = entry.frames();
    if (values.length() != frames) {
      throw new AttributeAlignmentException(tag, key, values.length(), frames);
    }
    entry.nonStatics.put(key, values);
    dirty = true;
  }

  @Override
  public Set<String> staticAttributeKeys(String tag) {
    return Collections.unmodifiableSet(new LinkedHashSet<>(entry(tag).statics.keySet()));
  }

  @Override
  public Set<String> nonStaticAttributeKeys(String tag) {
    return Collections.unmodifiableSet(new LinkedHashSet<>(entry(tag).nonStatics.keySet()));
  }

  @Override
  public boolean deleteStaticAttribute(String tag, String key) {
    boolean removed = entry(tag).statics.remove(key) != null;
    dirty |= removed;
    return removed;
  }

  @Override
  public boolean deleteNonStaticAttribute(String tag, String key) {
    boolean removed = entry(tag).nonStatics.remove(key) != null;
    dirty |= removed;
    return removed;
  }

  @Override
  public Map<String, AttributeValue> settings() {
    open();
    return Collections.unmodifiableMap(new LinkedHashMap<>(settings));
  }

  @Override
  public void writeSettings(Map<String, AttributeValue> newSettings) {
    Objects.requireNonNull(newSettings, "settings");
    open();
    settings.clear();
    settings.putAll(newSettings);
    dirty = true;
  }

  @Override
  public void flush() {
    if (n5 == null || !dirty) {
      return;
    }
    try {
      JsonArray tags = new JsonArray();
      for (DatasetEntry entry : datasets.values()) {
        n5.setAttribute(entry.path, STATIC_KEY, AttributeJson.encodeValues(entry.statics));
        n5.setAttribute(entry.path, NON_STATIC_KEY, AttributeJson.encodeArrays(entry.nonStatics));
        tags.add(entry.tag);
      }
      n5.setAttribute(ROOT, SETTINGS_KEY, AttributeJson.encodeValues(settings));
      n5.setAttribute(ROOT, TAGS_KEY, tags);
      dirty = false;
    } catch (N5Exception ex) {
      throw new StorageException("Failed to flush storage " + path + ": " + ex.getMessage(), ex);
    }
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    if (n5 == null) {
      closed = true;
      return;
    }
    try {
      flush();
    } finally {
      closed = true;
      try {
        if (lock != null && lock.isValid()) {
          lock.release();
        }
        lockChannel.close();
        log.debug("Closed storage container {}", path);
      } catch (IOException ex) {
        throw new StorageException("Failed to close storage " + path + ": " + ex.getMessage(), ex);
      } finally {
        n5 = null;
        lockChannel = null;
        lock = null;
      }
    }
  }

  private DatasetEntry entry(String tag) {
    open();
    DatasetEntry entry = datasets.get(tag);
    if (entry == null) {
      throw new StorageException("Unknown dataset '" + tag + "' in " + path);
    }
    return entry;
  }

  private static void requireFrameShape(DatasetEntry entry, NdArray array) {
    long[] dims = array.shape().frameDims();
    if (!Arrays.equals(dims, entry.frameDims)) {
      throw new StorageException("Frame shape " + Arrays.toString(dims) + " does not match dataset '"
          + entry.tag + "' frame shape " + Arrays.toString(entry.frameDims));
    }
  }

  private static void closeQuietly(FileChannel ch) {
    if (ch == null) {
      return;
    }
    try {
      ch.close();
    } catch (IOException ex) {
      log.debug("Failed to close lock channel {} after open failure", ch, ex);
    }
  }
}
