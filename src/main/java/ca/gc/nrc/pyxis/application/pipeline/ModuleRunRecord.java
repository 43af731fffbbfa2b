package ca.gc.nrc.pyxis.application.pipeline;

import ca.gc.nrc.pyxis.application.module.ModuleKind;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Timing and size bookkeeping of one module execution.
 *
 * @param name module name
 * @param kind module capability
 * @param startedAtMillis wall-clock start
 * @param durationMillis elapsed time including attribute bookkeeping
 * @param outputs statistics per output tag, in declaration order
 * @since 0.1.0
 */
public record ModuleRunRecord(
    String name,
    ModuleKind kind,
    long startedAtMillis,
    long durationMillis,
    Map<String, OutputStats> outputs) {

  public ModuleRunRecord {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(kind, "kind");
    outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs == null ? Map.of() : outputs));
  }

  /**
   * Frames written across all outputs.
   *
   * @return frame total
   */
  public long framesWritten() {
    long total = 0;
    for (OutputStats stats : outputs.values()) {
      total += stats.framesWritten();
    }
    return total;
  }

  /**
   * Bytes written across all outputs.
   *
   * @return byte total
   */
  public long bytesWritten() {
    long total = 0;
    for (OutputStats stats : outputs.values()) {
      total += stats.bytesWritten();
    }
    return total;
  }

  /**
   * Per-output statistics.
   *
   * @param framesWritten frames written by the module
   * @param bytesWritten bytes written in the dataset's element type
   * @param totalFrames frame count of the dataset after the module
   */
  public record OutputStats(long framesWritten, long bytesWritten, long totalFrames) {}
}
