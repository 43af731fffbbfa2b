package ca.gc.nrc.pyxis.application.pipeline;

import java.util.List;

/**
 * Outcome of {@link Pipeline#runAll()}.
 *
 * @param records run records of the modules that completed, in execution order
 * @param durationMillis elapsed time of the whole run
 * @since 0.1.0
 */
public record RunReport(List<ModuleRunRecord> records, long durationMillis) {

  public RunReport {
    records = List.copyOf(records);
  }

  public long framesWritten() {
    return records.stream().mapToLong(ModuleRunRecord::framesWritten).sum();
  }
}
