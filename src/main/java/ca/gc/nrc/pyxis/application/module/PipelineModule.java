package ca.gc.nrc.pyxis.application.module;

import ca.gc.nrc.pyxis.domain.dataset.DataType;
import java.util.Map;
import java.util.Set;

/**
 * <strong>What:</strong> Unit of work executed by the pipeline against central storage.
 * <p><strong>Why:</strong> Reduction steps (import, calibration, selection, export) share one contract so the
 * pipeline can validate, order and account for them uniformly.</p>
 * <p><strong>Role:</strong> Implemented through one of the capability interfaces {@link ReadingModule},
 * {@link WritingModule} or {@link ProcessingModule}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Declare input and output dataset tags keyed by role, in a stable order.</li>
 *   <li>Process data through the ports of the supplied {@link ModuleContext}, chunk by chunk.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Modules run on the pipeline thread only.</p>
 *
 * @since 0.1.0
 */
public interface PipelineModule {

  /**
   * Unique name within a pipeline; follows the dataset tag character rules.
   *
   * @return module name
   */
  String name();

  ModuleKind kind();

  /**
   * Input tags by role. The first entry is the primary input attributes propagate from.
   *
   * @return ordered role to tag map
   */
  Map<String, String> inputs();

  /**
   * Output tags by role.
   *
   * @return ordered role to tag map
   */
  Map<String, String> outputs();

  /**
   * Input roles that may be missing from storage.
   *
   * @return optional roles, empty by default
   */
  default Set<String> optionalInputRoles() {
    return Set.of();
  }

  default AttributePolicy propagation() {
    return AttributePolicy.COPY;
  }

  /**
   * Element type an output dataset is created with.
   *
   * @param role output role
   * @return on-disk element type, {@link DataType#FLOAT64} by default
   */
  default DataType outputType(String role) {
    return DataType.FLOAT64;
  }

  /**
   * Processes data.
   *
   * @param context bound ports and configuration
   * @throws Exception any failure; the pipeline aborts the run and wraps it with the module name
   */
  void run(ModuleContext context) throws Exception;
}
