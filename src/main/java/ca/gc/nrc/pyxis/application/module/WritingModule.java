package ca.gc.nrc.pyxis.application.module;

import java.util.Map;

/**
 * Module that exports stored data. It has no outputs and receives a read-only context.
 */
public interface WritingModule extends PipelineModule {

  @Override
  default ModuleKind kind() {
    return ModuleKind.WRITING;
  }

  @Override
  default Map<String, String> outputs() {
    return Map.of();
  }
}
