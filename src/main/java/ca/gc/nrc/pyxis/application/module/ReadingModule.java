package ca.gc.nrc.pyxis.application.module;

import java.util.Map;

/**
 * Module that imports data into storage. It has no inputs and must create every declared output.
 */
public interface ReadingModule extends PipelineModule {

  @Override
  default ModuleKind kind() {
    return ModuleKind.READING;
  }

  @Override
  default Map<String, String> inputs() {
    return Map.of();
  }
}
