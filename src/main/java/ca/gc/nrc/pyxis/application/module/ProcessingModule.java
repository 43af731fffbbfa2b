package ca.gc.nrc.pyxis.application.module;

/**
 * Module that transforms stored datasets into other datasets. Only processing modules may change frame counts,
 * and only they trigger attribute propagation from their primary input.
 */
public interface ProcessingModule extends PipelineModule {

  @Override
  default ModuleKind kind() {
    return ModuleKind.PROCESSING;
  }
}
