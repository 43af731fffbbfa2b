package ca.gc.nrc.pyxis.application.module;

import ca.gc.nrc.pyxis.application.port.DataStoragePort;
import ca.gc.nrc.pyxis.domain.error.PortBindingException;

/**
 * Read-only handle on a dataset a module consumes.
 *
 * @since 0.1.0
 */
public final class InputPort extends DatasetPort {

  private InputPort(String moduleName, String role, String tag, DataStoragePort storage) {
    super(moduleName, role, tag, storage);
  }

  /**
   * Binds an input to an existing dataset.
   *
   * @param moduleName owning module
   * @param role input role
   * @param tag dataset tag
   * @param storage central storage
   * @return bound port
   * @throws PortBindingException when the dataset does not exist
   */
  public static InputPort bind(String moduleName, String role, String tag, DataStoragePort storage) {
    if (!storage.hasDataset(tag)) {
      throw new PortBindingException(moduleName, role, tag);
    }
    return new InputPort(moduleName, role, tag, storage);
  }
}
