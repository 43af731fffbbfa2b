package ca.gc.nrc.pyxis.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation for working, input and output directories.
 * <p><strong>Why:</strong> A pipeline writes its container and exported stacks into these directories; failing
 * early beats failing after hours of processing.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility; filesystem state may change between check and use.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates that {@code path} is (or can become) a writable directory.
   *
   * @param path directory to check
   * @param createIfMissing when {@code true}, missing directories are created
   * @return absolute normalized directory path
   * @throws IllegalArgumentException if the path contains control characters, is not a directory, is not
   *     writable, or cannot be created
   */
  public static Path validateWritableDir(Path path, boolean createIfMissing) {
    Path normalized = normalize(path);
    try {
      if (!Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        if (!createIfMissing) {
          throw new IllegalArgumentException("directory does not exist: " + normalized);
        }
        Files.createDirectories(normalized);
      }
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to create directory " + normalized + ": " + ex.getMessage(), ex);
    }
    if (!Files.isDirectory(normalized)) {
      throw new IllegalArgumentException("path is not a directory: " + normalized);
    }
    if (!Files.isWritable(normalized)) {
      throw new IllegalArgumentException("directory is not writable: " + normalized);
    }
    return normalized;
  }

  /**
   * Validates that {@code path} names an existing readable regular file.
   *
   * @param path file to check
   * @return absolute normalized file path
   * @throws IllegalArgumentException if the file is missing or unreadable
   */
  public static Path validateReadableFile(Path path) {
    Path normalized = normalize(path);
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException("file does not exist: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException("file is not readable: " + normalized);
    }
    return normalized;
  }

  private static Path normalize(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("path must not contain null bytes");
    }
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException("path must not contain control characters");
      }
    }
    return path.toAbsolutePath().normalize();
  }
}
