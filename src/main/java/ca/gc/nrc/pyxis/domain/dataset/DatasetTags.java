package ca.gc.nrc.pyxis.domain.dataset;

import java.util.regex.Pattern;

/**
 * Naming rules shared by dataset tags and module names.
 *
 * <p>Names are non-blank, at most {@value #MAX_LENGTH} characters of {@code [A-Za-z0-9._-]}, and never
 * {@code .} or {@code ..} since tags become storage paths. The tag {@value #RESERVED_CONFIG} is reserved for
 * the settings snapshot and cannot name a dataset.</p>
 *
 * @since 0.1.0
 */
public final class DatasetTags {
  /** Longest accepted name. */
  public static final int MAX_LENGTH = 128;
  /** Tag reserved for pipeline settings. */
  public static final String RESERVED_CONFIG = "config";

  private static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z0-9._-]+");

  private DatasetTags() {
    // Utility
  }

  /**
   * Validates a name against the shared character set and length.
   *
   * @param label what the name identifies, used in messages
   * @param name candidate name
   * @return the name unchanged
   * @throws IllegalArgumentException when the name is blank, too long, a dot path, or uses other characters
   */
  public static String requireValidName(String label, String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException(label + " must not be blank");
    }
    if (name.length() > MAX_LENGTH) {
      throw new IllegalArgumentException(label + " '" + name + "' exceeds " + MAX_LENGTH + " characters");
    }
    if (!NAME_PATTERN.matcher(name).matches()) {
      throw new IllegalArgumentException(
          label + " '" + name + "' must only contain letters, digits, dot, underscore, or hyphen");
    }
    if (".".equals(name) || "..".equals(name)) {
      throw new IllegalArgumentException(label + " '" + name + "' is not a usable name");
    }
    return name;
  }

  /**
   * Validates a dataset tag, rejecting the reserved settings tag.
   *
   * @param tag candidate tag
   * @return the tag unchanged
   * @throws IllegalArgumentException when the tag is invalid or reserved
   */
  public static String requireValidTag(String tag) {
    requireValidName("tag", tag);
    if (RESERVED_CONFIG.equals(tag)) {
      throw new IllegalArgumentException("tag '" + RESERVED_CONFIG + "' is reserved for pipeline settings");
    }
    return tag;
  }
}
