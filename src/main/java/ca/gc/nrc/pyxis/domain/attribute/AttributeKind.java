package ca.gc.nrc.pyxis.domain.attribute;

import java.util.Locale;

/** Value kinds an attribute may carry. */
public enum AttributeKind {
  TEXT,
  INTEGER,
  REAL;

  /**
   * Parses a kind name, case-insensitively.
   *
   * @param raw kind name
   * @return parsed kind
   */
  public static AttributeKind fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("attribute kind must not be blank");
    }
    return AttributeKind.valueOf(raw.trim().toUpperCase(Locale.ROOT));
  }
}
