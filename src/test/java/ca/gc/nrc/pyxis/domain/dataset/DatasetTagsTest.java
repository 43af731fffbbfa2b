package ca.gc.nrc.pyxis.domain.dataset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class DatasetTagsTest {

  @Test
  void acceptsTagCharacterSet() {
    assertEquals("im_arr-1.flat", DatasetTags.requireValidTag("im_arr-1.flat"));
  }

  @Test
  void rejectsInvalidTags() {
    assertThrows(IllegalArgumentException.class, () -> DatasetTags.requireValidTag(" "));
    assertThrows(IllegalArgumentException.class, () -> DatasetTags.requireValidTag("a/b"));
    assertThrows(IllegalArgumentException.class, () -> DatasetTags.requireValidTag("x".repeat(129)));
  }

  @Test
  void rejectsDotPathTags() {
    assertThrows(IllegalArgumentException.class, () -> DatasetTags.requireValidTag("."));
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> DatasetTags.requireValidTag(".."));
    assertEquals("tag '..' is not a usable name", ex.getMessage());
    assertEquals("..flat", DatasetTags.requireValidTag("..flat"));
  }

  @Test
  void configTagIsReserved() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> DatasetTags.requireValidTag("config"));
    assertEquals("tag 'config' is reserved for pipeline settings", ex.getMessage());
    assertEquals("config", DatasetTags.requireValidName("module name", "config"));
  }
}
