package ca.gc.nrc.pyxis.domain.attribute;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class AttributeArrayTest {

  @Test
  void selectSubsetsInGivenOrder() {
    AttributeArray times = AttributeArray.reals(0, 10, 20, 30, 40);

    assertEquals(AttributeArray.reals(40, 0, 20), times.select(new int[] {4, 0, 2}));
    assertEquals(AttributeArray.texts("b"), AttributeArray.texts("a", "b").select(new int[] {1}));
    assertEquals(AttributeArray.integers(), AttributeArray.integers(1, 2).select(new int[0]));
  }

  @Test
  void concatRequiresSameKind() {
    assertEquals(AttributeArray.integers(1, 2, 3),
        AttributeArray.integers(1).concat(AttributeArray.integers(2, 3)));
    assertEquals(AttributeArray.texts("a", "b"), AttributeArray.texts("a").concat(AttributeArray.texts("b")));
    assertThrows(IllegalArgumentException.class,
        () -> AttributeArray.reals(1).concat(AttributeArray.integers(2)));
  }

  @Test
  void getReturnsStaticValue() {
    AttributeArray array = AttributeArray.integers(5, 6);

    assertEquals(2, array.length());
    assertEquals(AttributeKind.INTEGER, array.kind());
    assertEquals(AttributeValue.integer(6), array.get(1));
  }
}
