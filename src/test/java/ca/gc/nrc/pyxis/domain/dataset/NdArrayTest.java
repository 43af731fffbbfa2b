package ca.gc.nrc.pyxis.domain.dataset;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class NdArrayTest {

  @Test
  void ofCopiesValuesAndIndexesRowMajor() {
    double[] values = {0, 1, 2, 3, 4, 5};
    NdArray array = NdArray.of(Shape.ofFrames(3, 2), values);
    values[0] = 99;

    assertEquals(0, array.get(0, 0));
    assertEquals(3, array.get(1, 1));
    assertEquals(4, array.getFlat(4));
    assertArrayEquals(new double[] {4, 5}, array.frameValues(2));
  }

  @Test
  void rejectsValueCountMismatch() {
    assertThrows(IllegalArgumentException.class, () -> NdArray.of(Shape.ofFrames(2, 2), 1, 2, 3));
  }

  @Test
  void outOfRangeAccessFails() {
    NdArray array = NdArray.zeros(Shape.ofFrames(2, 2));

    assertThrows(IndexOutOfBoundsException.class, () -> array.get(2, 0));
    assertThrows(IndexOutOfBoundsException.class, () -> array.set(0, 2, 1));
  }

  @Test
  void framesAndSelectCopySubsets() {
    NdArray array = NdArray.of(Shape.ofFrames(4, 2), 0, 1, 10, 11, 20, 21, 30, 31);

    assertEquals(NdArray.of(Shape.ofFrames(2, 2), 10, 11, 20, 21), array.frames(new FrameRange(1, 3)));
    assertEquals(NdArray.of(Shape.ofFrames(2, 2), 30, 31, 0, 1), array.select(new int[] {3, 0}));
    assertEquals(NdArray.of(Shape.ofFrames(1, 2), 20, 21), array.frame(2));
  }

  @Test
  void concatJoinsAlongFrameAxis() {
    NdArray a = NdArray.of(Shape.ofFrames(1, 2), 1, 2);
    NdArray b = NdArray.of(Shape.ofFrames(2, 2), 3, 4, 5, 6);

    NdArray joined = NdArray.concat(List.of(a, b));

    assertEquals(Shape.ofFrames(3, 2), joined.shape());
    assertArrayEquals(new double[] {1, 2, 3, 4, 5, 6}, joined.toArray());
    assertThrows(IllegalArgumentException.class,
        () -> NdArray.concat(List.of(a, NdArray.zeros(Shape.ofFrames(1, 3)))));
  }

  @Test
  void mapReturnsTransformedCopy() {
    NdArray array = NdArray.of(Shape.of(3), 1, 2, 3);

    NdArray doubled = array.map(v -> v * 2);

    assertArrayEquals(new double[] {2, 4, 6}, doubled.toArray());
    assertArrayEquals(new double[] {1, 2, 3}, array.toArray());
  }
}
