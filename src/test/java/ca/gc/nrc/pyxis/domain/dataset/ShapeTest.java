package ca.gc.nrc.pyxis.domain.dataset;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ShapeTest {

  @Test
  void ofFramesPrependsFrameAxis() {
    Shape shape = Shape.ofFrames(100, 64, 64);

    assertEquals(3, shape.rank());
    assertEquals(100, shape.frames());
    assertArrayEquals(new long[] {64, 64}, shape.frameDims());
    assertEquals(4096, shape.frameSize());
    assertEquals(409_600, shape.elementCount());
    assertEquals("64x64", shape.frameShapeText());
    assertEquals("[100, 64, 64]", shape.toString());
  }

  @Test
  void scalarFramesHaveUnitFrameSize() {
    Shape shape = Shape.of(5);

    assertEquals(1, shape.frameSize());
    assertEquals("", shape.frameShapeText());
    assertEquals(5, shape.elementCount());
  }

  @Test
  void zeroFramesAllowedButOtherAxesMustBePositive() {
    assertEquals(0, Shape.ofFrames(0, 3).elementCount());
    assertThrows(IllegalArgumentException.class, () -> Shape.of(-1, 3));
    assertThrows(IllegalArgumentException.class, () -> Shape.of(2, 0));
    assertThrows(IllegalArgumentException.class, () -> Shape.of());
  }

  @Test
  void withFramesKeepsFrameShape() {
    Shape shape = Shape.ofFrames(10, 4, 2);
    Shape resized = shape.withFrames(3);

    assertEquals(Shape.ofFrames(3, 4, 2), resized);
    assertTrue(shape.sameFrameShape(resized));
    assertFalse(shape.sameFrameShape(Shape.ofFrames(10, 2, 4)));
    assertFalse(shape.sameFrameShape(Shape.ofFrames(10, 8)));
  }

  @Test
  void parseFrameDimsReadsTimesSeparatedText() {
    assertArrayEquals(new long[] {64, 32}, Shape.parseFrameDims("64x32"));
    assertArrayEquals(new long[0], Shape.parseFrameDims(" "));
    assertThrows(IllegalArgumentException.class, () -> Shape.parseFrameDims("64xfoo"));
  }
}
