package ca.gc.nrc.pyxis.testutil;

import ca.gc.nrc.pyxis.domain.dataset.NdArray;
import ca.gc.nrc.pyxis.domain.dataset.Shape;

/**
 * Array fixtures.
 */
public final class TestArrays {

  private TestArrays() {}

  /**
   * Array whose element at flat index {@code i} equals {@code i}.
   *
   * @param frames frame count
   * @param frameDims frame dimensions
   * @return ramp array
   */
  public static NdArray ramp(long frames, long... frameDims) {
    Shape shape = Shape.ofFrames(frames, frameDims);
    double[] values = new double[Math.toIntExact(shape.elementCount())];
    for (int i = 0; i < values.length; i++) {
      values[i] = i;
    }
    return NdArray.wrap(shape, values);
  }

  /**
   * Array whose every pixel of frame {@code f} equals {@code f}.
   */
  public static NdArray frameIndexed(long frames, long... frameDims) {
    Shape shape = Shape.ofFrames(frames, frameDims);
    NdArray array = NdArray.zeros(shape);
    for (long f = 0; f < frames; f++) {
      for (int offset = 0; offset < array.frameSize(); offset++) {
        array.set(f, offset, f);
      }
    }
    return array;
  }
}
