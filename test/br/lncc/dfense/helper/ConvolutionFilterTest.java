package br.lncc.dfense.helper;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import br.lncc.dfense.helper.InvalidSeriesArgumentException.Reason;

import org.junit.Test;

public class ConvolutionFilterTest {
  private static final double[] SERIES = {1, 2, 3, 4, 5};

  @Test
  public void testMovingAverage() {
    double[] y = ConvolutionFilter.movingAverage(1).apply(SERIES);
    assertArrayEquals(new double[] {4 / 3.0, 2, 3, 4, 14 / 3.0}, y, 1e-12);
  }

  @Test
  public void testKernelIsFlipped() {
    assertArrayEquals(new double[] {2, 3, 4, 5, 5},
        new ConvolutionFilter(1, 0, 0).apply(SERIES), 0.0);
    assertArrayEquals(new double[] {1, 1, 2, 3, 4},
        new ConvolutionFilter(0, 0, 1).apply(SERIES), 0.0);
  }

  @Test
  public void testCoefficientsNormalized() {
    assertArrayEquals(new double[] {0.25, 0.5, 0.25},
        new ConvolutionFilter(1, 2, 1).getCoefficients(), 0.0);
  }

  @Test
  public void testConstantPreserved() {
    double[] x = {6, 6, 6, 6};
    assertArrayEquals(x, new ConvolutionFilter(1, 3, 5, 3, 1).apply(x), 1e-12);
  }

  @Test
  public void testFilterLongerThanSeries() {
    double[] y = ConvolutionFilter.movingAverage(2).apply(new double[] {0, 10});
    // padded: 0 0 0 10 10 10
    assertArrayEquals(new double[] {4, 6}, y, 1e-12);
  }

  @Test
  public void testIdentity() {
    assertArrayEquals(SERIES, ConvolutionFilter.movingAverage(0).apply(SERIES), 0.0);
  }

  @Test
  public void testRejectsEvenLength() {
    assertRejected(new double[] {1, 1});
  }

  @Test
  public void testRejectsZeroSum() {
    assertRejected(new double[] {1, 0, -1});
  }

  @Test
  public void testRejectsNegativeHalfWidth() {
    try {
      ConvolutionFilter.movingAverage(-1);
      fail();
    } catch (InvalidSeriesArgumentException e) {
      assertEquals(Reason.INVALID_FILTER, e.getReason());
    }
  }

  private static void assertRejected(double[] coefficients) {
    try {
      new ConvolutionFilter(coefficients);
      fail();
    } catch (InvalidSeriesArgumentException e) {
      assertEquals(Reason.INVALID_FILTER, e.getReason());
    }
  }
}
