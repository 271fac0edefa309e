package br.lncc.dfense.algorithms;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import br.lncc.dfense.helper.InvalidSeriesArgumentException;
import br.lncc.dfense.helper.InvalidSeriesArgumentException.Reason;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;

import org.junit.Test;

public class SplineResamplerTest {

  @Test
  public void testRefinedGridSize() {
    DoubleArrayList fine = new SplineResampler(0.5).refine(new double[] {1, 3, 2, 5, 4});
    assertEquals(9, fine.size());
    fine = new SplineResampler(0.25).refine(new double[] {1, 3, 2, 5, 4});
    assertEquals(17, fine.size());
  }

  @Test
  public void testKnotsAreKept() {
    double[] x = {1, 3, 2, 5, 4, 0, 7};
    DoubleArrayList fine = new SplineResampler(0.5).refine(x);
    for (int i = 0; i < x.length; i++) {
      assertEquals(x[i], fine.getDouble(2 * i), 1e-9);
    }
  }

  @Test
  public void testRoundTrip() {
    double[] x = {10, 12, 9, 15, 20, 18, 11, 8};
    assertArrayEquals(x, new SplineResampler().resample(x), 1e-9);
    assertArrayEquals(x, new SplineResampler(0.2).resample(x), 1e-9);
  }

  @Test
  public void testLinearDataStaysLinear() {
    double[] x = {1, 2, 3, 4, 5};
    DoubleArrayList fine = new SplineResampler(0.5).refine(x);
    for (int k = 0; k < fine.size(); k++) {
      assertEquals(1.0 + k * 0.5, fine.getDouble(k), 1e-9);
    }
  }

  @Test
  public void testShortSeries() {
    assertArrayEquals(new double[] {4}, new SplineResampler().resample(new double[] {4}), 0.0);

    DoubleArrayList fine = new SplineResampler(0.5).refine(new double[] {2, 6});
    assertEquals(3, fine.size());
    assertEquals(4.0, fine.getDouble(1), 1e-12);
    assertEquals(6.0, fine.getDouble(2), 0.0);
  }

  @Test
  public void testUnitStepIsIdentity() {
    double[] x = {3, 1, 4, 1, 5};
    assertArrayEquals(x, new SplineResampler(1.0).resample(x), 1e-12);
  }

  @Test
  public void testRejectsStep() {
    for (double step : new double[] {0.0, -0.5, 1.5, 0.3}) {
      try {
        new SplineResampler(step);
        fail("accepted step " + step);
      } catch (InvalidSeriesArgumentException e) {
        assertEquals(Reason.INVALID_SMOOTHING_CONFIG, e.getReason());
        assertTrue(e.getMessage().contains("step"));
      }
    }
  }
}
