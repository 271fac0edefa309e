/*
 * Copyright (c) 2024 DFENSE Project Authors.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */

package br.lncc.dfense.algorithms;

import static br.lncc.dfense.helper.InvalidSeriesArgumentException.Reason.INVALID_SMOOTHING_CONFIG;

import br.lncc.dfense.helper.ArrayHelper;
import br.lncc.dfense.helper.InvalidSeriesArgumentException;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;

import org.apache.commons.math.MathException;
import org.apache.commons.math.analysis.UnivariateRealFunction;
import org.apache.commons.math.analysis.interpolation.SplineInterpolator;

/**
 * Cubic spline round trip: interpolates the samples at times 1..N, evaluates
 * the spline on a grid refined by 1 / step, and keeps every (1 / step)-th
 * value so the result has N samples again.
 *
 * <p>The kept grid points are the knots, where the spline equals the data, so
 * the round trip only moves values by floating point noise.
 */
public class SplineResampler {
  public static final double DEFAULT_STEP = 0.5;

  private final double step;
  private final int stride;

  public SplineResampler() {
    this(DEFAULT_STEP);
  }

  public SplineResampler(double step) {
    this.stride = checkStep(step);
    this.step = step;
  }

  /** Returns 1 / step, rejecting steps that do not divide the unit interval. */
  static int checkStep(double step) {
    InvalidSeriesArgumentException.check(step > 0.0 && step <= 1.0, INVALID_SMOOTHING_CONFIG,
        "resample step (%s) must be in (0, 1]", step);
    long stride = Math.round(1.0 / step);
    InvalidSeriesArgumentException.check(Math.abs(stride * step - 1.0) < 1.0e-9,
        INVALID_SMOOTHING_CONFIG, "resample step (%s) must be 1/k for an integer k", step);
    return (int) stride;
  }

  public double getStep() {
    return step;
  }

  /** The spline values on the refined grid 1, 1 + step, ..., N. */
  public DoubleArrayList refine(double[] series) {
    ArrayHelper.checkSeries(series);
    int n = series.length;
    DoubleArrayList fine = new DoubleArrayList((n - 1) * stride + 1);
    if (n < 3) {
      // too few knots for a cubic spline; use the chord
      for (int k = 0; k <= (n - 1) * stride; k++) {
        int knot = Math.min(k / stride, n - 1);
        double frac = (double) (k - knot * stride) / stride;
        double next = knot + 1 < n ? series[knot + 1] : series[knot];
        fine.add(series[knot] + frac * (next - series[knot]));
      }
      return fine;
    }

    double[] knots = new double[n];
    for (int i = 0; i < n; i++) {
      knots[i] = i + 1;
    }
    try {
      UnivariateRealFunction spline = new SplineInterpolator().interpolate(knots, series);
      for (int k = 0; k <= (n - 1) * stride; k++) {
        // k / stride keeps the knots exact where k * step would drift
        fine.add(spline.value(Math.min(1.0 + (double) k / stride, n)));
      }
    } catch (MathException e) {
      throw new IllegalStateException("cubic spline evaluation failed", e);
    }
    return fine;
  }

  /** Refines the series and subsamples it back to its own length. */
  public double[] resample(double[] series) {
    DoubleArrayList fine = refine(series);
    double[] result = new double[series.length];
    for (int i = 0; i < result.length; i++) {
      result[i] = fine.getDouble(i * stride);
    }
    return result;
  }
}
