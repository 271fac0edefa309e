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
import br.lncc.dfense.helper.LeastSquaresProjector;

import org.ejml.data.DenseMatrix64F;

/**
 * Savitzky-Golay smoothing: every sample is replaced by the value at its
 * position of the least squares polynomial of a given order fitted to the
 * surrounding window.
 *
 * <p>Edges use the "interp" convention of MATLAB sgolayfilt and SciPy
 * savgol_filter. The first windowLength / 2 outputs come from the polynomial
 * fitted to the first windowLength samples, evaluated at their own positions;
 * the last windowLength / 2 outputs likewise from the last window. No padding
 * is involved, so polynomials of degree up to the order pass through
 * unchanged, edges included.
 */
public class SavitzkyGolayFilter {
  private final int windowLength;
  private final int order;
  // row k holds the weights giving the fit at offset k of the window
  private final DenseMatrix64F weights;

  public SavitzkyGolayFilter(int windowLength, int order) {
    checkConfig(windowLength, order);
    this.windowLength = windowLength;
    this.order = order;
    this.weights = LeastSquaresProjector.polynomial(windowLength, order).projection();
  }

  static void checkConfig(int windowLength, int order) {
    InvalidSeriesArgumentException.check(windowLength >= 1 && windowLength % 2 == 1,
        INVALID_SMOOTHING_CONFIG, "window length (%d) must be a positive odd number", windowLength);
    InvalidSeriesArgumentException.check(order >= 0 && order < windowLength,
        INVALID_SMOOTHING_CONFIG, "polynomial order (%d) must be in [0, %d)", order, windowLength);
  }

  public int getWindowLength() {
    return windowLength;
  }

  public int getOrder() {
    return order;
  }

  /** The convolution weights applied away from the edges. */
  public double[] centerCoefficients() {
    double[] coefficients = new double[windowLength];
    int half = windowLength / 2;
    for (int k = 0; k < windowLength; k++) {
      coefficients[k] = weights.get(half, k);
    }
    return coefficients;
  }

  /**
   * Returns the smoothed series, same length as the input.
   *
   * @throws InvalidSeriesArgumentException if the series is shorter than the window
   */
  public double[] filter(double[] series) {
    ArrayHelper.checkSeries(series);
    int n = series.length;
    InvalidSeriesArgumentException.check(windowLength <= n, INVALID_SMOOTHING_CONFIG,
        "window length (%d) exceeds the series length (%d)", windowLength, n);

    int half = windowLength / 2;
    double[] result = new double[n];

    for (int i = half; i < n - half; i++) {
      result[i] = apply(half, series, i - half);
    }
    for (int i = 0; i < half; i++) {
      result[i] = apply(i, series, 0);
    }
    int lastStart = n - windowLength;
    for (int i = n - half; i < n; i++) {
      result[i] = apply(i - lastStart, series, lastStart);
    }
    return result;
  }

  private double apply(int row, double[] series, int start) {
    double sum = 0.0;
    for (int k = 0; k < windowLength; k++) {
      sum += weights.unsafe_get(row, k) * series[start + k];
    }
    return sum;
  }
}
