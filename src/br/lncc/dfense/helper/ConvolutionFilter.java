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

package br.lncc.dfense.helper;

import static br.lncc.dfense.helper.InvalidSeriesArgumentException.Reason.INVALID_FILTER;

import com.google.common.primitives.Doubles;

import java.util.Arrays;

/**
 * An odd-length FIR smoother. Coefficients are rescaled to sum to one
 * and the series is padded with copies of its first and last samples, so the
 * output has the input length and a constant series is left unchanged.
 */
public class ConvolutionFilter {
  private final double[] coefficients;
  private final int half;

  /**
   * @param coefficients 2m + 1 weights with a non-zero sum
   */
  public ConvolutionFilter(double... coefficients) {
    InvalidSeriesArgumentException.check(coefficients != null && coefficients.length % 2 == 1,
        INVALID_FILTER, "filter length must be odd (2m+1)");
    double sum = 0.0;
    for (double c : coefficients) {
      sum += c;
    }
    InvalidSeriesArgumentException.check(sum != 0.0 && Doubles.isFinite(sum), INVALID_FILTER,
        "filter coefficients must have a finite non-zero sum, got %s", sum);

    this.coefficients = new double[coefficients.length];
    for (int i = 0; i < coefficients.length; i++) {
      this.coefficients[i] = coefficients[i] / sum;
    }
    this.half = coefficients.length / 2;
  }

  /** Moving average over 2m + 1 samples. */
  public static ConvolutionFilter movingAverage(int halfWidth) {
    InvalidSeriesArgumentException.check(halfWidth >= 0, INVALID_FILTER,
        "half width (%d) must not be negative", halfWidth);
    double[] ones = new double[2 * halfWidth + 1];
    Arrays.fill(ones, 1.0);
    return new ConvolutionFilter(ones);
  }

  public double[] getCoefficients() {
    return coefficients.clone();
  }

  public double[] apply(double[] series) {
    ArrayHelper.checkSeries(series);
    int n = series.length;
    double[] padded = new double[n + 2 * half];
    for (int i = 0; i < padded.length; i++) {
      padded[i] = series[Math.min(Math.max(i - half, 0), n - 1)];
    }

    // Full convolution flips the kernel; keep only the fully overlapping part.
    double[] result = new double[n];
    int last = coefficients.length - 1;
    for (int i = 0; i < n; i++) {
      double sum = 0.0;
      for (int k = 0; k <= last; k++) {
        sum += padded[i + k] * coefficients[last - k];
      }
      result[i] = sum;
    }
    return result;
  }
}
