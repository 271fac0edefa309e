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

import br.lncc.dfense.helper.ArrayHelper;

/**
 * Smooths a denoised series in three steps:
 * <ol>
 *   <li>Savitzky-Golay filter of the configured window length and order;</li>
 *   <li>cubic spline resample round trip at the configured step;</li>
 *   <li>rounding to integers for count data, then clipping at zero.</li>
 * </ol>
 */
public final class SmoothingPipeline {
  public static final int DEFAULT_WINDOW_LENGTH = 11;
  public static final int DEFAULT_ORDER = 3;

  public static final class Args {
    /** Savitzky-Golay frame length, odd. */
    final int windowLength;

    /** Savitzky-Golay polynomial order, below the frame length. */
    final int order;

    /** Spline grid step, 1/k for an integer k. */
    final double resampleFactor;

    public Args() {
      this(DEFAULT_WINDOW_LENGTH, DEFAULT_ORDER, SplineResampler.DEFAULT_STEP);
    }

    public Args(int windowLength, int order) {
      this(windowLength, order, SplineResampler.DEFAULT_STEP);
    }

    public Args(int windowLength, int order, double resampleFactor) {
      SavitzkyGolayFilter.checkConfig(windowLength, order);
      SplineResampler.checkStep(resampleFactor);
      this.windowLength = windowLength;
      this.order = order;
      this.resampleFactor = resampleFactor;
    }

    public int getWindowLength() {
      return windowLength;
    }

    public int getOrder() {
      return order;
    }

    public double getResampleFactor() {
      return resampleFactor;
    }
  }

  private final Args args;
  private final SavitzkyGolayFilter filter;
  private final SplineResampler resampler;

  public SmoothingPipeline() {
    this(new Args());
  }

  public SmoothingPipeline(Args args) {
    this.args = args;
    this.filter = new SavitzkyGolayFilter(args.windowLength, args.order);
    this.resampler = new SplineResampler(args.resampleFactor);
  }

  public Args getArgs() {
    return args;
  }

  public static double[] smooth(double[] series, int windowLength, int order, double resampleFactor) {
    return new SmoothingPipeline(new Args(windowLength, order, resampleFactor)).smooth(series);
  }

  public static double[] smooth(double[] series, int windowLength, int order) {
    return smooth(series, windowLength, order, SplineResampler.DEFAULT_STEP);
  }

  /** Smooths a real valued series; the result is non-negative. */
  public double[] smooth(double[] series) {
    return smooth(series, false);
  }

  /**
   * Smooths a series.
   *
   * @param integerValued round the result to whole numbers, as for case counts
   * @return a new array of the same length, every value >= 0
   */
  public double[] smooth(double[] series, boolean integerValued) {
    double[] result = resampler.resample(filter.filter(series));
    if (integerValued) {
      ArrayHelper.roundHalfAwayFromZero(result);
    }
    return ArrayHelper.clipNegative(result);
  }
}
