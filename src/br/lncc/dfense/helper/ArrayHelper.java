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

import static br.lncc.dfense.helper.InvalidSeriesArgumentException.Reason.INVALID_SERIES;

import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.math.stat.descriptive.rank.Median;

/** Static array manipulation functions. */
public class ArrayHelper {
  private ArrayHelper() {}

  /** Rejects null or empty series. */
  public static void checkSeries(double[] series) {
    InvalidSeriesArgumentException.check(!ArrayUtils.isEmpty(series), INVALID_SERIES,
        "series must contain at least one value");
  }

  /**
   * Median of the values. For an even count this is the mean of the two middle
   * values.
   */
  public static double median(double[] values) {
    checkSeries(values);
    return new Median().evaluate(values);
  }

  /** Sets every negative entry, -0.0 included, to zero in place. Returns the same array. */
  public static double[] clipNegative(double[] values) {
    for (int i = 0; i < values.length; i++) {
      values[i] = Math.max(values[i], 0.0);
    }
    return values;
  }

  /**
   * Rounds every entry to the nearest integer, ties away from zero, in place.
   * Math.round() would send -2.5 to -2.
   */
  public static double[] roundHalfAwayFromZero(double[] values) {
    for (int i = 0; i < values.length; i++) {
      values[i] = Math.signum(values[i]) * Math.floor(Math.abs(values[i]) + 0.5);
    }
    return values;
  }

  /**
   * Returns a copy where every non-positive or non-finite entry is replaced by
   * half of the smallest positive finite entry. Used before taking logarithms
   * of counts.
   */
  public static double[] positiveFloor(double[] values) {
    checkSeries(values);
    double minPositive = Double.POSITIVE_INFINITY;
    for (double v : values) {
      if (v > 0.0 && !Double.isInfinite(v) && v < minPositive) {
        minPositive = v;
      }
    }
    InvalidSeriesArgumentException.check(minPositive != Double.POSITIVE_INFINITY,
        INVALID_SERIES, "series must contain at least one positive finite value");

    double halfMin = minPositive / 2.0;
    double[] result = values.clone();
    for (int i = 0; i < result.length; i++) {
      // NaN fails the comparison and is replaced too.
      if (!(result[i] > 0.0) || Double.isInfinite(result[i])) {
        result[i] = halfMin;
      }
    }
    return result;
  }

  /** Min-max normalization against scalar bounds: (x - min) / (max - min). */
  public static double[] normalize(double[] values, double min, double max) {
    checkSeries(values);
    InvalidSeriesArgumentException.check(max - min > 0.0, INVALID_SERIES,
        "max (%s) must exceed min (%s)", max, min);
    double[] result = new double[values.length];
    double range = max - min;
    for (int i = 0; i < values.length; i++) {
      result[i] = (values[i] - min) / range;
    }
    return result;
  }

  /** Element-wise min-max normalization, bounds given per sample. */
  public static double[] normalize(double[] values, double[] mins, double[] maxs) {
    checkSeries(values);
    InvalidSeriesArgumentException.check(
        mins != null && maxs != null && mins.length == values.length && maxs.length == values.length,
        INVALID_SERIES, "bounds must have the same length as the series (%d)", values.length);
    double[] result = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      double range = maxs[i] - mins[i];
      InvalidSeriesArgumentException.check(range > 0.0, INVALID_SERIES,
          "max must exceed min at index %d", i);
      result[i] = (values[i] - mins[i]) / range;
    }
    return result;
  }
}
