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

package br.lncc.dfense.timeseries;

import static br.lncc.dfense.helper.InvalidSeriesArgumentException.Reason.INVALID_WINDOW;

import br.lncc.dfense.helper.ArrayHelper;
import br.lncc.dfense.helper.InvalidSeriesArgumentException;

import org.ejml.data.DenseMatrix64F;

/**
 * Sliding window (trajectory) embedding of a series into a Hankel matrix.
 *
 * <p>For a series x of length N and window w the matrix has N - w + 1 rows and
 * w columns, and row i is x[i], x[i+1], ..., x[i+w-1]. Entry (i, j) therefore
 * holds x[i+j], so each anti-diagonal repeats a single sample.
 */
public final class HankelEmbedding {
  private HankelEmbedding() {}

  /**
   * Builds the Hankel matrix of the series.
   *
   * @param series the samples, at least one
   * @param window the row length, 1 <= window <= series.length
   */
  public static DenseMatrix64F embed(double[] series, int window) {
    ArrayHelper.checkSeries(series);
    checkWindow(series.length, window);

    int numRows = series.length - window + 1;
    DenseMatrix64F hankel = new DenseMatrix64F(numRows, window);
    for (int i = 0; i < numRows; i++) {
      for (int j = 0; j < window; j++) {
        hankel.unsafe_set(i, j, series[i + j]);
      }
    }
    return hankel;
  }

  /** Rejects windows outside [1, length]. */
  public static void checkWindow(int length, int window) {
    InvalidSeriesArgumentException.check(window >= 1 && window <= length, INVALID_WINDOW,
        "window (%d) must be between 1 and the series length (%d)", window, length);
  }
}
