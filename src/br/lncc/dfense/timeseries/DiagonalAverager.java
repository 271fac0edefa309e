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

import br.lncc.dfense.helper.InvalidSeriesArgumentException;

import com.google.common.annotations.VisibleForTesting;

import org.ejml.data.DenseMatrix64F;

/**
 * Collapses a Hankel-shaped matrix back into a series by averaging each
 * anti-diagonal. This inverts {@link HankelEmbedding#embed} exactly for a true
 * Hankel matrix, and gives the least squares Hankel approximation otherwise.
 */
public final class DiagonalAverager {
  private DiagonalAverager() {}

  /**
   * @param matrix an (N - w + 1) x w matrix
   * @param length the series length N
   */
  public static double[] average(DenseMatrix64F matrix, int length) {
    int numRows = matrix.getNumRows();
    int numCols = matrix.getNumCols();
    InvalidSeriesArgumentException.check(numCols >= 1 && numRows + numCols - 1 == length,
        INVALID_WINDOW, "a %dx%d matrix does not embed a series of length %d",
        numRows, numCols, length);

    double[] sums = new double[length];
    for (int i = 0; i < numRows; i++) {
      for (int j = 0; j < numCols; j++) {
        sums[i + j] += matrix.unsafe_get(i, j);
      }
    }

    int[] counts = contributionCounts(length, numCols);
    for (int k = 0; k < length; k++) {
      sums[k] /= counts[k];
    }
    return sums;
  }

  /**
   * Number of matrix entries on the anti-diagonal of each series index, i.e.
   * min(k + 1, w, N - k, N - w + 1). These are the divisors of
   * {@link #average}.
   */
  @VisibleForTesting
  public static int[] contributionCounts(int length, int window) {
    HankelEmbedding.checkWindow(length, window);
    int numRows = length - window + 1;
    int[] counts = new int[length];
    for (int k = 0; k < length; k++) {
      counts[k] = Math.min(Math.min(k + 1, window), Math.min(length - k, numRows));
    }
    return counts;
  }
}
