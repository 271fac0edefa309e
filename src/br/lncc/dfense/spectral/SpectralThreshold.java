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

package br.lncc.dfense.spectral;

import static br.lncc.dfense.helper.InvalidSeriesArgumentException.Reason.INVALID_ASPECT_RATIO;

import br.lncc.dfense.helper.ArrayHelper;
import br.lncc.dfense.helper.InvalidSeriesArgumentException;

/**
 * Optimal singular value hard threshold (SVHT) coefficients of Gavish and
 * Donoho.
 *
 * <p>For an m x n matrix Y = X + sigma Z, singular values of Y below
 * lambda(beta) sqrt(n) sigma are dropped when sigma is known. When sigma is
 * unknown the cutoff is omega(beta) times the median singular value of Y.
 */
public final class SpectralThreshold {
  private SpectralThreshold() {}

  /** min(m, n) / max(m, n). */
  public static double aspectRatio(int numRows, int numCols) {
    InvalidSeriesArgumentException.check(numRows >= 1 && numCols >= 1, INVALID_ASPECT_RATIO,
        "matrix shape %dx%d is empty", numRows, numCols);
    return (double) Math.min(numRows, numCols) / Math.max(numRows, numCols);
  }

  /**
   * lambda(beta) = sqrt(2 (beta + 1) + 8 beta / (beta + 1 + sqrt(beta^2 + 14 beta + 1))).
   * Equals 4 / sqrt(3) for a square matrix.
   */
  public static double knownNoiseCoefficient(double beta) {
    checkBeta(beta);
    double w = (8.0 * beta) / (beta + 1.0 + Math.sqrt(beta * beta + 14.0 * beta + 1.0));
    return Math.sqrt(2.0 * (beta + 1.0) + w);
  }

  /** omega(beta) = lambda(beta) / sqrt(median of Marchenko-Pastur(beta)). */
  public static double unknownNoiseCoefficient(double beta) {
    checkBeta(beta);
    double median = new MarchenkoPastur(beta).median();
    return knownNoiseCoefficient(beta) / Math.sqrt(median);
  }

  public static double coefficient(double beta, boolean sigmaKnown) {
    return sigmaKnown ? knownNoiseCoefficient(beta) : unknownNoiseCoefficient(beta);
  }

  /**
   * The cutoff for the given spectrum when the noise level is unknown:
   * omega(beta) times the median singular value.
   */
  public static double threshold(double beta, double[] singularValues) {
    return unknownNoiseCoefficient(beta) * ArrayHelper.median(singularValues);
  }

  private static void checkBeta(double beta) {
    InvalidSeriesArgumentException.check(beta > 0.0 && beta <= 1.0, INVALID_ASPECT_RATIO,
        "aspect ratio %s is outside (0, 1]", beta);
  }
}
