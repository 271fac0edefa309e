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

import org.ejml.data.DenseMatrix64F;
import org.ejml.factory.DecompositionFactory;
import org.ejml.interfaces.decomposition.SingularValueDecomposition;
import org.ejml.ops.CommonOps;
import org.ejml.ops.SingularOps;

/**
 * Compact singular value decomposition A = U W V' with the singular values
 * sorted from largest to smallest.
 *
 * <p>For an m x n matrix and p = min(m, n), U is m x p, W is p x p and V is
 * n x p.
 */
public class SpectralDecomposition {
  // left and right singular vectors, one per column
  private final DenseMatrix64F u;
  private final DenseMatrix64F v;
  // non-negative and non-increasing
  private final double[] singularValues;

  private SpectralDecomposition(DenseMatrix64F u, double[] singularValues, DenseMatrix64F v) {
    this.u = u;
    this.singularValues = singularValues;
    this.v = v;
  }

  /**
   * Decomposes the matrix, which is left untouched.
   *
   * @throws IllegalStateException if the decomposition does not converge
   */
  public static SpectralDecomposition of(DenseMatrix64F matrix) {
    SingularValueDecomposition<DenseMatrix64F> svd =
        DecompositionFactory.svd(matrix.numRows, matrix.numCols, true, true, true);
    if (!svd.decompose(matrix.copy())) {
      throw new IllegalStateException(
          String.format("SVD of a %dx%d matrix failed", matrix.numRows, matrix.numCols));
    }

    DenseMatrix64F u = svd.getU(null, false);
    DenseMatrix64F w = svd.getW(null);
    DenseMatrix64F v = svd.getV(null, false);
    SingularOps.descendingOrder(u, false, w, v, false);

    int rank = Math.min(w.numRows, w.numCols);
    double[] values = new double[rank];
    for (int i = 0; i < rank; i++) {
      values[i] = w.get(i, i);
    }
    return new SpectralDecomposition(u, values, v);
  }

  /** A copy of the singular values, largest first. */
  public double[] getSingularValues() {
    return singularValues.clone();
  }

  public double getSingularValue(int index) {
    return singularValues[index];
  }

  public int size() {
    return singularValues.length;
  }

  /** min(m, n) / max(m, n) of the decomposed matrix. */
  public double aspectRatio() {
    return SpectralThreshold.aspectRatio(u.numRows, v.numRows);
  }

  /**
   * Rebuilds U diag(s) V' keeping only the first rank singular triplets. A rank
   * of zero gives the zero matrix.
   */
  public DenseMatrix64F reconstruct(int rank) {
    int kept = Math.min(Math.max(rank, 0), singularValues.length);
    DenseMatrix64F scaled = new DenseMatrix64F(u.numRows, u.numCols);
    for (int i = 0; i < u.numRows; i++) {
      for (int j = 0; j < kept; j++) {
        scaled.unsafe_set(i, j, u.unsafe_get(i, j) * singularValues[j]);
      }
    }
    DenseMatrix64F result = new DenseMatrix64F(u.numRows, v.numRows);
    CommonOps.multTransB(scaled, v, result);
    return result;
  }
}
