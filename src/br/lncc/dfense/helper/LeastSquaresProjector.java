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

import com.google.common.base.Preconditions;

import org.ejml.data.DenseMatrix64F;
import org.ejml.factory.LinearSolverFactory;
import org.ejml.interfaces.linsol.LinearSolver;
import org.ejml.ops.CommonOps;

/**
 * A wrapper for OLS fitting of a fixed design matrix.
 *
 * <p>Given the design A (rows = observations, cols = features), builds the
 * projection ("hat") matrix P = A (A'A)^-1 A'. Row i of P holds the weights that
 * map the observations to the fitted value at observation i, so any number of
 * target vectors can be smoothed with a dot product and no further solves.
 */
public class LeastSquaresProjector {
  private final int numRows;
  private final int numCols;
  private final DenseMatrix64F matrixA;

  public LeastSquaresProjector(int numRows, int numCols) {
    Preconditions.checkArgument(numRows >= numCols && numCols >= 1,
        "need at least as many observations (%s) as features (%s)", numRows, numCols);
    this.numRows = numRows;
    this.numCols = numCols;
    this.matrixA = new DenseMatrix64F(numRows, numCols);
  }

  /**
   * A projector onto polynomials of the given order, sampled at the integer
   * offsets -half..half of a centred window of length numRows.
   */
  public static LeastSquaresProjector polynomial(int windowLength, int order) {
    LeastSquaresProjector projector = new LeastSquaresProjector(windowLength, order + 1);
    int half = windowLength / 2;
    for (int i = 0; i < windowLength; i++) {
      double offset = i - half;
      double power = 1.0;
      for (int j = 0; j <= order; j++) {
        projector.setObservation(i, j, power);
        power *= offset;
      }
    }
    return projector;
  }

  public void setObservation(int idx, int feature, double value) {
    matrixA.set(idx, feature, value);
  }

  public int getNumRows() {
    return numRows;
  }

  public int getNumCols() {
    return numCols;
  }

  /**
   * Computes the numRows x numRows projection matrix.
   *
   * @throws IllegalStateException if the design matrix is rank deficient
   */
  public DenseMatrix64F projection() {
    LinearSolver<DenseMatrix64F> solver = LinearSolverFactory.leastSquares(numRows, numCols);
    if (!solver.setA(matrixA.copy()) || solver.quality() == 0) {
      throw new IllegalStateException("design matrix is rank deficient");
    }

    // Solving A X = I column by column gives X = (A'A)^-1 A'.
    DenseMatrix64F pseudoInverse = new DenseMatrix64F(numCols, numRows);
    solver.solve(CommonOps.identity(numRows), pseudoInverse);

    DenseMatrix64F hat = new DenseMatrix64F(numRows, numRows);
    CommonOps.mult(matrixA, pseudoInverse, hat);
    return hat;
  }
}
